package dev.fumaz.unbox.bind;

import dev.fumaz.unbox.exception.LifecycleException;
import dev.fumaz.unbox.exception.NotFoundException;
import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.resolve.ParameterMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Holds the lifecycle state, factory, value and pending configuration of every component name.
 * <p>
 * A component is <em>active</em> while a value is stored for it, however the value got there. It is
 * <em>sealed</em> once it has been handed out by the container; a sealed component can no longer be re-registered
 * or overwritten. The registry is not thread-safe on its own.
 */
public final class ComponentRegistry {

    private final Map<String, ComponentRecord> records = new LinkedHashMap<>();

    public boolean exists(@NotNull String name) {
        ComponentRecord record = records.get(name);
        return record != null && record.getState() != ComponentState.UNREGISTERED;
    }

    public boolean isActive(@NotNull String name) {
        ComponentRecord record = records.get(name);
        return record != null && record.hasValue();
    }

    public boolean isSealed(@NotNull String name) {
        ComponentRecord record = records.get(name);
        return record != null && record.isSealed();
    }

    public boolean hasFactory(@NotNull String name) {
        ComponentRecord record = records.get(name);
        return record != null && record.getFactory() != null;
    }

    public @NotNull ComponentState getState(@NotNull String name) {
        ComponentRecord record = records.get(name);
        return record == null ? ComponentState.UNREGISTERED : record.getState();
    }

    public @Nullable Object getValue(@NotNull String name) {
        ComponentRecord record = records.get(name);

        if (record == null || !record.hasValue()) {
            throw new NotFoundException(name);
        }

        return record.getValue();
    }

    public @NotNull Injectable<?> getFactory(@NotNull String name) {
        ComponentRecord record = records.get(name);

        if (record == null || record.getFactory() == null) {
            throw new NotFoundException(name);
        }

        return record.getFactory();
    }

    public @NotNull ParameterMap getFactoryMap(@NotNull String name) {
        ComponentRecord record = records.get(name);
        return record == null ? ParameterMap.empty() : record.getFactoryMap();
    }

    /**
     * Stores a value. A registered factory is kept, but is no longer consulted while the value is present.
     */
    public void putValue(@NotNull String name, @Nullable Object value) {
        record(name).setValue(value);
    }

    public void removeValue(@NotNull String name) {
        ComponentRecord record = records.get(name);

        if (record != null) {
            record.clearValue();
        }
    }

    /**
     * Registers a factory, discarding any value stored directly under the same name.
     *
     * @throws LifecycleException if the component is sealed
     */
    public void putFactory(@NotNull String name, @NotNull Injectable<?> factory, @NotNull ParameterMap map) {
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(map, "map");

        if (isSealed(name)) {
            throw new LifecycleException(name, "attempted re-registration of active component: " + name);
        }

        ComponentRecord record = record(name);
        record.setFactory(factory, map);
        record.clearValue();
    }

    public void seal(@NotNull String name) {
        record(name).seal();
    }

    /**
     * Appends a configuration entry for later application.
     *
     * @throws NotFoundException if no factory is registered under the name
     */
    public void queueConfiguration(@NotNull String name, @NotNull ConfigurationEntry entry) {
        ComponentRecord record = records.get(name);

        if (record == null || record.getFactory() == null) {
            throw new NotFoundException(name);
        }

        record.queue(Objects.requireNonNull(entry, "entry"));
    }

    /**
     * Removes and returns the pending configuration entries of a component, in the order they were queued.
     */
    public @NotNull List<ConfigurationEntry> drainConfigurations(@NotNull String name) {
        ComponentRecord record = records.get(name);
        return record == null ? Collections.emptyList() : record.drain();
    }

    /**
     * Puts configuration entries back at the front of the queue, ahead of anything queued since they were drained.
     */
    public void requeueConfigurations(@NotNull String name, @NotNull List<ConfigurationEntry> entries) {
        if (!entries.isEmpty()) {
            record(name).requeue(entries);
        }
    }

    public int pendingConfigurations(@NotNull String name) {
        ComponentRecord record = records.get(name);
        return record == null ? 0 : record.pendingCount();
    }

    public @NotNull Set<String> names() {
        Set<String> names = new LinkedHashSet<>();

        for (Map.Entry<String, ComponentRecord> entry : records.entrySet()) {
            if (entry.getValue().getState() != ComponentState.UNREGISTERED) {
                names.add(entry.getKey());
            }
        }

        return Collections.unmodifiableSet(names);
    }

    private ComponentRecord record(String name) {
        return records.computeIfAbsent(Objects.requireNonNull(name, "name"), ignored -> new ComponentRecord());
    }
}
