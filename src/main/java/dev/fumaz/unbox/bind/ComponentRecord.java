package dev.fumaz.unbox.bind;

import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.resolve.ParameterMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything the registry knows about one component name.
 */
final class ComponentRecord {

    private @Nullable Injectable<?> factory;
    private @NotNull ParameterMap factoryMap = ParameterMap.empty();
    private @Nullable Object value;
    private boolean hasValue;
    private boolean sealed;
    private final List<ConfigurationEntry> pendingConfigurations = new ArrayList<>();

    @NotNull ComponentState getState() {
        if (hasValue) {
            return ComponentState.ACTIVE;
        }

        return factory != null ? ComponentState.REGISTERED : ComponentState.UNREGISTERED;
    }

    @Nullable Injectable<?> getFactory() {
        return factory;
    }

    @NotNull ParameterMap getFactoryMap() {
        return factoryMap;
    }

    void setFactory(@NotNull Injectable<?> factory, @NotNull ParameterMap factoryMap) {
        this.factory = factory;
        this.factoryMap = factoryMap;
    }

    boolean hasValue() {
        return hasValue;
    }

    @Nullable Object getValue() {
        return value;
    }

    void setValue(@Nullable Object value) {
        this.value = value;
        this.hasValue = true;
    }

    void clearValue() {
        this.value = null;
        this.hasValue = false;
    }

    boolean isSealed() {
        return sealed;
    }

    void seal() {
        this.sealed = true;
    }

    void queue(@NotNull ConfigurationEntry entry) {
        pendingConfigurations.add(entry);
    }

    @NotNull List<ConfigurationEntry> drain() {
        if (pendingConfigurations.isEmpty()) {
            return Collections.emptyList();
        }

        List<ConfigurationEntry> drained = new ArrayList<>(pendingConfigurations);
        pendingConfigurations.clear();
        return drained;
    }

    void requeue(@NotNull List<ConfigurationEntry> entries) {
        pendingConfigurations.addAll(0, entries);
    }

    int pendingCount() {
        return pendingConfigurations.size();
    }
}
