package dev.fumaz.unbox.box;

import dev.fumaz.unbox.container.ComponentLookup;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A {@link BoxedReference} is a {@link BoxedValue} that fetches a named component when unboxed.
 *
 * @param <T> the type of the referenced component
 */
public class BoxedReference<T> implements BoxedValue<T> {

    private final @NotNull ComponentLookup lookup;
    private final @NotNull String name;

    public BoxedReference(@NotNull ComponentLookup lookup, @NotNull String name) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    @SuppressWarnings("unchecked")
    public @Nullable T unbox() {
        return (T) lookup.get(name);
    }

    public @NotNull String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "ref(" + name + ")";
    }
}
