package dev.fumaz.unbox.container;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Looks up components by name.
 */
public interface ComponentLookup {

    /**
     * Returns the component registered under the given name, building it on first use.
     *
     * @throws dev.fumaz.unbox.exception.NotFoundException if the name is unknown
     * @throws dev.fumaz.unbox.exception.ResolutionException if the factory's arguments cannot be resolved
     */
    @Nullable Object get(@NotNull String name);

    default <T> @Nullable T get(@NotNull Class<T> type) {
        return type.cast(get(type.getName()));
    }

    boolean has(@NotNull String name);

    default boolean has(@NotNull Class<?> type) {
        return has(type.getName());
    }

    boolean isActive(@NotNull String name);

}
