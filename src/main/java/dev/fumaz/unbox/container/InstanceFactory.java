package dev.fumaz.unbox.container;

import dev.fumaz.unbox.resolve.ParameterMap;
import org.jetbrains.annotations.NotNull;

/**
 * Creates new instances of classes, resolving their constructor arguments.
 */
public interface InstanceFactory {

    /**
     * @throws IllegalArgumentException if the class does not exist or cannot be instantiated
     */
    @NotNull Object create(@NotNull String typeName, @NotNull ParameterMap map);

    <T> @NotNull T create(@NotNull Class<T> type, @NotNull ParameterMap map);

    default @NotNull Object create(@NotNull String typeName) {
        return create(typeName, ParameterMap.empty());
    }

    default <T> @NotNull T create(@NotNull Class<T> type) {
        return create(type, ParameterMap.empty());
    }

}
