package dev.fumaz.unbox.function;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Invokes a callable with its fully resolved, positional arguments.
 *
 * @param <R> the return type
 */
@FunctionalInterface
public interface Invoker<R> {

    @Nullable R invoke(@NotNull Object[] arguments) throws Exception;

}
