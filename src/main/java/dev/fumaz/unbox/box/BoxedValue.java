package dev.fumaz.unbox.box;

import org.jetbrains.annotations.Nullable;

/**
 * A {@link BoxedValue} defers the computation of an argument until the slot it occupies is resolved.
 * <p>
 * Boxed values may be placed in a {@link dev.fumaz.unbox.resolve.ParameterMap}; they are unwrapped exactly once,
 * when the parameter they are bound to is resolved, and never when the map is built.
 *
 * @param <T> the type of the boxed value
 */
@FunctionalInterface
public interface BoxedValue<T> {

    @Nullable T unbox();

}
