package dev.fumaz.unbox.module;

import dev.fumaz.unbox.container.Container;
import org.jetbrains.annotations.NotNull;

/**
 * A {@link Module} is a packaged set of registrations and configuration functions.
 */
@FunctionalInterface
public interface Module {

    void register(@NotNull Container container);

}
