package dev.fumaz.unbox.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a component that has already been activated is re-registered or overwritten.
 */
public class LifecycleException extends UnboxException {

    private final @NotNull String name;

    public LifecycleException(@NotNull String name, @NotNull String message) {
        super(message);
        this.name = name;
    }

    public @NotNull String getName() {
        return name;
    }
}
