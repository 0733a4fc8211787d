package dev.fumaz.unbox.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a component name has neither a stored value nor a registered factory.
 */
public class NotFoundException extends UnboxException {

    private final @NotNull String name;

    public NotFoundException(@NotNull String name) {
        super("undefined component: " + name);
        this.name = name;
    }

    public @NotNull String getName() {
        return name;
    }
}
