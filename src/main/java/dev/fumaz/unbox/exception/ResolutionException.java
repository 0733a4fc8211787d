package dev.fumaz.unbox.exception;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Signals that a parameter could not be satisfied by an override, a registered component or a default value.
 */
public class ResolutionException extends UnboxException {

    private final @Nullable String parameterName;
    private final @Nullable String typeName;
    private final @Nullable String location;

    public ResolutionException(@NotNull String parameterName, @Nullable String typeName, @NotNull String location) {
        super("unable to resolve \"" + (typeName == null ? "" : typeName) + "\" for parameter: "
                + parameterName + " in " + location);
        this.parameterName = parameterName;
        this.typeName = typeName;
        this.location = location;
    }

    protected ResolutionException(@NotNull String message) {
        super(message);
        this.parameterName = null;
        this.typeName = null;
        this.location = null;
    }

    public @Nullable String getParameterName() {
        return parameterName;
    }

    public @Nullable String getTypeName() {
        return typeName;
    }

    public @Nullable String getLocation() {
        return location;
    }
}
