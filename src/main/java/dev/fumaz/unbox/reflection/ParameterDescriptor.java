package dev.fumaz.unbox.reflection;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Describes one parameter of a callable: its name, the name of its declared type (if any), and whether it may fall
 * back to a default value.
 * <p>
 * The declared type is kept as a name only, so that describing a parameter never requires the type itself to be
 * loaded or registered.
 */
public final class ParameterDescriptor {

    private final @NotNull String name;
    private final @Nullable String typeName;
    private final boolean optional;
    private final @Nullable Object defaultValue;

    private ParameterDescriptor(@NotNull String name, @Nullable String typeName, boolean optional,
                                @Nullable Object defaultValue) {
        this.name = Objects.requireNonNull(name, "name");
        this.typeName = typeName == null || typeName.isEmpty() ? null : typeName;
        this.optional = optional;
        this.defaultValue = defaultValue;
    }

    public static @NotNull ParameterDescriptor required(@NotNull String name) {
        return new ParameterDescriptor(name, null, false, null);
    }

    public static @NotNull ParameterDescriptor required(@NotNull String name, @Nullable String typeName) {
        return new ParameterDescriptor(name, typeName, false, null);
    }

    public static @NotNull ParameterDescriptor optional(@NotNull String name, @Nullable String typeName,
                                                        @Nullable Object defaultValue) {
        return new ParameterDescriptor(name, typeName, true, defaultValue);
    }

    public @NotNull String getName() {
        return name;
    }

    public @Nullable String getTypeName() {
        return typeName;
    }

    public boolean isOptional() {
        return optional;
    }

    public @Nullable Object getDefaultValue() {
        return defaultValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof ParameterDescriptor)) {
            return false;
        }

        ParameterDescriptor that = (ParameterDescriptor) o;
        return optional == that.optional
                && name.equals(that.name)
                && Objects.equals(typeName, that.typeName)
                && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, typeName, optional, defaultValue);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();

        if (typeName != null) {
            builder.append(typeName).append(' ');
        }

        builder.append(name);

        if (optional) {
            builder.append(" = ").append(defaultValue);
        }

        return builder.toString();
    }
}
