package dev.fumaz.unbox.resolve;

import dev.fumaz.unbox.box.BoxedValue;
import dev.fumaz.unbox.container.ComponentLookup;
import dev.fumaz.unbox.exception.ResolutionException;
import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.reflection.ParameterDescriptor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Turns a parameter list and a {@link ParameterMap} into positional arguments.
 * <p>
 * Each parameter is resolved by the first of these that applies:
 * <ol>
 *     <li>an override keyed by the parameter's name</li>
 *     <li>an override keyed by the parameter's index</li>
 *     <li>a component registered under the parameter's declared type name</li>
 *     <li>a component registered under the parameter's name</li>
 *     <li>the parameter's default value, if it is optional</li>
 * </ol>
 * Otherwise a {@link ResolutionException} is thrown. Whichever value is selected is unboxed if it is a
 * {@link BoxedValue}. Component lookups go through {@link ComponentLookup#get(String)}, so they may activate the
 * component.
 */
public final class ArgumentResolver {

    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final @NotNull ComponentLookup lookup;

    public ArgumentResolver(@NotNull ComponentLookup lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    public @NotNull Object[] resolve(@NotNull Injectable<?> injectable, @NotNull ParameterMap map) {
        return resolve(injectable.getParameters(), map, injectable.getLocation());
    }

    public @NotNull Object[] resolve(@NotNull List<ParameterDescriptor> parameters, @NotNull ParameterMap map,
                                     @NotNull String location) {
        if (parameters.isEmpty()) {
            return NO_ARGUMENTS;
        }

        Object[] arguments = new Object[parameters.size()];

        for (int index = 0; index < arguments.length; index++) {
            arguments[index] = unbox(select(parameters.get(index), index, map, location));
        }

        return arguments;
    }

    private @Nullable Object select(ParameterDescriptor parameter, int index, ParameterMap map, String location) {
        String name = parameter.getName();

        if (map.has(name)) {
            return map.get(name);
        }

        if (map.has(index)) {
            return map.get(index);
        }

        String typeName = parameter.getTypeName();

        if (typeName != null && lookup.has(typeName)) {
            return lookup.get(typeName);
        }

        if (lookup.has(name)) {
            return lookup.get(name);
        }

        if (parameter.isOptional()) {
            return parameter.getDefaultValue();
        }

        throw new ResolutionException(name, typeName, location);
    }

    private static @Nullable Object unbox(@Nullable Object value) {
        if (value instanceof BoxedValue) {
            return ((BoxedValue<?>) value).unbox();
        }

        return value;
    }
}
