package dev.fumaz.unbox.reflection;

import dev.fumaz.unbox.util.InjectionUtils;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Describes parameters using {@link java.lang.reflect}.
 * <p>
 * Parameter names come from {@link dev.fumaz.unbox.annotation.Named} when present, otherwise from the class file,
 * which requires the declaring class to be compiled with {@code -parameters}. Parameters declared as {@link Object}
 * are reported without a type name. Parameters annotated with {@code @Inject(optional = true)} default to
 * {@code null}, or to zero for primitives.
 */
public final class ReflectiveIntrospector implements ParameterIntrospector {

    private final ConcurrentMap<Executable, List<ParameterDescriptor>> descriptors = new ConcurrentHashMap<>();

    @Override
    public @NotNull List<ParameterDescriptor> describe(@NotNull Executable executable) {
        return descriptors.computeIfAbsent(executable, ReflectiveIntrospector::createDescriptors);
    }

    @Override
    public @NotNull String locate(@NotNull Executable executable) {
        String member = executable instanceof Constructor ? "<init>" : executable.getName();
        StringJoiner joiner = new StringJoiner(", ", "(", ")");

        for (Class<?> type : executable.getParameterTypes()) {
            joiner.add(type.getSimpleName());
        }

        return executable.getDeclaringClass().getName() + "." + member + joiner;
    }

    private static List<ParameterDescriptor> createDescriptors(Executable executable) {
        Parameter[] parameters = executable.getParameters();

        if (parameters.length == 0) {
            return Collections.emptyList();
        }

        List<ParameterDescriptor> result = new ArrayList<>(parameters.length);

        for (Parameter parameter : parameters) {
            Class<?> type = parameter.getType();
            String name = InjectionUtils.resolveName(parameter);
            String typeName = type == Object.class ? null : type.getName();

            if (InjectionUtils.isOptional(parameter.getAnnotations())) {
                result.add(ParameterDescriptor.optional(name, typeName, Reflections.defaultValue(type)));
            } else {
                result.add(ParameterDescriptor.required(name, typeName));
            }
        }

        return Collections.unmodifiableList(result);
    }
}
