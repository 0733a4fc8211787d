package dev.fumaz.unbox.util;

import dev.fumaz.unbox.annotation.Inject;
import dev.fumaz.unbox.annotation.Named;

import java.lang.annotation.Annotation;
import java.lang.reflect.Parameter;

public final class InjectionUtils {

    private InjectionUtils() {
    }

    public static boolean isOptional(Annotation[] annotations) {
        if (annotations == null) {
            return false;
        }

        for (Annotation annotation : annotations) {
            if (annotation instanceof Inject) {
                return ((Inject) annotation).optional();
            }
        }

        return false;
    }

    public static String resolveName(Parameter parameter) {
        Named named = parameter.getAnnotation(Named.class);

        if (named == null) {
            return parameter.getName();
        }

        if (named.value().isEmpty()) {
            throw new IllegalStateException("@Named on parameter " + parameter.getName() + " of "
                    + parameter.getDeclaringExecutable() + " must not be empty");
        }

        return named.value();
    }
}
