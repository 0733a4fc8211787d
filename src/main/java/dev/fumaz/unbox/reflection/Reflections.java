package dev.fumaz.unbox.reflection;

import dev.fumaz.unbox.annotation.Inject;
import dev.fumaz.unbox.annotation.Invoke;
import dev.fumaz.unbox.exception.ProvisionException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.*;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@SuppressWarnings({"unchecked"})
public final class Reflections {

    private Reflections() {
        throw new UnsupportedOperationException("This class cannot be instantiated");
    }

    /**
     * Loads a class by name without initializing it, or returns {@code null} if no such class exists.
     */
    public static @Nullable Class<?> findClass(@NotNull String name, @NotNull ClassLoader classLoader) {
        try {
            return Class.forName(name, false, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            return null;
        }
    }

    public static boolean isInstantiable(@NotNull Class<?> type) {
        return !type.isInterface()
                && !type.isPrimitive()
                && !type.isArray()
                && !type.isEnum()
                && !type.isAnnotation()
                && !Modifier.isAbstract(type.getModifiers());
    }

    /**
     * Picks the constructor used to create instances of the given type: the one annotated with {@link Inject}, else
     * the no-argument constructor, else the only declared constructor.
     */
    public static <T> @NotNull Constructor<T> selectConstructor(@NotNull Class<T> type) {
        Constructor<?>[] declaredConstructors = type.getDeclaredConstructors();
        Constructor<?> injectable = null;
        Constructor<?> zeroArg = null;

        for (Constructor<?> constructor : declaredConstructors) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                if (injectable != null) {
                    throw new IllegalArgumentException("Multiple injectable constructors found for type " + type.getName());
                }

                injectable = constructor;
            }

            if (constructor.getParameterCount() == 0) {
                zeroArg = constructor;
            }
        }

        Constructor<?> selected = injectable;

        if (selected == null) {
            if (zeroArg != null) {
                selected = zeroArg;
            } else if (declaredConstructors.length == 1) {
                selected = declaredConstructors[0];
            }
        }

        if (selected == null) {
            throw new IllegalArgumentException("No suitable constructor found for " + type.getName()
                    + "; annotate one with @Inject");
        }

        return (Constructor<T>) selected;
    }

    public static <T> T construct(@NotNull Constructor<T> constructor, @NotNull Object[] arguments) {
        try {
            constructor.setAccessible(true);
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            throw rethrow("Exception whilst constructing " + constructor.getDeclaringClass().getName(), e);
        } catch (InstantiationException e) {
            throw new IllegalArgumentException("unable to create instance of abstract class: "
                    + constructor.getDeclaringClass().getName(), e);
        } catch (IllegalAccessException e) {
            throw new ReflectionException("Exception whilst instantiating the object", e);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Resolved arguments " + Arrays.toString(arguments)
                    + " do not match " + constructor, e);
        }
    }

    public static Object invokeMethod(@Nullable Object instance, @NotNull Method method, @NotNull Object[] arguments) {
        try {
            method.setAccessible(true);
            return method.invoke(instance, arguments);
        } catch (InvocationTargetException e) {
            throw rethrow("Exception whilst invoking " + method.getName(), e);
        } catch (IllegalAccessException e) {
            throw new ReflectionException("Exception whilst invoking the method", e);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Resolved arguments " + Arrays.toString(arguments)
                    + " do not match " + method, e);
        }
    }

    /**
     * Finds the single method with the given name, searching public methods first and then the methods declared
     * along the class hierarchy.
     *
     * @throws IllegalArgumentException if there is no such method, or more than one
     */
    public static @NotNull Method getMethod(@NotNull Class<?> clazz, @NotNull String name, boolean requireStatic) {
        List<Method> candidates = filter(Arrays.asList(clazz.getMethods()), name, requireStatic);

        if (candidates.isEmpty()) {
            List<Method> declared = new ArrayList<>();

            for (Class<?> current = clazz; current != null; current = current.getSuperclass()) {
                declared.addAll(Arrays.asList(current.getDeclaredMethods()));
            }

            candidates = filter(declared, name, requireStatic);
        }

        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("expected callable: " + clazz.getName() + "::" + name
                    + (requireStatic ? " is not a static method" : " does not exist"));
        }

        if (candidates.size() > 1) {
            throw new IllegalArgumentException("ambiguous callable: " + clazz.getName() + "::" + name
                    + " is overloaded");
        }

        return candidates.get(0);
    }

    /**
     * Finds the method annotated with {@link Invoke} on the given class.
     *
     * @throws IllegalArgumentException if the class declares none, or more than one
     */
    public static @NotNull Method getInvokeMethod(@NotNull Class<?> clazz) {
        Method found = null;

        for (Class<?> current = clazz; current != null; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                if (!method.isAnnotationPresent(Invoke.class) || method.isBridge()) {
                    continue;
                }

                if (found != null && !overrides(found, method)) {
                    throw new IllegalArgumentException("class " + clazz.getName()
                            + " declares more than one @Invoke method");
                }

                if (found == null) {
                    found = method;
                }
            }
        }

        if (found == null || Modifier.isStatic(found.getModifiers())) {
            throw new IllegalArgumentException("class " + clazz.getName() + " does not declare an @Invoke method");
        }

        return found;
    }

    public static @Nullable Object defaultValue(@NotNull Class<?> type) {
        if (!type.isPrimitive()) {
            return null;
        }

        if (type == boolean.class) {
            return false;
        } else if (type == char.class) {
            return '\0';
        } else if (type == byte.class) {
            return (byte) 0;
        } else if (type == short.class) {
            return (short) 0;
        } else if (type == int.class) {
            return 0;
        } else if (type == long.class) {
            return 0L;
        } else if (type == float.class) {
            return 0F;
        } else if (type == double.class) {
            return 0D;
        }

        return null;
    }

    private static List<Method> filter(List<Method> methods, String name, boolean requireStatic) {
        Map<String, Method> bySignature = new LinkedHashMap<>();

        for (Method method : methods) {
            if (!method.getName().equals(name) || method.isBridge() || method.isSynthetic()) {
                continue;
            }

            if (requireStatic != Modifier.isStatic(method.getModifiers())) {
                continue;
            }

            // subclasses come first, so an override shadows the method it overrides
            bySignature.putIfAbsent(Arrays.toString(method.getParameterTypes()), method);
        }

        return new ArrayList<>(bySignature.values());
    }

    private static boolean overrides(Method subclassMethod, Method superclassMethod) {
        return subclassMethod.getName().equals(superclassMethod.getName())
                && Arrays.equals(subclassMethod.getParameterTypes(), superclassMethod.getParameterTypes());
    }

    private static RuntimeException rethrow(String message, InvocationTargetException e) {
        Throwable cause = e.getTargetException() != null ? e.getTargetException() : e;

        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }

        if (cause instanceof Error) {
            throw (Error) cause;
        }

        return new ProvisionException(message, cause);
    }

}
