package dev.fumaz.unbox.function;

import dev.fumaz.unbox.exception.ProvisionException;
import dev.fumaz.unbox.reflection.ParameterDescriptor;
import dev.fumaz.unbox.reflection.ParameterIntrospector;
import dev.fumaz.unbox.reflection.Reflections;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An {@link Injectable} is a callable whose parameters are described up front, so that the container can resolve
 * its arguments before invoking it.
 * <p>
 * Factories, configuration functions and anything passed to {@code call} are represented this way. Java lambdas do
 * not carry parameter names at runtime, so functions are described explicitly:
 *
 * <pre>{@code
 * Injectable<Mailer> factory = Injectable.builder()
 *         .parameter("transport", Transport.class)
 *         .optional("retries", 3)
 *         .build(args -> new Mailer((Transport) args[0], (int) args[1]));
 * }</pre>
 * <p>
 * Constructors and methods are described by a {@link ParameterIntrospector} instead.
 *
 * @param <R> the return type
 */
public final class Injectable<R> {

    private final @NotNull List<ParameterDescriptor> parameters;
    private final @NotNull Invoker<? extends R> invoker;
    private final @NotNull String location;

    public Injectable(@NotNull List<ParameterDescriptor> parameters, @NotNull Invoker<? extends R> invoker,
                      @NotNull String location) {
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.location = Objects.requireNonNull(location, "location");
    }

    public static <R> @NotNull Injectable<R> of(@NotNull Supplier<? extends R> supplier) {
        Objects.requireNonNull(supplier, "supplier");

        return new Injectable<>(Collections.emptyList(), arguments -> supplier.get(), describe(supplier));
    }

    @SuppressWarnings("unchecked")
    public static <A, R> @NotNull Injectable<R> of(@NotNull String name, @NotNull Class<A> type,
                                                   @NotNull Function<? super A, ? extends R> function) {
        Objects.requireNonNull(function, "function");

        return new Injectable<>(Collections.singletonList(ParameterDescriptor.required(name, typeName(type))),
                arguments -> function.apply((A) arguments[0]), describe(function));
    }

    @SuppressWarnings("unchecked")
    public static <A, B, R> @NotNull Injectable<R> of(@NotNull String first, @NotNull Class<A> firstType,
                                                      @NotNull String second, @NotNull Class<B> secondType,
                                                      @NotNull BiFunction<? super A, ? super B, ? extends R> function) {
        Objects.requireNonNull(function, "function");

        List<ParameterDescriptor> parameters = new ArrayList<>(2);
        parameters.add(ParameterDescriptor.required(first, typeName(firstType)));
        parameters.add(ParameterDescriptor.required(second, typeName(secondType)));

        return new Injectable<>(parameters, arguments -> function.apply((A) arguments[0], (B) arguments[1]),
                describe(function));
    }

    public static <T> @NotNull Injectable<T> ofConstructor(@NotNull ParameterIntrospector introspector,
                                                          @NotNull Constructor<T> constructor) {
        return new Injectable<>(introspector.describe(constructor),
                arguments -> Reflections.construct(constructor, arguments), introspector.locate(constructor));
    }

    public static @NotNull Injectable<Object> ofMethod(@NotNull ParameterIntrospector introspector,
                                                      @Nullable Object target, @NotNull Method method) {
        if (target == null && !Modifier.isStatic(method.getModifiers())) {
            throw new IllegalArgumentException("method " + method.getName() + " requires a target instance");
        }

        return new Injectable<>(introspector.describe(method),
                arguments -> Reflections.invokeMethod(target, method, arguments), introspector.locate(method));
    }

    public static @NotNull Builder builder() {
        return new Builder();
    }

    public @NotNull List<ParameterDescriptor> getParameters() {
        return parameters;
    }

    public @NotNull String getLocation() {
        return location;
    }

    /**
     * Invokes the callable. Unchecked exceptions propagate unchanged; checked exceptions are wrapped in a
     * {@link ProvisionException}.
     */
    public @Nullable R invoke(@NotNull Object[] arguments) {
        if (arguments.length != parameters.size()) {
            throw new IllegalArgumentException("expected " + parameters.size() + " arguments for " + location
                    + " but got " + arguments.length);
        }

        try {
            return invoker.invoke(arguments);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new ProvisionException("Exception whilst invoking " + location, e);
        }
    }

    @Override
    public String toString() {
        return location + parameters;
    }

    private static @Nullable String typeName(@NotNull Class<?> type) {
        return type == Object.class ? null : type.getName();
    }

    private static String describe(Object function) {
        return "function " + function.getClass().getName();
    }

    /**
     * Describes the parameters of a function one at a time, in declaration order.
     */
    public static final class Builder {

        private final List<ParameterDescriptor> parameters = new ArrayList<>();
        private @Nullable String location;

        private Builder() {
        }

        public @NotNull Builder parameter(@NotNull String name) {
            return add(ParameterDescriptor.required(name));
        }

        public @NotNull Builder parameter(@NotNull String name, @NotNull Class<?> type) {
            return add(ParameterDescriptor.required(name, typeName(type)));
        }

        public @NotNull Builder parameter(@NotNull String name, @Nullable String typeName) {
            return add(ParameterDescriptor.required(name, typeName));
        }

        public @NotNull Builder optional(@NotNull String name, @Nullable Object defaultValue) {
            return add(ParameterDescriptor.optional(name, null, defaultValue));
        }

        public @NotNull Builder optional(@NotNull String name, @NotNull Class<?> type, @Nullable Object defaultValue) {
            return add(ParameterDescriptor.optional(name, typeName(type), defaultValue));
        }

        public @NotNull Builder add(@NotNull ParameterDescriptor descriptor) {
            parameters.add(Objects.requireNonNull(descriptor, "descriptor"));
            return this;
        }

        public @NotNull Builder location(@NotNull String location) {
            this.location = location;
            return this;
        }

        public <R> @NotNull Injectable<R> build(@NotNull Invoker<? extends R> invoker) {
            Objects.requireNonNull(invoker, "invoker");

            return new Injectable<>(parameters, invoker, location != null ? location : describe(invoker));
        }
    }
}
