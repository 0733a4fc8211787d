package dev.fumaz.unbox.container;

import dev.fumaz.unbox.box.BoxedValue;
import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.module.Module;
import dev.fumaz.unbox.resolve.ParameterMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A {@link Container} maps component names to lazily built values.
 * <p>
 * Components are registered with a factory and built the first time they are fetched. From then on the same value
 * is returned, and the component can no longer be re-registered or overwritten. Class-based overloads use the
 * class's {@linkplain Class#getName() binary name} as the component name.
 */
public interface Container extends ComponentLookup, InstanceFactory {

    static @NotNull Container create(@NotNull List<Module> modules) {
        Container container = new UnboxContainer();

        for (Module module : modules) {
            container.install(module);
        }

        return container;
    }

    static @NotNull Container create(@NotNull Module... modules) {
        return create(Arrays.asList(modules));
    }

    /**
     * Registers a factory under the given name. Nothing is built until the component is first fetched.
     *
     * @throws dev.fumaz.unbox.exception.LifecycleException if the component has already been fetched
     */
    void register(@NotNull String name, @NotNull Injectable<?> factory, @NotNull ParameterMap map);

    /**
     * Registers the class named {@code typeName} to be created, with the given overrides, when {@code name} is first
     * fetched. This is how an implementation is registered under an interface name.
     */
    void register(@NotNull String name, @NotNull String typeName, @NotNull ParameterMap map);

    /**
     * Registers the class named {@code name} itself, created with the given constructor overrides.
     */
    void register(@NotNull String name, @NotNull ParameterMap map);

    /**
     * Directly stores a value built elsewhere.
     *
     * @throws dev.fumaz.unbox.exception.LifecycleException if the component has already been fetched
     */
    void set(@NotNull String name, @Nullable Object value);

    /**
     * Adds a configuration function, whose first parameter receives the component. It is applied when the component
     * is first built, or right away if the component is already active. A non-null return value replaces the
     * component.
     *
     * @throws dev.fumaz.unbox.exception.NotFoundException if the component is neither active nor registered
     */
    void configure(@NotNull String name, @NotNull Injectable<?> function, @NotNull ParameterMap map);

    /**
     * Registers {@code name} as another name for {@code refName}. The target is fetched when {@code name} is first
     * used, not when the alias is defined.
     */
    void alias(@NotNull String name, @NotNull String refName);

    <R> @Nullable R call(@NotNull Injectable<R> function, @NotNull ParameterMap map);

    /**
     * Calls the method with the given name on {@code target}, resolving its arguments.
     */
    @Nullable Object call(@NotNull Object target, @NotNull String methodName, @NotNull ParameterMap map);

    /**
     * Calls the static method with the given name on {@code type}, resolving its arguments.
     */
    @Nullable Object call(@NotNull Class<?> type, @NotNull String methodName, @NotNull ParameterMap map);

    /**
     * Calls an invokable object: an {@link Injectable}, or an object with a single method annotated with
     * {@link dev.fumaz.unbox.annotation.Invoke}.
     */
    @Nullable Object call(@NotNull Object invokable, @NotNull ParameterMap map);

    /**
     * Creates a reference to a component that is only fetched when the reference is unboxed.
     */
    <T> @NotNull BoxedValue<T> ref(@NotNull String name);

    void install(@NotNull Module module);

    @NotNull Set<String> getNames();

    default void register(@NotNull String name) {
        register(name, ParameterMap.empty());
    }

    default void register(@NotNull String name, @NotNull Injectable<?> factory) {
        register(name, factory, ParameterMap.empty());
    }

    default void register(@NotNull String name, @NotNull String typeName) {
        register(name, typeName, ParameterMap.empty());
    }

    default void register(@NotNull Class<?> type) {
        register(type.getName());
    }

    default void register(@NotNull Class<?> type, @NotNull ParameterMap map) {
        register(type.getName(), map);
    }

    default void register(@NotNull Class<?> type, @NotNull Class<?> implementation) {
        register(type.getName(), implementation.getName());
    }

    default void register(@NotNull Class<?> type, @NotNull Class<?> implementation, @NotNull ParameterMap map) {
        register(type.getName(), implementation.getName(), map);
    }

    default void register(@NotNull Class<?> type, @NotNull Injectable<?> factory) {
        register(type.getName(), factory);
    }

    default void register(@NotNull Class<?> type, @NotNull Injectable<?> factory, @NotNull ParameterMap map) {
        register(type.getName(), factory, map);
    }

    default <T> void set(@NotNull Class<T> type, @Nullable T value) {
        set(type.getName(), value);
    }

    default void configure(@NotNull String name, @NotNull Injectable<?> function) {
        configure(name, function, ParameterMap.empty());
    }

    default <T> void configure(@NotNull Class<T> type, @NotNull Consumer<? super T> function) {
        configure(type.getName(), Injectable.of("component", type, component -> {
            function.accept(component);
            return null;
        }));
    }

    /**
     * Adds a configuration function that replaces the component with the function's result.
     */
    default <T> void decorate(@NotNull Class<T> type, @NotNull UnaryOperator<T> function) {
        configure(type.getName(), Injectable.of("component", type, function));
    }

    default void alias(@NotNull Class<?> type, @NotNull Class<?> target) {
        alias(type.getName(), target.getName());
    }

    default <R> @Nullable R call(@NotNull Injectable<R> function) {
        return call(function, ParameterMap.empty());
    }

    default @Nullable Object call(@NotNull Object target, @NotNull String methodName) {
        return call(target, methodName, ParameterMap.empty());
    }

    default @Nullable Object call(@NotNull Class<?> type, @NotNull String methodName) {
        return call(type, methodName, ParameterMap.empty());
    }

    default @Nullable Object call(@NotNull Object invokable) {
        return call(invokable, ParameterMap.empty());
    }

    default <T> @NotNull BoxedValue<T> ref(@NotNull Class<T> type) {
        return ref(type.getName());
    }

}
