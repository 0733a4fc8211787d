package dev.fumaz.unbox.container;

import dev.fumaz.unbox.bind.ComponentRegistry;
import dev.fumaz.unbox.bind.ConfigurationEntry;
import dev.fumaz.unbox.box.BoxedReference;
import dev.fumaz.unbox.box.BoxedValue;
import dev.fumaz.unbox.exception.LifecycleException;
import dev.fumaz.unbox.exception.NotFoundException;
import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.module.Module;
import dev.fumaz.unbox.reflection.ParameterDescriptor;
import dev.fumaz.unbox.reflection.ParameterIntrospector;
import dev.fumaz.unbox.reflection.ReflectiveIntrospector;
import dev.fumaz.unbox.reflection.Reflections;
import dev.fumaz.unbox.resolve.ArgumentResolver;
import dev.fumaz.unbox.resolve.ParameterMap;
import dev.fumaz.unbox.resolve.ResolutionStack;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Constructor;
import java.lang.reflect.Method;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

public class UnboxContainer implements Container {

    private static final Logger LOGGER = Logger.getLogger(UnboxContainer.class.getName());

    private final @NotNull ComponentRegistry registry;
    private final @NotNull ArgumentResolver resolver;
    private final @NotNull ResolutionStack resolutionStack;
    private final @NotNull ParameterIntrospector introspector;
    private final @NotNull ClassLoader classLoader;
    private final Object lock = new Object();

    public UnboxContainer() {
        this(new ReflectiveIntrospector());
    }

    public UnboxContainer(@NotNull ParameterIntrospector introspector) {
        this(introspector, defaultClassLoader());
    }

    public UnboxContainer(@NotNull ParameterIntrospector introspector, @NotNull ClassLoader classLoader) {
        this.introspector = Objects.requireNonNull(introspector, "introspector");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
        this.registry = new ComponentRegistry();
        this.resolver = new ArgumentResolver(this);
        this.resolutionStack = new ResolutionStack();

        Set<String> selfNames = new LinkedHashSet<>();
        selfNames.add(getClass().getName());
        selfNames.add(UnboxContainer.class.getName());
        selfNames.add(Container.class.getName());
        selfNames.add(ComponentLookup.class.getName());
        selfNames.add(InstanceFactory.class.getName());

        for (String name : selfNames) {
            registry.putValue(name, this);
            registry.seal(name);
        }
    }

    @Override
    public @Nullable Object get(@NotNull String name) {
        synchronized (lock) {
            if (registry.isActive(name)) {
                registry.seal(name);
                return registry.getValue(name);
            }

            if (!registry.hasFactory(name)) {
                throw new NotFoundException(name);
            }

            return activate(name);
        }
    }

    @Override
    public boolean has(@NotNull String name) {
        synchronized (lock) {
            return registry.exists(name);
        }
    }

    @Override
    public boolean isActive(@NotNull String name) {
        synchronized (lock) {
            return registry.isActive(name);
        }
    }

    @Override
    public void register(@NotNull String name, @NotNull Injectable<?> factory, @NotNull ParameterMap map) {
        synchronized (lock) {
            registry.putFactory(name, factory, map);
        }

        LOGGER.fine(() -> "Registered component " + name + " with factory " + factory.getLocation());
    }

    @Override
    public void register(@NotNull String name, @NotNull String typeName, @NotNull ParameterMap map) {
        register(name, Injectable.builder()
                .location("create " + typeName)
                .build(arguments -> create(typeName, map)));
    }

    @Override
    public void register(@NotNull String name, @NotNull ParameterMap map) {
        register(name, name, map);
    }

    @Override
    public void set(@NotNull String name, @Nullable Object value) {
        synchronized (lock) {
            if (registry.isSealed(name)) {
                throw new LifecycleException(name, "attempted overwrite of initialized component: " + name);
            }

            registry.putValue(name, value);
        }
    }

    @Override
    public void configure(@NotNull String name, @NotNull Injectable<?> function, @NotNull ParameterMap map) {
        ConfigurationEntry entry = new ConfigurationEntry(function, map);

        synchronized (lock) {
            if (registry.isActive(name)) {
                applyConfiguration(name, entry);
                return;
            }

            registry.queueConfiguration(name, entry);
        }

        LOGGER.finer(() -> "Queued configuration " + function.getLocation() + " for component " + name);
    }

    @Override
    public void alias(@NotNull String name, @NotNull String refName) {
        register(name, Injectable.builder()
                .location("alias of " + refName)
                .build(arguments -> get(refName)));
    }

    @Override
    public <R> @Nullable R call(@NotNull Injectable<R> function, @NotNull ParameterMap map) {
        synchronized (lock) {
            return function.invoke(resolver.resolve(function, map));
        }
    }

    @Override
    public @Nullable Object call(@NotNull Object target, @NotNull String methodName, @NotNull ParameterMap map) {
        Method method = Reflections.getMethod(target.getClass(), methodName, false);

        return call(Injectable.ofMethod(introspector, target, method), map);
    }

    @Override
    public @Nullable Object call(@NotNull Class<?> type, @NotNull String methodName, @NotNull ParameterMap map) {
        Method method = Reflections.getMethod(type, methodName, true);

        return call(Injectable.ofMethod(introspector, null, method), map);
    }

    @Override
    public @Nullable Object call(@NotNull Object invokable, @NotNull ParameterMap map) {
        if (invokable instanceof Injectable) {
            return call((Injectable<?>) invokable, map);
        }

        Method method = Reflections.getInvokeMethod(invokable.getClass());

        return call(Injectable.ofMethod(introspector, invokable, method), map);
    }

    @Override
    public @NotNull Object create(@NotNull String typeName, @NotNull ParameterMap map) {
        Class<?> type = Reflections.findClass(typeName, classLoader);

        if (type == null) {
            throw new IllegalArgumentException("unable to create component: " + typeName);
        }

        return create(type, map);
    }

    @Override
    public <T> @NotNull T create(@NotNull Class<T> type, @NotNull ParameterMap map) {
        if (!Reflections.isInstantiable(type)) {
            throw new IllegalArgumentException("unable to create instance of abstract class: " + type.getName());
        }

        Constructor<T> constructor = Reflections.selectConstructor(type);
        Injectable<T> injectable = Injectable.ofConstructor(introspector, constructor);

        synchronized (lock) {
            return Objects.requireNonNull(injectable.invoke(resolver.resolve(injectable, map)), type.getName());
        }
    }

    @Override
    public <T> @NotNull BoxedValue<T> ref(@NotNull String name) {
        return new BoxedReference<>(this, name);
    }

    @Override
    public void install(@NotNull Module module) {
        Objects.requireNonNull(module, "module");

        module.register(this);
        LOGGER.fine(() -> "Installed module " + module.getClass().getName());
    }

    @Override
    public @NotNull Set<String> getNames() {
        synchronized (lock) {
            return registry.names();
        }
    }

    private @Nullable Object activate(String name) {
        Injectable<?> factory = registry.getFactory(name);
        ParameterMap map = registry.getFactoryMap(name);
        Object value;

        resolutionStack.enter(name);

        try {
            value = factory.invoke(resolver.resolve(factory, map));
        } finally {
            resolutionStack.exit(name);
        }

        registry.putValue(name, value);
        List<ConfigurationEntry> configurations = registry.drainConfigurations(name);

        try {
            for (ConfigurationEntry entry : configurations) {
                applyConfiguration(name, entry);
            }
        } catch (RuntimeException | Error e) {
            // the next get rebuilds the component and runs every entry again
            registry.removeValue(name);
            registry.requeueConfigurations(name, configurations);
            throw e;
        }

        registry.seal(name);
        LOGGER.fine(() -> "Activated component " + name);

        return registry.getValue(name);
    }

    private void applyConfiguration(String name, ConfigurationEntry entry) {
        Injectable<?> function = entry.getFunction();
        ParameterMap map = bindComponent(function.getParameters(), entry.getMap(), registry.getValue(name));
        Object replacement = function.invoke(resolver.resolve(function, map));

        if (replacement != null) {
            registry.putValue(name, replacement);
        }

        LOGGER.finer(() -> "Applied configuration " + function.getLocation() + " to component " + name
                + (replacement != null ? " (replaced)" : ""));
    }

    private static ParameterMap bindComponent(List<ParameterDescriptor> parameters, ParameterMap map,
                                              @Nullable Object component) {
        if (parameters.isEmpty()) {
            return map;
        }

        if (map.has(parameters.get(0).getName()) || map.has(0)) {
            return map;
        }

        return map.with(0, component);
    }

    private static ClassLoader defaultClassLoader() {
        ClassLoader contextLoader = Thread.currentThread().getContextClassLoader();
        return contextLoader != null ? contextLoader : UnboxContainer.class.getClassLoader();
    }

}
