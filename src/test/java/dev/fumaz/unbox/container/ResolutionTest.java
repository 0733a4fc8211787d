package dev.fumaz.unbox.container;

import dev.fumaz.unbox.exception.ResolutionException;
import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.resolve.ParameterMap;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionTest {

    private final Container container = new UnboxContainer();

    static class Thing {
    }

    @Test
    void shouldResolveInPrecedenceOrder() {
        container.set("b", 5);
        container.register(Thing.class);

        Injectable<List<Object>> function = Injectable.builder()
                .parameter("a")
                .parameter("b")
                .parameter("c", Thing.class)
                .optional("d", 9)
                .build(arguments -> Arrays.asList(arguments));

        List<Object> arguments = container.call(function, ParameterMap.empty()
                .with(0, "pos0")
                .with("a", "named-a"));

        assertEquals(Arrays.asList("named-a", 5, container.get(Thing.class), 9), arguments);
    }

    @Test
    void shouldNotActivateBoxedReferenceUntilConsumed() {
        AtomicInteger constructed = new AtomicInteger();
        container.register("expensive", Injectable.of(() -> {
            constructed.incrementAndGet();
            return new Object();
        }));

        ParameterMap map = ParameterMap.empty().with("dependency", container.ref("expensive"));

        assertEquals(0, constructed.get());
        assertFalse(container.isActive("expensive"));

        Object resolved = container.call(Injectable.of("dependency", Object.class, dependency -> dependency), map);

        assertEquals(1, constructed.get());
        assertSame(container.get("expensive"), resolved);
    }

    @Test
    void shouldReferenceComponentsRegisteredLater() {
        container.register("service", Injectable.of("path", String.class, path -> "service@" + path),
                ParameterMap.empty().with("path", container.ref("cache.path")));
        container.set("cache.path", "/tmp/cache");

        assertEquals("service@/tmp/cache", container.get("service"));
    }

    @Test
    void shouldLetExplicitNullShadowComponent() {
        container.set("value", "component");

        Object resolved = container.call(Injectable.of("value", String.class, value -> value == null ? "null" : value),
                ParameterMap.empty().with("value", null));

        assertEquals("null", resolved);
    }

    @Test
    void shouldResolveFactoryArgumentsFromComponents() {
        container.set("greeting", "Hello");
        container.register("message", Injectable.of("greeting", String.class, greeting -> greeting + ", world"));

        assertEquals("Hello, world", container.get("message"));
    }

    @Test
    void shouldFailWithResolutionErrorForMissingArgument() {
        container.register("message", Injectable.builder()
                .parameter("greeting", String.class)
                .location("MessageFactory.create")
                .build(arguments -> arguments[0]));

        ResolutionException exception = assertThrows(ResolutionException.class, () -> container.get("message"));

        assertEquals("greeting", exception.getParameterName());
        assertEquals("java.lang.String", exception.getTypeName());
        assertEquals("MessageFactory.create", exception.getLocation());
        assertFalse(container.isActive("message"));
    }

    @Test
    void shouldAliasLazily() {
        AtomicInteger constructed = new AtomicInteger();
        container.register("target", Injectable.of(() -> {
            constructed.incrementAndGet();
            return new Object();
        }));

        container.alias("alias", "target");

        assertTrue(container.has("alias"));
        assertEquals(0, constructed.get());
        assertSame(container.get("target"), container.get("alias"));
        assertEquals(1, constructed.get());
    }

    @Test
    void shouldAllowAliasToTargetRegisteredLater() {
        container.alias("alias", "late");
        container.set("late", "value");

        assertEquals("value", container.get("alias"));
    }
}
