package dev.fumaz.unbox.container;

import dev.fumaz.unbox.annotation.Inject;
import dev.fumaz.unbox.annotation.Invoke;
import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.resolve.ParameterMap;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CallTest {

    private final Container container = new UnboxContainer();

    static class Greeter {
        String greet(String name, @Inject(optional = true) String suffix) {
            return "Hello, " + name + (suffix == null ? "" : suffix);
        }

        static int twice(int value) {
            return value * 2;
        }
    }

    static class Handler {
        @Invoke
        String handle(Container container, String request) {
            return request + " handled by " + container.getClass().getSimpleName();
        }
    }

    @Test
    void shouldCallBoundInstanceMethod() {
        container.set("name", "world");

        assertEquals("Hello, world", container.call(new Greeter(), "greet"));
        assertEquals("Hello, world!", container.call(new Greeter(), "greet", ParameterMap.of("world", "!")));
    }

    @Test
    void shouldCallStaticMethod() {
        assertEquals(42, container.call(Greeter.class, "twice", ParameterMap.of(21)));
    }

    @Test
    void shouldCallInvokableObject() {
        Object result = container.call(new Handler(), ParameterMap.empty().with("request", "ping"));

        assertEquals("ping handled by UnboxContainer", result);
    }

    @Test
    void shouldCallInjectablePassedAsObject() {
        Object invokable = Injectable.of(() -> "called");

        assertEquals("called", container.call(invokable));
    }

    @Test
    void shouldRejectNonCallableTargets() {
        assertThrows(IllegalArgumentException.class, () -> container.call(new Object()));
        assertThrows(IllegalArgumentException.class, () -> container.call(new Greeter(), "missing"));
        assertThrows(IllegalArgumentException.class, () -> container.call(Greeter.class, "greet"));
    }
}
