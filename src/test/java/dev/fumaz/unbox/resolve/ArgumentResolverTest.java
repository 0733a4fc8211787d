package dev.fumaz.unbox.resolve;

import dev.fumaz.unbox.box.BoxedValue;
import dev.fumaz.unbox.container.ComponentLookup;
import dev.fumaz.unbox.exception.NotFoundException;
import dev.fumaz.unbox.exception.ResolutionException;
import dev.fumaz.unbox.reflection.ParameterDescriptor;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ArgumentResolverTest {

    private static final String THING = "com.example.Thing";

    private final Map<String, Object> components = new HashMap<>();
    private final List<String> fetched = new ArrayList<>();
    private final ArgumentResolver resolver = new ArgumentResolver(new MapLookup());

    private static List<ParameterDescriptor> parameters(ParameterDescriptor... descriptors) {
        return Arrays.asList(descriptors);
    }

    @Test
    void shouldApplyFullPrecedenceOrder() {
        Object thing = new Object();
        components.put("b", 5);
        components.put(THING, thing);

        ParameterMap map = ParameterMap.empty()
                .with(0, "pos0")
                .with("a", "named-a");

        Object[] arguments = resolver.resolve(parameters(
                ParameterDescriptor.required("a"),
                ParameterDescriptor.required("b"),
                ParameterDescriptor.required("c", THING),
                ParameterDescriptor.optional("d", null, 9)
        ), map, "test");

        assertArrayEquals(new Object[]{"named-a", 5, thing, 9}, arguments);
    }

    @Test
    void shouldPreferPositionalOverrideOverLookup() {
        components.put(THING, new Object());

        Object[] arguments = resolver.resolve(parameters(
                ParameterDescriptor.required("a"),
                ParameterDescriptor.required("c", THING)
        ), ParameterMap.of("first", "second"), "test");

        assertArrayEquals(new Object[]{"first", "second"}, arguments);
        assertTrue(fetched.isEmpty(), "overridden parameters must not trigger lookups");
    }

    @Test
    void shouldPreferTypeLookupOverNameLookup() {
        Object byType = new Object();
        components.put(THING, byType);
        components.put("c", "by-name");

        Object[] arguments = resolver.resolve(parameters(ParameterDescriptor.required("c", THING)),
                ParameterMap.empty(), "test");

        assertSame(byType, arguments[0]);
        assertEquals(Collections.singletonList(THING), fetched);
    }

    @Test
    void shouldFallBackToNameWhenTypeIsUnknown() {
        components.put("c", "by-name");

        Object[] arguments = resolver.resolve(parameters(ParameterDescriptor.required("c", THING)),
                ParameterMap.empty(), "test");

        assertEquals("by-name", arguments[0]);
    }

    @Test
    void shouldPreferComponentOverDefaultValue() {
        components.put("d", 1);

        Object[] arguments = resolver.resolve(parameters(ParameterDescriptor.optional("d", null, 9)),
                ParameterMap.empty(), "test");

        assertEquals(1, arguments[0]);
    }

    @Test
    void shouldLetExplicitNullShadowComponent() {
        components.put("b", 5);

        Object[] arguments = resolver.resolve(parameters(ParameterDescriptor.required("b")),
                ParameterMap.empty().with("b", null), "test");

        assertNull(arguments[0]);
        assertTrue(fetched.isEmpty());
    }

    @Test
    void shouldReportUnresolvableParameter() {
        ResolutionException exception = assertThrows(ResolutionException.class,
                () -> resolver.resolve(parameters(ParameterDescriptor.required("missing", THING)),
                        ParameterMap.empty(), "Example.method(Thing)"));

        assertEquals("missing", exception.getParameterName());
        assertEquals(THING, exception.getTypeName());
        assertEquals("Example.method(Thing)", exception.getLocation());
        assertTrue(exception.getMessage().contains("missing"));
        assertTrue(exception.getMessage().contains("Example.method(Thing)"));
    }

    @Test
    void shouldUnboxSelectedValueExactlyOnce() {
        AtomicInteger unboxed = new AtomicInteger();
        BoxedValue<String> boxed = () -> {
            unboxed.incrementAndGet();
            return "unboxed";
        };

        ParameterMap map = ParameterMap.empty().with("value", boxed);
        assertEquals(0, unboxed.get(), "placing a boxed value in a map must not unbox it");

        Object[] arguments = resolver.resolve(parameters(ParameterDescriptor.required("value")), map, "test");

        assertEquals("unboxed", arguments[0]);
        assertEquals(1, unboxed.get());
    }

    @Test
    void shouldUnboxComponentsAndDefaults() {
        components.put("component", (BoxedValue<String>) () -> "from-component");

        Object[] arguments = resolver.resolve(parameters(
                ParameterDescriptor.required("component"),
                ParameterDescriptor.optional("fallback", null, (BoxedValue<String>) () -> "from-default")
        ), ParameterMap.empty(), "test");

        assertArrayEquals(new Object[]{"from-component", "from-default"}, arguments);
    }

    @Test
    void shouldReturnEmptyArgumentsForNoParameters() {
        assertEquals(0, resolver.resolve(Collections.emptyList(), ParameterMap.of("ignored"), "test").length);
    }

    private final class MapLookup implements ComponentLookup {

        @Override
        public @Nullable Object get(@NotNull String name) {
            if (!components.containsKey(name)) {
                throw new NotFoundException(name);
            }

            fetched.add(name);
            return components.get(name);
        }

        @Override
        public boolean has(@NotNull String name) {
            return components.containsKey(name);
        }

        @Override
        public boolean isActive(@NotNull String name) {
            return components.containsKey(name);
        }
    }
}
