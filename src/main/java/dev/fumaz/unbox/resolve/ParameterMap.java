package dev.fumaz.unbox.resolve;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable set of argument overrides, keyed either by parameter name or by zero-based parameter index.
 * <p>
 * A key mapped to {@code null} is present: it overrides the parameter with {@code null} rather than leaving it to
 * be resolved. Values may be {@link dev.fumaz.unbox.box.BoxedValue boxed}, in which case they are unboxed only when
 * the parameter they are bound to is resolved.
 */
public final class ParameterMap {

    private static final ParameterMap EMPTY = new ParameterMap(Collections.emptyMap(), Collections.emptyMap());

    private final @NotNull Map<String, Object> named;
    private final @NotNull Map<Integer, Object> positional;

    private ParameterMap(@NotNull Map<String, Object> named, @NotNull Map<Integer, Object> positional) {
        this.named = named;
        this.positional = positional;
    }

    public static @NotNull ParameterMap empty() {
        return EMPTY;
    }

    /**
     * Creates a map of positional overrides, the first value bound to index 0.
     */
    public static @NotNull ParameterMap of(@Nullable Object... values) {
        if (values == null || values.length == 0) {
            return EMPTY;
        }

        Map<Integer, Object> positional = new LinkedHashMap<>();

        for (int i = 0; i < values.length; i++) {
            positional.put(i, values[i]);
        }

        return new ParameterMap(Collections.emptyMap(), Collections.unmodifiableMap(positional));
    }

    /**
     * Creates a map from {@link String} (parameter name) and {@link Integer} (parameter index) keys.
     *
     * @throws IllegalArgumentException if a key is neither, or an index is negative
     */
    public static @NotNull ParameterMap of(@NotNull Map<?, ?> values) {
        Map<String, Object> named = new LinkedHashMap<>();
        Map<Integer, Object> positional = new LinkedHashMap<>();

        for (Map.Entry<?, ?> entry : values.entrySet()) {
            Object key = entry.getKey();

            if (key instanceof String) {
                named.put((String) key, entry.getValue());
            } else if (key instanceof Integer) {
                positional.put(checkIndex((Integer) key), entry.getValue());
            } else {
                throw new IllegalArgumentException("parameter keys must be names or indices, got: " + key);
            }
        }

        return new ParameterMap(Collections.unmodifiableMap(named), Collections.unmodifiableMap(positional));
    }

    public @NotNull ParameterMap with(@NotNull String name, @Nullable Object value) {
        Objects.requireNonNull(name, "name");

        Map<String, Object> copy = new LinkedHashMap<>(named);
        copy.put(name, value);

        return new ParameterMap(Collections.unmodifiableMap(copy), positional);
    }

    public @NotNull ParameterMap with(int index, @Nullable Object value) {
        Map<Integer, Object> copy = new LinkedHashMap<>(positional);
        copy.put(checkIndex(index), value);

        return new ParameterMap(named, Collections.unmodifiableMap(copy));
    }

    public boolean has(@NotNull String name) {
        return named.containsKey(name);
    }

    public boolean has(int index) {
        return positional.containsKey(index);
    }

    public @Nullable Object get(@NotNull String name) {
        return named.get(name);
    }

    public @Nullable Object get(int index) {
        return positional.get(index);
    }

    public boolean isEmpty() {
        return named.isEmpty() && positional.isEmpty();
    }

    private static int checkIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("parameter index must not be negative: " + index);
        }

        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof ParameterMap)) {
            return false;
        }

        ParameterMap that = (ParameterMap) o;
        return named.equals(that.named) && positional.equals(that.positional);
    }

    @Override
    public int hashCode() {
        return Objects.hash(named, positional);
    }

    @Override
    public String toString() {
        return "ParameterMap{named=" + named + ", positional=" + positional + "}";
    }
}
