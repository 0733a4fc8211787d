package dev.fumaz.unbox.bind;

import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.resolve.ParameterMap;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A configuration function queued against a component, together with its argument overrides.
 */
public final class ConfigurationEntry {

    private final @NotNull Injectable<?> function;
    private final @NotNull ParameterMap map;

    public ConfigurationEntry(@NotNull Injectable<?> function, @NotNull ParameterMap map) {
        this.function = Objects.requireNonNull(function, "function");
        this.map = Objects.requireNonNull(map, "map");
    }

    public @NotNull Injectable<?> getFunction() {
        return function;
    }

    public @NotNull ParameterMap getMap() {
        return map;
    }
}
