package dev.fumaz.unbox.exception;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when activating a component requires that same component further down the resolution path.
 */
public class CircularDependencyException extends ResolutionException {

    private final @NotNull List<String> path;

    public CircularDependencyException(@NotNull List<String> path) {
        super("Dependency cycle detected while resolving " + path.get(path.size() - 1)
                + System.lineSeparator() + "Cycle path: " + String.join(" -> ", path));
        this.path = Collections.unmodifiableList(path);
    }

    public @NotNull List<String> getPath() {
        return path;
    }
}
