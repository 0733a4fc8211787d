package dev.fumaz.unbox.resolve;

import dev.fumaz.unbox.exception.CircularDependencyException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Tracks the components currently under construction, so that a component requiring itself fails fast instead of
 * recursing until the stack overflows.
 */
public final class ResolutionStack {

    private final Deque<String> path = new ArrayDeque<>();
    private final Set<String> inProgress = new HashSet<>();

    public void enter(@NotNull String name) {
        if (!inProgress.add(name)) {
            throw cycle(name);
        }

        path.push(name);
    }

    public void exit(@NotNull String name) {
        String finished = path.pop();

        if (!finished.equals(name)) {
            throw new IllegalStateException("Resolution stack mismatch while exiting " + name);
        }

        inProgress.remove(name);
    }

    private CircularDependencyException cycle(String name) {
        List<String> ordered = new ArrayList<>(path);
        Collections.reverse(ordered);

        List<String> cycle = new ArrayList<>(ordered.subList(ordered.indexOf(name), ordered.size()));
        cycle.add(name);

        return new CircularDependencyException(cycle);
    }
}
