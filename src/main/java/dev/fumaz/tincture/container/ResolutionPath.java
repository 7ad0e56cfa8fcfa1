package dev.fumaz.tincture.container;

import dev.fumaz.tincture.exception.CyclicDependencyException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Tracks the capabilities currently being resolved on each thread.
 */
final class ResolutionPath {

    private final ThreadLocal<Deque<Class<?>>> path = ThreadLocal.withInitial(ArrayDeque::new);

    void enter(@NotNull Class<?> capability) {
        Deque<Class<?>> current = path.get();

        if (current.contains(capability)) {
            throw cycle(current, capability);
        }

        current.push(capability);
    }

    void exit(@NotNull Class<?> capability) {
        Deque<Class<?>> current = path.get();
        Class<?> top = current.poll();

        if (top != capability) {
            throw new IllegalStateException("Resolution path corrupted: expected " + capability.getName()
                    + " but found " + (top == null ? "nothing" : top.getName()));
        }

        if (current.isEmpty()) {
            path.remove();
        }
    }

    /**
     * Returns the capability this thread is resolving, or {@code fallback} when called outside a resolution.
     */
    @NotNull Class<?> currentOr(@NotNull Class<?> fallback) {
        Class<?> top = path.get().peek();

        if (top == null) {
            path.remove();
            return fallback;
        }

        return top;
    }

    private static CyclicDependencyException cycle(Deque<Class<?>> current, Class<?> capability) {
        List<Class<?>> ordered = new ArrayList<>(current.size() + 1);
        Iterator<Class<?>> iterator = current.descendingIterator();

        while (iterator.hasNext()) {
            ordered.add(iterator.next());
        }

        List<Class<?>> cycle = new ArrayList<>(ordered.subList(ordered.indexOf(capability), ordered.size()));
        cycle.add(capability);

        String lineSeparator = System.lineSeparator();
        StringBuilder builder = new StringBuilder()
                .append("Dependency cycle detected while resolving ")
                .append(capability.getName())
                .append(lineSeparator)
                .append("Cycle path:");

        for (Class<?> step : cycle) {
            builder.append(lineSeparator).append(" - ").append(step.getName());
        }

        return new CyclicDependencyException(builder.toString(), cycle);
    }
}
