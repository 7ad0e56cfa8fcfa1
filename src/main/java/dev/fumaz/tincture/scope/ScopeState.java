package dev.fumaz.tincture.scope;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds scoped instances and their destruction callbacks for the lifetime of a scope activation.
 */
public final class ScopeState {

    private static final Logger LOGGER = Logger.getLogger(ScopeState.class.getName());

    private final int depth;
    private final Map<Class<?>, Object> instances = new HashMap<>();
    private final Deque<Runnable> destroyCallbacks = new ArrayDeque<>();
    private boolean destroyed;

    ScopeState(int depth) {
        this.depth = depth;
    }

    public <T> @Nullable T get(@NotNull Class<T> capability) {
        return capability.cast(instances.get(capability));
    }

    public <T> void put(@NotNull Class<T> capability, @NotNull T instance, @NotNull Consumer<? super T> onDestroy) {
        Objects.requireNonNull(instance, "instance");
        Objects.requireNonNull(onDestroy, "onDestroy");

        if (destroyed) {
            throw new IllegalStateException("Scope at depth " + depth + " has already been closed");
        }

        if (instances.putIfAbsent(capability, instance) != null) {
            throw new IllegalStateException("Scope at depth " + depth + " already holds " + capability.getName());
        }

        destroyCallbacks.push(() -> onDestroy.accept(instance));
    }

    public int getDepth() {
        return depth;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    void destroy() {
        if (destroyed) {
            return;
        }

        destroyed = true;

        Runnable callback;
        while ((callback = destroyCallbacks.poll()) != null) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Destruction callback failed in scope at depth " + depth, e);
            }
        }

        instances.clear();
    }
}
