package dev.fumaz.tincture.scope;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Logger;

/**
 * Stack of scope tables owned by one container. Entering a scope pushes an empty table; closing its handle
 * pops the table and restores the enclosing one, or no scope at all. Closing a handle also closes any inner
 * scope still open above it, innermost first.
 * <p>
 * Not thread-safe: there is a single active scope per container, not per thread.
 */
public final class ScopeStack {

    private static final Logger LOGGER = Logger.getLogger(ScopeStack.class.getName());

    private final Deque<ScopeState> states = new ArrayDeque<>();

    public @NotNull ScopeHandle enter() {
        ScopeState state = new ScopeState(states.size() + 1);
        states.push(state);

        LOGGER.fine(() -> "Entered scope at depth " + state.getDepth());
        return new Activation(state);
    }

    public @Nullable ScopeState current() {
        return states.peek();
    }

    public boolean isActive() {
        return !states.isEmpty();
    }

    public int depth() {
        return states.size();
    }

    /**
     * Closes every open scope, innermost first.
     */
    public void closeAll() {
        while (!states.isEmpty()) {
            exit(states.pop());
        }
    }

    private void exit(ScopeState state) {
        state.destroy();
        LOGGER.fine(() -> "Exited scope at depth " + state.getDepth());
    }

    private final class Activation implements ScopeHandle {

        private final ScopeState state;

        private Activation(ScopeState state) {
            this.state = state;
        }

        @Override
        public void close() {
            if (state.isDestroyed()) {
                return;
            }

            while (!states.isEmpty()) {
                ScopeState top = states.pop();

                if (top != state) {
                    LOGGER.warning(() -> "Closing scope at depth " + top.getDepth()
                            + " left open inside scope at depth " + state.getDepth());
                }

                exit(top);

                if (top == state) {
                    return;
                }
            }
        }

        @Override
        public boolean isOpen() {
            return !state.isDestroyed();
        }

        @Override
        public int getDepth() {
            return state.getDepth();
        }
    }
}
