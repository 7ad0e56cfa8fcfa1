package dev.fumaz.tincture.scope;

/**
 * Represents an active scope that can be closed to release its scoped instances.
 */
public interface ScopeHandle extends AutoCloseable {

    /**
     * Closes the scope, triggering any registered destruction callbacks and restoring the enclosing scope.
     * Closing an already closed scope does nothing.
     *
     * @throws IllegalStateException if an inner scope opened after this one is still active
     */
    @Override
    void close();

    boolean isOpen();

    /**
     * @return the nesting depth of this scope, starting at 1 for the outermost scope
     */
    int getDepth();
}
