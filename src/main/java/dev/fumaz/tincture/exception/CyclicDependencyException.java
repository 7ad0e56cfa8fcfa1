package dev.fumaz.tincture.exception;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a capability is requested again while it is still being resolved.
 */
public class CyclicDependencyException extends ContainerException {

    private final @NotNull List<Class<?>> path;

    public CyclicDependencyException(@NotNull String message, @NotNull List<Class<?>> path) {
        super(message);
        this.path = Collections.unmodifiableList(path);
    }

    /**
     * @return the capabilities forming the cycle, starting and ending with the same capability
     */
    public @NotNull List<Class<?>> getPath() {
        return path;
    }
}
