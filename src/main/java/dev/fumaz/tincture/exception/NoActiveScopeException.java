package dev.fumaz.tincture.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a scoped capability is resolved while no scope is active.
 */
public class NoActiveScopeException extends ContainerException {

    private final @NotNull Class<?> capability;

    public NoActiveScopeException(@NotNull Class<?> capability) {
        super("Cannot resolve scoped " + capability.getName() + " outside of an active scope");
        this.capability = capability;
    }

    public @NotNull Class<?> getCapability() {
        return capability;
    }
}
