package dev.fumaz.tincture.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a capability is resolved or looked up without ever having been registered.
 */
public class UnregisteredCapabilityException extends ContainerException {

    private final @NotNull Class<?> capability;

    public UnregisteredCapabilityException(@NotNull Class<?> capability) {
        super("No registration found for " + capability.getName());
        this.capability = capability;
    }

    public @NotNull Class<?> getCapability() {
        return capability;
    }
}
