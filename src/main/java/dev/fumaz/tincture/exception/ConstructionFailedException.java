package dev.fumaz.tincture.exception;

import org.jetbrains.annotations.NotNull;

/**
 * Signals that a producer failed while creating an instance. The cause is what the producer raised.
 */
public class ConstructionFailedException extends ContainerException {

    private final @NotNull Class<?> capability;

    public ConstructionFailedException(@NotNull Class<?> capability, @NotNull String message, Throwable cause) {
        super(message, cause);
        this.capability = capability;
    }

    public ConstructionFailedException(@NotNull Class<?> capability, Throwable cause) {
        this(capability, "Failed to construct " + capability.getName(), cause);
    }

    public @NotNull Class<?> getCapability() {
        return capability;
    }
}
