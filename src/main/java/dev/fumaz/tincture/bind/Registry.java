package dev.fumaz.tincture.bind;

import dev.fumaz.tincture.exception.UnregisteredCapabilityException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Maps each capability to exactly one {@link Registration}. Registering a capability again replaces the
 * previous entry.
 */
public final class Registry {

    private static final Logger LOGGER = Logger.getLogger(Registry.class.getName());

    private final Map<Class<?>, Registration<?>> registrations = new LinkedHashMap<>();

    public synchronized void register(@NotNull Registration<?> registration) {
        Objects.requireNonNull(registration, "registration");

        Registration<?> previous = registrations.put(registration.getCapability(), registration);

        if (previous != null) {
            LOGGER.fine(() -> "Replacing registration " + previous.describe() + " with " + registration.describe());
        } else {
            LOGGER.fine(() -> "Registered " + registration.describe());
        }
    }

    public synchronized <T> @NotNull Registration<T> lookup(@NotNull Class<T> capability) {
        Registration<T> registration = find(capability);

        if (registration == null) {
            throw new UnregisteredCapabilityException(capability);
        }

        return registration;
    }

    @SuppressWarnings("unchecked")
    public synchronized <T> @Nullable Registration<T> find(@NotNull Class<T> capability) {
        Objects.requireNonNull(capability, "capability");
        return (Registration<T>) registrations.get(capability);
    }

    public synchronized boolean isRegistered(@NotNull Class<?> capability) {
        return registrations.containsKey(capability);
    }

    public synchronized @NotNull List<Registration<?>> all() {
        return new ArrayList<>(registrations.values());
    }

    public synchronized int size() {
        return registrations.size();
    }
}
