package dev.fumaz.tincture.bind;

import dev.fumaz.tincture.provider.Provider;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A {@link Registration} links a capability to the {@link Provider} that produces it, together with its
 * {@link Lifetime} and the fixed constructor parameters applied when the provider constructs a type.
 *
 * @param <T> the capability type
 */
public final class Registration<T> {

    private final @NotNull Class<T> capability;
    private final @NotNull Provider<T> provider;
    private final @NotNull Lifetime lifetime;
    private final @NotNull Map<String, Object> fixedParameters;

    public Registration(@NotNull Class<T> capability, @NotNull Provider<T> provider) {
        this(capability, provider, Lifetime.PER_REQUEST, Collections.emptyMap());
    }

    public Registration(@NotNull Class<T> capability,
                        @NotNull Provider<T> provider,
                        @NotNull Lifetime lifetime,
                        @NotNull Map<String, ?> fixedParameters) {
        this.capability = Objects.requireNonNull(capability, "capability");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        this.fixedParameters = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(fixedParameters, "fixedParameters")));
    }

    public @NotNull Class<T> getCapability() {
        return capability;
    }

    public @NotNull Provider<T> getProvider() {
        return provider;
    }

    public @NotNull Lifetime getLifetime() {
        return lifetime;
    }

    public @NotNull Map<String, Object> getFixedParameters() {
        return fixedParameters;
    }

    public @NotNull String describe() {
        StringBuilder builder = new StringBuilder(capability.getName())
                .append(" -> ")
                .append(provider)
                .append(" [")
                .append(lifetime)
                .append(']');

        if (!fixedParameters.isEmpty()) {
            builder.append(" with ").append(fixedParameters.keySet());
        }

        return builder.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof Registration)) {
            return false;
        }

        Registration<?> that = (Registration<?>) o;
        return capability.equals(that.capability)
                && provider.equals(that.provider)
                && lifetime == that.lifetime
                && fixedParameters.equals(that.fixedParameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(capability, provider, lifetime, fixedParameters);
    }

    @Override
    public String toString() {
        return describe();
    }
}
