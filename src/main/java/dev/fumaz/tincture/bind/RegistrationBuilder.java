package dev.fumaz.tincture.bind;

import dev.fumaz.tincture.exception.ConfigurationException;
import dev.fumaz.tincture.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Modifier;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A {@link RegistrationBuilder} is used to create a {@link Registration}. The terminal {@code to*} methods
 * hand the finished registration to the sink the builder was created with.
 *
 * @param <T> the capability type
 */
public class RegistrationBuilder<T> {

    private final @NotNull Class<T> capability;
    private final @NotNull Consumer<Registration<?>> sink;
    private final @NotNull Map<String, Object> fixedParameters = new LinkedHashMap<>();

    private @NotNull Lifetime lifetime = Lifetime.PER_REQUEST;

    public RegistrationBuilder(@NotNull Class<T> capability, @NotNull Consumer<Registration<?>> sink) {
        this.capability = Objects.requireNonNull(capability, "capability");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public RegistrationBuilder<T> in(@NotNull Lifetime lifetime) {
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        return this;
    }

    public RegistrationBuilder<T> perRequest() {
        return in(Lifetime.PER_REQUEST);
    }

    public RegistrationBuilder<T> scoped() {
        return in(Lifetime.SCOPED);
    }

    public RegistrationBuilder<T> singleton() {
        return in(Lifetime.SINGLETON);
    }

    /**
     * Supplies a literal value for the constructor parameter with the given name. Fixed parameters win over
     * injected dependencies and are ignored by factory providers.
     */
    public RegistrationBuilder<T> with(@NotNull String name, @Nullable Object value) {
        fixedParameters.put(Objects.requireNonNull(name, "name"), value);
        return this;
    }

    public RegistrationBuilder<T> withParameters(@NotNull Map<String, ?> parameters) {
        Objects.requireNonNull(parameters, "parameters").forEach(this::with);
        return this;
    }

    public Registration<T> to(@NotNull Class<? extends T> implementation) {
        Objects.requireNonNull(implementation, "implementation");
        ensureConstructible(implementation);

        return toProvider(Provider.constructing(implementation));
    }

    public Registration<T> toSelf() {
        return to(capability);
    }

    public Registration<T> toFactory(@NotNull Supplier<? extends T> factory) {
        return toProvider(Provider.factory(factory));
    }

    /**
     * Registers an already built instance. Instances are always singletons, whatever lifetime was selected.
     */
    public Registration<T> toInstance(@NotNull T instance) {
        Objects.requireNonNull(instance, "instance");
        this.lifetime = Lifetime.SINGLETON;

        return toProvider(Provider.instance(instance));
    }

    public Registration<T> toProvider(@NotNull Provider<T> provider) {
        Registration<T> registration = new Registration<>(capability,
                Objects.requireNonNull(provider, "provider"),
                lifetime,
                fixedParameters);

        sink.accept(registration);
        return registration;
    }

    private void ensureConstructible(@NotNull Class<? extends T> implementation) {
        if (!capability.isAssignableFrom(implementation)) {
            throw new ConfigurationException(implementation.getName() + " does not implement "
                    + capability.getName());
        }

        if (implementation.isInterface() || Modifier.isAbstract(implementation.getModifiers())) {
            throw new ConfigurationException("Cannot register " + implementation.getName()
                    + " as implementation of " + capability.getName() + ": type is not constructible");
        }
    }
}
