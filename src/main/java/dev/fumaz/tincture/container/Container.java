package dev.fumaz.tincture.container;

import dev.fumaz.tincture.bind.Lifetime;
import dev.fumaz.tincture.bind.Registration;
import dev.fumaz.tincture.bind.RegistrationBuilder;
import dev.fumaz.tincture.bind.Registry;
import dev.fumaz.tincture.module.Module;
import dev.fumaz.tincture.provider.Provider;
import dev.fumaz.tincture.scope.ScopeHandle;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * A {@link Container} maps capabilities to producers and controls how many instances of each may exist and
 * for how long.
 * <p>
 * Instances are created on demand by {@link #resolve(Class)}. Singleton instances live as long as the
 * container, scoped instances as long as the scope that was active when they were created, and per-request
 * instances are never cached.
 */
public interface Container {

    static @NotNull Container create(@NotNull List<Module> modules) {
        return new DefaultContainer(modules);
    }

    static @NotNull Container create(@NotNull Module... modules) {
        return create(Arrays.asList(modules));
    }

    @NotNull Registry getRegistry();

    /**
     * Inserts or replaces the registration for its capability.
     */
    void register(@NotNull Registration<?> registration);

    default <T> @NotNull RegistrationBuilder<T> bind(@NotNull Class<T> capability) {
        return new RegistrationBuilder<>(capability, this::register);
    }

    default <T> void register(@NotNull Class<T> capability, @NotNull Class<? extends T> implementation) {
        register(capability, implementation, Lifetime.PER_REQUEST);
    }

    default <T> void register(@NotNull Class<T> capability,
                              @NotNull Class<? extends T> implementation,
                              @NotNull Lifetime lifetime) {
        register(capability, implementation, lifetime, Collections.emptyMap());
    }

    default <T> void register(@NotNull Class<T> capability,
                              @NotNull Class<? extends T> implementation,
                              @NotNull Lifetime lifetime,
                              @NotNull Map<String, ?> fixedParameters) {
        bind(capability).in(lifetime).withParameters(fixedParameters).to(implementation);
    }

    default <T> void registerFactory(@NotNull Class<T> capability,
                                     @NotNull Supplier<? extends T> factory,
                                     @NotNull Lifetime lifetime) {
        bind(capability).in(lifetime).toFactory(factory);
    }

    default <T> void registerProvider(@NotNull Class<T> capability,
                                      @NotNull Provider<T> provider,
                                      @NotNull Lifetime lifetime) {
        bind(capability).in(lifetime).toProvider(provider);
    }

    default <T> void registerInstance(@NotNull Class<T> capability, @NotNull T instance) {
        bind(capability).toInstance(instance);
    }

    boolean isRegistered(@NotNull Class<?> capability);

    /**
     * Returns an instance of the capability, honouring its lifetime.
     *
     * @throws dev.fumaz.tincture.exception.UnregisteredCapabilityException if the capability was never registered
     * @throws dev.fumaz.tincture.exception.NoActiveScopeException if a scoped capability is resolved outside a scope
     * @throws dev.fumaz.tincture.exception.ConstructionFailedException if the producer failed
     * @throws dev.fumaz.tincture.exception.CyclicDependencyException if the capability depends on itself
     */
    <T> @NotNull T resolve(@NotNull Class<T> capability);

    /**
     * Builds a new instance of a concrete type, injecting its constructor parameters. The result is not cached.
     */
    <T> @NotNull T construct(@NotNull Class<T> type, @NotNull Map<String, ?> fixedParameters);

    default <T> @NotNull T construct(@NotNull Class<T> type) {
        return construct(type, Collections.emptyMap());
    }

    /**
     * Opens a new scope nested inside the current one, if any. Close the handle to restore the enclosing scope.
     */
    @NotNull ScopeHandle enterScope();

    default <R> R withinScope(@NotNull Supplier<R> body) {
        try (ScopeHandle ignored = enterScope()) {
            return body.get();
        }
    }

    boolean isScopeActive();

    int getScopeDepth();

    /**
     * Closes any open scopes and releases every singleton. The container cannot be used afterwards.
     */
    void destroy();

}
