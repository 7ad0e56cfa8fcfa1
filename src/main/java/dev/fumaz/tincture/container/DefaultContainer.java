package dev.fumaz.tincture.container;

import dev.fumaz.tincture.bind.Registration;
import dev.fumaz.tincture.bind.Registry;
import dev.fumaz.tincture.context.Context;
import dev.fumaz.tincture.exception.ConfigurationException;
import dev.fumaz.tincture.exception.ContainerException;
import dev.fumaz.tincture.exception.ConstructionFailedException;
import dev.fumaz.tincture.exception.NoActiveScopeException;
import dev.fumaz.tincture.module.Module;
import dev.fumaz.tincture.scope.ScopeHandle;
import dev.fumaz.tincture.scope.ScopeStack;
import dev.fumaz.tincture.scope.ScopeState;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

public class DefaultContainer implements Container {

    private static final Logger LOGGER = Logger.getLogger(DefaultContainer.class.getName());

    private final @NotNull Registry registry;
    private final @NotNull Map<Class<?>, Object> singletons;
    private final @NotNull Object singletonLock;
    private final @NotNull ScopeStack scopes;
    private final @NotNull ResolutionPath resolutionPath;
    private final @NotNull ConcurrentMap<Class<?>, ConstructorPlan> constructorPlans;
    private volatile boolean destroyed;

    public DefaultContainer() {
        this(Collections.emptyList());
    }

    public DefaultContainer(@NotNull List<Module> modules) {
        this.registry = new Registry();
        this.singletons = new LinkedHashMap<>();
        this.singletonLock = new Object();
        this.scopes = new ScopeStack();
        this.resolutionPath = new ResolutionPath();
        this.constructorPlans = new ConcurrentHashMap<>();

        for (Module module : modules) {
            module.reset();
            module.configure();

            for (Registration<?> registration : module.getRegistrations()) {
                register(registration);
            }
        }
    }

    @Override
    public @NotNull Registry getRegistry() {
        return registry;
    }

    @Override
    public void register(@NotNull Registration<?> registration) {
        registry.register(registration);
    }

    @Override
    public boolean isRegistered(@NotNull Class<?> capability) {
        return registry.isRegistered(capability);
    }

    @Override
    public <T> @NotNull T resolve(@NotNull Class<T> capability) {
        Objects.requireNonNull(capability, "capability");
        ensureNotDestroyed();

        Registration<T> registration = registry.lookup(capability);
        resolutionPath.enter(capability);

        try {
            switch (registration.getLifetime()) {
                case SINGLETON:
                    return resolveSingleton(registration);
                case SCOPED:
                    return resolveScoped(registration);
                case PER_REQUEST:
                default:
                    return create(registration);
            }
        } finally {
            resolutionPath.exit(capability);
        }
    }

    private <T> @NotNull T resolveSingleton(@NotNull Registration<T> registration) {
        Class<T> capability = registration.getCapability();

        synchronized (singletonLock) {
            Object existing = singletons.get(capability);

            if (existing != null) {
                return capability.cast(existing);
            }

            T created = create(registration);
            singletons.put(capability, created);
            return created;
        }
    }

    private <T> @NotNull T resolveScoped(@NotNull Registration<T> registration) {
        Class<T> capability = registration.getCapability();
        ScopeState scope = scopes.current();

        if (scope == null) {
            throw new NoActiveScopeException(capability);
        }

        T existing = scope.get(capability);

        if (existing != null) {
            return existing;
        }

        T created = create(registration);
        scope.put(capability, created, this::invokePreDestroy);
        return created;
    }

    private <T> @NotNull T create(@NotNull Registration<T> registration) {
        Class<T> capability = registration.getCapability();
        Context<T> context = new Context<>(capability, this, registration.getFixedParameters());
        T instance;

        try {
            instance = registration.getProvider().provide(context);
        } catch (ContainerException e) {
            throw e;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Failed to provide " + capability.getName(), e);
            throw new ConstructionFailedException(capability, e);
        }

        if (instance == null) {
            throw new ConstructionFailedException(capability, "Provider for " + capability.getName()
                    + " returned null", null);
        }

        if (!capability.isInstance(instance)) {
            throw new ConstructionFailedException(capability, "Provider for " + capability.getName()
                    + " returned incompatible " + instance.getClass().getName(), null);
        }

        LOGGER.fine(() -> "Created " + instance.getClass().getName() + " for " + registration.describe());
        return instance;
    }

    @Override
    public <T> @NotNull T construct(@NotNull Class<T> type, @NotNull Map<String, ?> fixedParameters) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(fixedParameters, "fixedParameters");
        ensureNotDestroyed();

        Class<?> capability = resolutionPath.currentOr(type);
        ConstructorPlan plan;

        try {
            plan = constructorPlans.computeIfAbsent(type, ConstructorPlan::new);
        } catch (ConfigurationException e) {
            throw new ConstructionFailedException(capability, "Cannot construct " + type.getName()
                    + " for " + capability.getName(), e);
        }

        Object[] arguments = plan.resolveArguments(this, capability, fixedParameters);

        try {
            T instance = type.cast(plan.instantiate(arguments));
            LifecyclePlan.of(type).postConstruct(instance);
            return instance;
        } catch (ContainerException | Error e) {
            throw e;
        } catch (Throwable throwable) {
            LOGGER.log(Level.WARNING, "Failed to construct " + type.getName(), throwable);
            throw new ConstructionFailedException(capability, "Failed to construct " + type.getName()
                    + " for " + capability.getName(), throwable);
        }
    }

    @Override
    public @NotNull ScopeHandle enterScope() {
        ensureNotDestroyed();
        return scopes.enter();
    }

    @Override
    public boolean isScopeActive() {
        return scopes.isActive();
    }

    @Override
    public int getScopeDepth() {
        return scopes.depth();
    }

    @Override
    public void destroy() {
        if (destroyed) {
            return;
        }

        destroyed = true;
        scopes.closeAll();

        List<Object> owned;
        synchronized (singletonLock) {
            owned = new ArrayList<>(singletons.values());
        }

        Collections.reverse(owned);

        for (Object singleton : owned) {
            invokePreDestroy(singleton);
        }

        LOGGER.fine(() -> "Destroyed container with " + owned.size() + " singleton(s)");
    }

    void invokePreDestroy(@NotNull Object instance) {
        LifecyclePlan plan = LifecyclePlan.of(instance.getClass());

        if (!plan.hasPreDestroy()) {
            return;
        }

        try {
            plan.preDestroy(instance);
        } catch (Error e) {
            throw e;
        } catch (Throwable throwable) {
            LOGGER.log(Level.WARNING, "Failed to invoke @PreDestroy on " + instance.getClass().getName(), throwable);
        }
    }

    private void ensureNotDestroyed() {
        if (destroyed) {
            throw new ContainerException("Container has been destroyed");
        }
    }
}
