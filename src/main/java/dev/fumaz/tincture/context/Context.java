package dev.fumaz.tincture.context;

import dev.fumaz.tincture.container.Container;
import org.jetbrains.annotations.NotNull;

import java.util.Map;
import java.util.Objects;

/**
 * The {@link Context} handed to a {@link dev.fumaz.tincture.provider.Provider} for one construction. It exposes
 * the container, so providers can resolve their own dependencies explicitly.
 *
 * @param <T> the capability being produced
 */
public final class Context<T> {

    private final @NotNull Class<T> capability;
    private final @NotNull Container container;
    private final @NotNull Map<String, Object> fixedParameters;

    public Context(@NotNull Class<T> capability,
                   @NotNull Container container,
                   @NotNull Map<String, Object> fixedParameters) {
        this.capability = Objects.requireNonNull(capability, "capability");
        this.container = Objects.requireNonNull(container, "container");
        this.fixedParameters = Objects.requireNonNull(fixedParameters, "fixedParameters");
    }

    public @NotNull Class<T> getCapability() {
        return capability;
    }

    public @NotNull Container getContainer() {
        return container;
    }

    public @NotNull Map<String, Object> getFixedParameters() {
        return fixedParameters;
    }

    public <D> @NotNull D resolve(@NotNull Class<D> dependency) {
        return container.resolve(dependency);
    }

    @Override
    public String toString() {
        return "Context{" + capability.getName() + '}';
    }
}
