package dev.fumaz.tincture.provider;

import dev.fumaz.tincture.context.Context;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@link ConstructingProvider} is a {@link Provider} that builds a concrete type through the container,
 * injecting its constructor parameters.
 *
 * @param <T> the capability type
 */
public class ConstructingProvider<T> implements Provider<T> {

    private final @NotNull Class<? extends T> implementation;

    public ConstructingProvider(@NotNull Class<? extends T> implementation) {
        this.implementation = Objects.requireNonNull(implementation, "implementation");
    }

    @Override
    public @NotNull T provide(@NotNull Context<T> context) {
        return context.getContainer().construct(implementation, context.getFixedParameters());
    }

    public @NotNull Class<? extends T> getImplementation() {
        return implementation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof ConstructingProvider)) {
            return false;
        }

        return implementation.equals(((ConstructingProvider<?>) o).implementation);
    }

    @Override
    public int hashCode() {
        return implementation.hashCode();
    }

    @Override
    public String toString() {
        return implementation.getName();
    }

}
