package dev.fumaz.tincture.provider;

import dev.fumaz.tincture.context.Context;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A {@link FactoryProvider} is a {@link Provider} backed by a no-argument factory. Fixed parameters and
 * constructor injection do not apply; the factory captures its own dependencies.
 *
 * @param <T> the capability type
 */
public class FactoryProvider<T> implements Provider<T> {

    private final @NotNull Supplier<? extends T> factory;

    public FactoryProvider(@NotNull Supplier<? extends T> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public @Nullable T provide(@NotNull Context<T> context) {
        return factory.get();
    }

    @Override
    public String toString() {
        return "factory";
    }

}
