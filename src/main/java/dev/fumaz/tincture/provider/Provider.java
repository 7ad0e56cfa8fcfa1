package dev.fumaz.tincture.provider;

import dev.fumaz.tincture.context.Context;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.function.Supplier;

/**
 * A {@link Provider} produces an instance of a capability. The container decides how often it is called.
 *
 * @param <T> the capability type
 */
@FunctionalInterface
public interface Provider<T> {

    static <T> @NotNull Provider<T> factory(@NotNull Supplier<? extends T> factory) {
        return new FactoryProvider<>(factory);
    }

    static <T> @NotNull Provider<T> constructing(@NotNull Class<? extends T> type) {
        return new ConstructingProvider<>(type);
    }

    static <T> @NotNull Provider<T> instance(@NotNull T instance) {
        return new InstanceProvider<>(instance);
    }

    @Nullable T provide(@NotNull Context<T> context);

}
