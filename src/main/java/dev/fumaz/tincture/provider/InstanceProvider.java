package dev.fumaz.tincture.provider;

import dev.fumaz.tincture.context.Context;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An {@link InstanceProvider} is a {@link Provider} that provides a specific instance without constructing it.
 *
 * @param <T> the capability type
 */
public class InstanceProvider<T> implements Provider<T> {

    private final @NotNull T instance;

    public InstanceProvider(@NotNull T instance) {
        this.instance = Objects.requireNonNull(instance, "instance");
    }

    @Override
    public @NotNull T provide(@NotNull Context<T> context) {
        return instance;
    }

    @Override
    public String toString() {
        return "instance of " + instance.getClass().getName();
    }

}
