package dev.fumaz.tincture.module;

import dev.fumaz.tincture.bind.Registration;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A {@link Module} is a collection of registrations.
 */
public interface Module {

    void configure();

    @NotNull List<Registration<?>> getRegistrations();

    default void reset() {
    }

}
