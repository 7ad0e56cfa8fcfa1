package dev.fumaz.tincture.bind;

import dev.fumaz.tincture.exception.ConfigurationException;
import dev.fumaz.tincture.provider.ConstructingProvider;
import dev.fumaz.tincture.provider.InstanceProvider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RegistrationBuilderTest {

    interface Clock {
    }

    static class SystemClock implements Clock {
    }

    abstract static class AbstractClock implements Clock {
    }

    @Test
    void shouldHandRegistrationToSink() {
        List<Registration<?>> sink = new ArrayList<>();

        Registration<Clock> registration = new RegistrationBuilder<>(Clock.class, sink::add)
                .scoped()
                .with("zone", "UTC")
                .to(SystemClock.class);

        assertEquals(1, sink.size());
        assertSame(registration, sink.get(0));
        assertEquals(Lifetime.SCOPED, registration.getLifetime());
        assertEquals(Map.of("zone", "UTC"), registration.getFixedParameters());
        assertTrue(registration.getProvider() instanceof ConstructingProvider);
        assertSame(SystemClock.class, ((ConstructingProvider<Clock>) registration.getProvider()).getImplementation());
    }

    @Test
    void shouldRejectNonConstructibleImplementation() {
        List<Registration<?>> sink = new ArrayList<>();
        RegistrationBuilder<Clock> builder = new RegistrationBuilder<>(Clock.class, sink::add);

        assertThrows(ConfigurationException.class, () -> builder.to(AbstractClock.class));
        assertThrows(ConfigurationException.class, builder::toSelf);
        assertTrue(sink.isEmpty(), "rejected registrations should not reach the sink");
    }

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void shouldRejectUnrelatedImplementation() {
        RegistrationBuilder builder = new RegistrationBuilder<>(Clock.class, registration -> {
        });

        assertThrows(ConfigurationException.class, () -> builder.to(String.class));
    }

    @Test
    void instancesAreAlwaysSingletons() {
        List<Registration<?>> sink = new ArrayList<>();
        SystemClock clock = new SystemClock();

        Registration<Clock> registration = new RegistrationBuilder<>(Clock.class, sink::add)
                .perRequest()
                .toInstance(clock);

        assertEquals(Lifetime.SINGLETON, registration.getLifetime());
        assertTrue(registration.getProvider() instanceof InstanceProvider);
    }

    @Test
    void fixedParametersMayHoldNull() {
        Registration<Clock> registration = new RegistrationBuilder<>(Clock.class, ignored -> {
        })
                .with("zone", null)
                .to(SystemClock.class);

        assertTrue(registration.getFixedParameters().containsKey("zone"));
        assertNull(registration.getFixedParameters().get("zone"));
    }
}
