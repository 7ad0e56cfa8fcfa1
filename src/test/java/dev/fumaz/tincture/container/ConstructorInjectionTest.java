package dev.fumaz.tincture.container;

import dev.fumaz.tincture.annotation.Inject;
import dev.fumaz.tincture.annotation.Named;
import dev.fumaz.tincture.annotation.PostConstruct;
import dev.fumaz.tincture.bind.Lifetime;
import dev.fumaz.tincture.exception.ConfigurationException;
import dev.fumaz.tincture.exception.ConstructionFailedException;
import dev.fumaz.tincture.provider.Provider;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class ConstructorInjectionTest {

    static class Leaf {
    }

    static class Middle {
        private final Leaf leaf;

        Middle(Leaf leaf) {
            this.leaf = leaf;
        }
    }

    static class Top {
        private final Middle middle;

        Top(Middle middle) {
            this.middle = middle;
        }
    }

    static class Name {
        private final String value;

        Name(String value) {
            this.value = value;
        }
    }

    static class Greeter {
        private final Name name;

        Greeter(Name name) {
            this.name = name;
        }
    }

    static class Endpoint {
        private final String host;
        private final int port;

        Endpoint(@Named("address") String host, int port) {
            this.host = host;
            this.port = port;
        }
    }

    static class Audited {
        private final Logger logger;
        private final Container container;
        private final Leaf leaf;

        Audited(Logger logger, Container container, @Inject(optional = true) Leaf leaf) {
            this.logger = logger;
            this.container = container;
            this.leaf = leaf;
        }
    }

    static class Exploding {
        Exploding() {
            throw new IllegalStateException("boom");
        }
    }

    static class Chooser {
        private final String chosen;

        Chooser() {
            this.chosen = "default";
        }

        @Inject
        Chooser(Leaf leaf) {
            this.chosen = "injected";
        }

        Chooser(Leaf leaf, Middle middle) {
            this.chosen = "wide";
        }
    }

    static class Ambiguous {
        @Inject
        Ambiguous(Leaf leaf) {
        }

        @Inject
        Ambiguous(Middle middle) {
        }
    }

    static class Overloaded {
        Overloaded(Leaf leaf) {
        }

        Overloaded(Middle middle) {
        }
    }

    class Detached {
    }

    interface Clock {
    }

    static class BrokenClock implements Clock {
        BrokenClock() {
            throw new IllegalStateException("no time source");
        }
    }

    static class Connection {
        final List<String> calls = new ArrayList<>();

        @PostConstruct
        void open() {
            calls.add("open");
        }
    }

    static class LazyConnection extends Connection {
        @Override
        void open() {
            calls.add("lazy");
        }
    }

    static class Initialised {
        private final List<String> calls = new ArrayList<>();

        @PostConstruct(priority = 2)
        void second() {
            calls.add("second");
        }

        @PostConstruct(priority = 1)
        void first() {
            calls.add("first");
        }
    }

    @Test
    void shouldResolveDependencyChainRecursively() {
        Container container = Container.create();
        container.register(Leaf.class, Leaf.class);
        container.register(Middle.class, Middle.class);
        container.register(Top.class, Top.class);

        Top top = container.resolve(Top.class);

        assertNotNull(top.middle);
        assertNotNull(top.middle.leaf);
    }

    @Test
    void fixedParameterOverridesRegisteredDependency() {
        AtomicInteger registeredNames = new AtomicInteger();
        Name fixed = new Name("fixed");
        Container container = Container.create();
        container.registerFactory(Name.class, () -> {
            registeredNames.incrementAndGet();
            return new Name("registered");
        }, Lifetime.PER_REQUEST);
        container.register(Greeter.class, Greeter.class, Lifetime.PER_REQUEST, Map.of("name", fixed));

        Greeter greeter = container.resolve(Greeter.class);

        assertSame(fixed, greeter.name);
        assertEquals(0, registeredNames.get(), "overridden dependency should not be constructed");
    }

    @Test
    void fixedParametersMatchNamedAnnotationAndPrimitives() {
        Container container = Container.create();
        container.bind(Endpoint.class)
                .with("address", "localhost")
                .with("port", 8080)
                .toSelf();

        Endpoint endpoint = container.resolve(Endpoint.class);

        assertEquals("localhost", endpoint.host);
        assertEquals(8080, endpoint.port);
    }

    @Test
    void missingParameterIsAConstructionFailure() {
        Container container = Container.create();
        container.bind(Endpoint.class).with("port", 80).toSelf();

        ConstructionFailedException exception = assertThrows(ConstructionFailedException.class,
                () -> container.resolve(Endpoint.class));

        assertTrue(exception.getMessage().contains("parameter 'address'"),
                "message should identify the unsatisfied parameter");
    }

    @Test
    void unknownFixedParameterIsAConstructionFailure() {
        Container container = Container.create();
        container.bind(Leaf.class).with("colour", "green").toSelf();

        ConstructionFailedException exception = assertThrows(ConstructionFailedException.class,
                () -> container.resolve(Leaf.class));

        assertTrue(exception.getMessage().contains("colour"));
    }

    @Test
    void incompatibleFixedParameterIsAConstructionFailure() {
        Container container = Container.create();
        container.bind(Endpoint.class)
                .with("address", "localhost")
                .with("port", "eighty")
                .toSelf();

        assertThrows(ConstructionFailedException.class, () -> container.resolve(Endpoint.class));
    }

    @Test
    void nullCannotSatisfyPrimitiveParameter() {
        Container container = Container.create();
        container.bind(Endpoint.class)
                .with("address", "localhost")
                .with("port", null)
                .toSelf();

        assertThrows(ConstructionFailedException.class, () -> container.resolve(Endpoint.class));
    }

    @Test
    void shouldSupplyBuiltInsAndOptionalParameters() {
        Container container = Container.create();
        container.register(Audited.class, Audited.class);

        Audited audited = container.resolve(Audited.class);

        assertSame(container, audited.container);
        assertEquals(Audited.class.getName(), audited.logger.getName());
        assertNull(audited.leaf, "unregistered optional parameter should be null");

        container.register(Leaf.class, Leaf.class);
        assertNotNull(container.resolve(Audited.class).leaf);
    }

    @Test
    void producerFailureIsWrappedWithItsCause() {
        Container container = Container.create();
        container.register(Exploding.class, Exploding.class);

        ConstructionFailedException exception = assertThrows(ConstructionFailedException.class,
                () -> container.resolve(Exploding.class));

        assertTrue(exception.getCause() instanceof IllegalStateException);
        assertEquals("boom", exception.getCause().getMessage());
        assertSame(Exploding.class, exception.getCapability());
    }

    @Test
    void prefersInjectAnnotatedConstructor() {
        Container container = Container.create();
        container.register(Leaf.class, Leaf.class);
        container.register(Chooser.class, Chooser.class);

        assertEquals("injected", container.resolve(Chooser.class).chosen);
    }

    @Test
    void rejectsMultipleInjectConstructors() {
        Container container = Container.create();
        container.register(Ambiguous.class, Ambiguous.class);

        ConstructionFailedException exception = assertThrows(ConstructionFailedException.class,
                () -> container.resolve(Ambiguous.class));

        assertTrue(exception.getCause() instanceof ConfigurationException);
        assertSame(Ambiguous.class, exception.getCapability());
    }

    @Test
    void unselectableConstructorFailsConstruction() {
        Container container = Container.create();
        container.bind(Overloaded.class).toProvider(Provider.constructing(Overloaded.class));

        ConstructionFailedException exception = assertThrows(ConstructionFailedException.class,
                () -> container.resolve(Overloaded.class));

        assertTrue(exception.getCause() instanceof ConfigurationException);
    }

    @Test
    void innerClassFailsConstruction() {
        Container container = Container.create();
        container.register(Detached.class, Detached.class);

        ConstructionFailedException exception = assertThrows(ConstructionFailedException.class,
                () -> container.resolve(Detached.class));

        assertTrue(exception.getCause() instanceof ConfigurationException);
        assertSame(Detached.class, exception.getCapability());
    }

    @Test
    void constructionFailureNamesRequestedCapability() {
        Container container = Container.create();
        container.register(Clock.class, BrokenClock.class);

        ConstructionFailedException exception = assertThrows(ConstructionFailedException.class,
                () -> container.resolve(Clock.class));

        assertSame(Clock.class, exception.getCapability());
        assertEquals("no time source", exception.getCause().getMessage());
    }

    @Test
    void missingArgumentNamesRequestedCapability() {
        Container container = Container.create();
        container.bind(Greeter.class).to(Greeter.class);
        container.bind(Name.class).to(Name.class);

        ConstructionFailedException exception = assertThrows(ConstructionFailedException.class,
                () -> container.resolve(Greeter.class));

        assertSame(Name.class, exception.getCapability());
    }

    @Test
    void overridingLifecycleMethodWithoutAnnotationDisablesIt() {
        Container container = Container.create();

        assertEquals(List.of("open"), container.construct(Connection.class).calls);
        assertTrue(container.construct(LazyConnection.class).calls.isEmpty());
    }

    @Test
    void runsPostConstructInPriorityOrder() {
        Container container = Container.create();

        Initialised initialised = container.construct(Initialised.class);

        assertEquals(List.of("first", "second"), initialised.calls);
    }

    @Test
    void factoriesIgnoreFixedParameters() {
        Container container = Container.create();
        container.bind(Name.class).with("value", "ignored").toFactory(() -> new Name("factory"));

        assertEquals("factory", container.resolve(Name.class).value);
    }

    @Test
    void constructDoesNotRequireRegistration() {
        Container container = Container.create();
        container.register(Leaf.class, Leaf.class, Lifetime.SINGLETON);

        Middle first = container.construct(Middle.class);
        Middle second = container.construct(Middle.class);

        assertNotSame(first, second);
        assertSame(first.leaf, second.leaf);
    }
}
