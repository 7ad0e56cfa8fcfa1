package dev.fumaz.tincture.benchmark;

import dev.fumaz.tincture.container.Container;
import dev.fumaz.tincture.module.ContainerModule;
import dev.fumaz.tincture.scope.ScopeHandle;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ContainerBenchmark {

    @State(Scope.Benchmark)
    public static class ContainerState {

        Container container;
        ScopeHandle scope;

        @Setup(Level.Trial)
        public void setUp() {
            container = Container.create(new BenchmarkModule());
            scope = container.enterScope();
        }

        @TearDown(Level.Trial)
        public void tearDown() {
            scope.close();
            container.destroy();
        }
    }

    @Benchmark
    public Object resolveSingleton(ContainerState state) {
        return state.container.resolve(SingletonService.class);
    }

    @Benchmark
    public Object resolveScoped(ContainerState state) {
        return state.container.resolve(ScopedService.class);
    }

    @Benchmark
    public Object resolveCompositeGraph(ContainerState state) {
        return state.container.resolve(CompositeService.class);
    }

    @Benchmark
    public void unregisteredLookup(ContainerState state, Blackhole blackhole) {
        try {
            blackhole.consume(state.container.resolve(UnregisteredType.class));
        } catch (RuntimeException exception) {
            blackhole.consume(exception);
        }
    }

    private static class BenchmarkModule extends ContainerModule {
        @Override
        public void configure() {
            bind(HeavyComputation.class).perRequest().toSelf();
            bind(SingletonService.class).singleton().toSelf();
            bind(ScopedService.class).scoped().toSelf();
            bind(TransientService.class).perRequest().toSelf();
            bind(CompositeService.class).perRequest().toSelf();
        }
    }

    public static class SingletonService {
        private final HeavyComputation heavyComputation;

        public SingletonService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int compute() {
            return heavyComputation.compute();
        }
    }

    public static class ScopedService {
        private final HeavyComputation heavyComputation;

        public ScopedService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int compute() {
            return heavyComputation.compute();
        }
    }

    public static class TransientService {
        private final HeavyComputation heavyComputation;

        public TransientService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int compute() {
            return heavyComputation.compute();
        }
    }

    public static class CompositeService {
        private final SingletonService singletonService;
        private final ScopedService scopedService;
        private final TransientService transientService;

        public CompositeService(SingletonService singletonService,
                                ScopedService scopedService,
                                TransientService transientService) {
            this.singletonService = singletonService;
            this.scopedService = scopedService;
            this.transientService = transientService;
        }

        public int aggregate() {
            return singletonService.compute() + scopedService.compute() + transientService.compute();
        }
    }

    public static class HeavyComputation {
        public int compute() {
            int result = 0;
            for (int i = 0; i < 16; i++) {
                result = (result * 31) ^ i;
            }
            return result;
        }
    }

    public static class UnregisteredType {
    }
}
