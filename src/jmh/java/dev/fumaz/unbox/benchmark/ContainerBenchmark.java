package dev.fumaz.unbox.benchmark;

import dev.fumaz.unbox.container.Container;
import dev.fumaz.unbox.exception.NotFoundException;
import dev.fumaz.unbox.function.Injectable;
import dev.fumaz.unbox.resolve.ParameterMap;
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
        Injectable<Object> function;
        ParameterMap overrides;

        @Setup(Level.Trial)
        public void setUp() {
            container = Container.create(registry -> {
                registry.register(HeavyComputation.class);
                registry.register(SingletonService.class);
                registry.register(CompositeService.class);
                registry.set("threshold", 42);
            });

            function = Injectable.builder()
                    .parameter("service", SingletonService.class)
                    .parameter("threshold")
                    .optional("label", "default")
                    .build(arguments -> arguments[1]);

            overrides = ParameterMap.empty().with("label", "override");
        }
    }

    @Benchmark
    public Object getActiveComponent(ContainerState state) {
        return state.container.get(SingletonService.class);
    }

    @Benchmark
    public Object createCompositeGraph(ContainerState state) {
        return state.container.create(CompositeService.class);
    }

    @Benchmark
    public Object callWithOverrides(ContainerState state) {
        return state.container.call(state.function, state.overrides);
    }

    @Benchmark
    public void unresolvedLookup(ContainerState state, Blackhole blackhole) {
        try {
            blackhole.consume(state.container.get("missing"));
        } catch (NotFoundException exception) {
            blackhole.consume(exception);
        }
    }

    public static class SingletonService {
        private final HeavyComputation heavyComputation;

        public SingletonService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public HeavyComputation getHeavyComputation() {
            return heavyComputation;
        }
    }

    public static class HeavyComputation {
        private final long seed = System.nanoTime();

        public long getSeed() {
            return seed;
        }
    }

    public static class CompositeService {
        private final SingletonService singletonService;
        private final int threshold;

        public CompositeService(SingletonService singletonService, int threshold) {
            this.singletonService = singletonService;
            this.threshold = threshold;
        }

        public SingletonService getSingletonService() {
            return singletonService;
        }

        public int getThreshold() {
            return threshold;
        }
    }
}
