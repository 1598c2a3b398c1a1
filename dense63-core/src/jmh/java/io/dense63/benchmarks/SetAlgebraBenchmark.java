package io.dense63.benchmarks;

import io.dense63.core.CoverConfiguration;
import io.dense63.cover.CoverPlanner;
import io.dense63.kernel.CanonicalSet;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

import java.util.Random;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class SetAlgebraBenchmark {

    @State(Scope.Benchmark)
    public static class BenchmarkState {
        @Param({"100", "10000"})
        private int runs;

        private CanonicalSet left;
        private CanonicalSet right;
        private CoverPlanner planner;

        @Setup(Level.Trial)
        public void setUp() {
            var random = new Random(42);
            left = lumpy(random, runs);
            right = lumpy(random, runs);
            planner = new CoverPlanner(CoverConfiguration.builder().maxSize(16).minGrain(64).build());
        }

        private static CanonicalSet lumpy(Random random, int runs) {
            var set = CanonicalSet.of();
            var next = 0L;
            for (var i = 0; i < runs; i++) {
                next += 1 + random.nextInt(5_000);
                var length = random.nextInt(2_000);
                set = set.union(CanonicalSet.interval(next, next + length));
                next += length;
            }
            return set;
        }
    }

    @Benchmark
    public int union(BenchmarkState state) {
        return state.left.union(state.right).size();
    }

    @Benchmark
    public int intersection(BenchmarkState state) {
        return state.left.intersection(state.right).size();
    }

    @Benchmark
    public int complement(BenchmarkState state) {
        return state.left.complement().size();
    }

    @Benchmark
    public boolean intersects(BenchmarkState state) {
        return state.left.intersects(state.right);
    }

    @Benchmark
    public int cover(BenchmarkState state) {
        return state.planner.cover(state.left).size();
    }
}
