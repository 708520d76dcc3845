package com.crossmatch.pairing.benchmark;

import com.crossmatch.pairing.core.model.ArraySourceCatalogue;
import com.crossmatch.pairing.core.model.Catalogue;
import com.crossmatch.pairing.core.model.Island;
import com.crossmatch.pairing.core.model.ModelReference;
import com.crossmatch.pairing.grid.PriorDensityGrids;
import com.crossmatch.pairing.hypothesis.HypothesisEnumerator;
import com.crossmatch.pairing.likelihood.NoOpPhotometricLikelihood;
import com.crossmatch.pairing.likelihood.PairwiseLikelihood;
import com.crossmatch.pairing.resolution.IslandResolver;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks of resolving one island as its source count grows.
 * Hypothesis counts grow factorially, so this tracks where the enumeration bound should sit.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
public class IslandResolutionBenchmark {

    private static final double ARCSEC = 1.0 / 3600.0;

    @Param({"2", "4", "6", "7"})
    private int sourcesPerCatalogue;

    private IslandResolver resolver;
    private Island island;

    @Setup(Level.Trial)
    public void setUp() {
        Random random = new Random(42);
        ModelReference ref = ModelReference.of(0, 0, 0);
        ArraySourceCatalogue.Builder a = ArraySourceCatalogue.builder(Catalogue.A);
        ArraySourceCatalogue.Builder b = ArraySourceCatalogue.builder(Catalogue.B);
        int[] indices = new int[sourcesPerCatalogue];
        for (int i = 0; i < sourcesPerCatalogue; i++) {
            a.add(150.0 + random.nextDouble() * ARCSEC, 2.0 + random.nextDouble() * ARCSEC,
                    0.1 * ARCSEC, new double[]{18.0}, 0, ref);
            b.add(150.0 + random.nextDouble() * ARCSEC, 2.0 + random.nextDouble() * ARCSEC,
                    0.08 * ARCSEC, new double[]{18.0}, 0, ref);
            indices[i] = i;
        }
        resolver = new IslandResolver(a.build(), b.build(),
                new PairwiseLikelihood(PriorDensityGrids.uniform(150.0, 550.0, 150.0),
                        NoOpPhotometricLikelihood.INSTANCE),
                new HypothesisEnumerator());
        island = new Island(0, indices, indices);
    }

    @Benchmark
    public void resolveIsland(Blackhole bh) {
        bh.consume(resolver.resolve(island));
    }

    @Benchmark
    public void countHypotheses(Blackhole bh) {
        bh.consume(HypothesisEnumerator.count(sourcesPerCatalogue, sourcesPerCatalogue));
    }

    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(IslandResolutionBenchmark.class.getSimpleName())
                .build();
        new Runner(opt).run();
    }
}
