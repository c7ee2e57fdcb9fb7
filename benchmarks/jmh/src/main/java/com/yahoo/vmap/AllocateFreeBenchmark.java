/*
 * Copyright 2020, Verizon Media.
 * Licensed under the terms of the Apache 2.0 license.
 * Please see LICENSE file in the project root for terms.
 */

package com.yahoo.vmap;

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
import org.openjdk.jmh.annotations.TearDown;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Random;
import java.util.concurrent.TimeUnit;

public class AllocateFreeBenchmark {

    static final long PAGE_SIZE = 4096;

    @State(Scope.Benchmark)
    public static class BenchmarkState {

        @Param({"10000"})
        private int liveRegions;

        @Param({"4"})
        private int maxPages;

        private RegionAllocator allocator;
        private long[] addresses;
        private long[] sizes;
        private Random random;

        @Setup(Level.Iteration)
        public void setup() throws AllocationException {
            allocator = new RegionAllocatorBuilder()
                    .setPageSize(PAGE_SIZE)
                    .setAddressSpace(PAGE_SIZE, PAGE_SIZE * (4L * liveRegions * maxPages + 1))
                    .setMemoryCapacity(PAGE_SIZE * 4L * liveRegions * maxPages)
                    .setInitialRegionCapacity(liveRegions)
                    .build();
            random = new Random(42);
            addresses = new long[liveRegions];
            sizes = new long[liveRegions];
            for (int i = 0; i < liveRegions; ++i) {
                sizes[i] = (1 + random.nextInt(maxPages)) * PAGE_SIZE;
                addresses[i] = allocator.allocate(sizes[i]);
            }
        }

        @TearDown(Level.Iteration)
        public void closeAllocator() {
            System.out.println("Live regions at tearDown " + allocator.regionCount());
            allocator.close();
        }
    }

    // Frees a random live region and allocates a new one of a random size, keeping the population stable
    @Warmup(iterations = 5)
    @Measurement(iterations = 10)
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    @Fork(value = 1)
    @Benchmark
    public void churn(Blackhole blackhole, BenchmarkState state)
            throws AllocationException, InvalidFreeException {
        int i = state.random.nextInt(state.liveRegions);
        state.allocator.free(state.addresses[i]);
        state.addresses[i] = state.allocator.allocate((1 + state.random.nextInt(state.maxPages)) * PAGE_SIZE);
        blackhole.consume(state.addresses[i]);
    }

    @Warmup(iterations = 5)
    @Measurement(iterations = 10)
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    @Fork(value = 1)
    @Benchmark
    public void resolve(Blackhole blackhole, BenchmarkState state) {
        int i = state.random.nextInt(state.liveRegions);
        blackhole.consume(state.allocator.resolve(state.addresses[i]));
    }

    //java -jar ./benchmarks/jmh/target/benchmarks.jar churn -p liveRegions=100000
    public static void main(String[] args) throws RunnerException {
        Options opt = new OptionsBuilder()
                .include(AllocateFreeBenchmark.class.getSimpleName())
                .forks(1)
                .threads(1)
                .build();

        new Runner(opt).run();
    }
}
