package io.github.kusoroadeolu.oneshot.benchmarks;

import io.github.kusoroadeolu.oneshot.FutureValue;
import io.github.kusoroadeolu.oneshot.ValueHolder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Baseline benchmark: single threaded, the value is always there before we ask for it.
 *
 * Goal: measure the floor cost of create, complete, get and delete vs a plain
 * CompletableFuture doing the same dance. No waiting, no contention.
 *
 * Run with:
 *   java -jar benchmarks.jar BaselineBenchmark -rf json -rff results.json
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 1)
@Fork(2)
public class BaselineBenchmark {

    private static final Integer VALUE = 42;

    private ValueHolder<Integer> holder;

    @Setup(Level.Trial)
    public void setup() {
        holder = ValueHolder.of(Integer.class);
    }

    // -------------------------------------------------------------------------
    // FutureValue
    // -------------------------------------------------------------------------

    @Benchmark
    public void futureValue_completeThenGet(Blackhole bh) {
        try (var future = FutureValue.create(Integer.class)) {
            future.complete(VALUE);
            bh.consume(future.get(0, holder));
            bh.consume(holder.value());
        }
    }

    @Benchmark
    public void futureValue_completeThenAwait(Blackhole bh) {
        try (var future = FutureValue.create(Integer.class)) {
            future.complete(VALUE);
            bh.consume(future.await(0));
        }
    }

    @Benchmark
    public void futureValue_pollEmpty(Blackhole bh) {
        try (var future = FutureValue.create(Integer.class)) {
            bh.consume(future.get(0, holder));
        }
    }

    // -------------------------------------------------------------------------
    // CompletableFuture, the baseline ceiling
    // -------------------------------------------------------------------------

    @Benchmark
    public void completableFuture_completeThenGet(Blackhole bh) throws ExecutionException, InterruptedException, TimeoutException {
        var future = new CompletableFuture<Integer>();
        future.complete(VALUE);
        bh.consume(future.get(0, TimeUnit.MILLISECONDS));
    }

    @Benchmark
    public void completableFuture_pollEmpty(Blackhole bh) {
        var future = new CompletableFuture<Integer>();
        bh.consume(future.getNow(null));
    }
}
