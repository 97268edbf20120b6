package io.github.kusoroadeolu.oneshot.benchmarks;

import io.github.kusoroadeolu.oneshot.FutureError;
import io.github.kusoroadeolu.oneshot.FutureValue;
import io.github.kusoroadeolu.oneshot.ValueHolder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cross thread handoff benchmark: a producer thread completes, the benchmark thread blocks in get.
 *
 * Goal: measure the round trip of handing one request to a parked producer and
 * blocking until its response comes back, which is the use case the future exists for.
 *
 * What to look for:
 *  - The cost of parking and waking on the future's condition vs CompletableFuture's park
 *  - Whether the lock adds noticeable latency over the lock free baseline
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(2)
public class HandoffBenchmark {

    private static final int TIMEOUT_MS = 1_000;

    private SynchronousQueue<Runnable> requests;
    private Thread producer;
    private ValueHolder<Integer> holder;

    @Setup(Level.Trial)
    public void setup() {
        requests = new SynchronousQueue<>();
        holder = ValueHolder.of(Integer.class);
        producer = new Thread(() -> {
            try {
                while (!Thread.currentThread().isInterrupted()) requests.take().run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "handoff-producer");
        producer.setDaemon(true);
        producer.start();
    }

    @TearDown(Level.Trial)
    public void tearDown() throws InterruptedException {
        producer.interrupt();
        producer.join();
    }

    @Benchmark
    public void futureValue_roundTrip(Blackhole bh) throws InterruptedException {
        try (var future = FutureValue.create(Integer.class)) {
            requests.put(() -> future.complete(42));
            var err = future.get(TIMEOUT_MS, holder);
            if (err != FutureError.SUCCESS) throw new IllegalStateException(FutureError.errorToString(err));
            bh.consume(holder.value());
        }
    }

    @Benchmark
    public void completableFuture_roundTrip(Blackhole bh) throws InterruptedException, ExecutionException, TimeoutException {
        var future = new CompletableFuture<Integer>();
        requests.put(() -> future.complete(42));
        bh.consume(future.get(TIMEOUT_MS, TimeUnit.MILLISECONDS));
    }
}
