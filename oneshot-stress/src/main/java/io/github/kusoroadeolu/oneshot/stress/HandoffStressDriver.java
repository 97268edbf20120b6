package io.github.kusoroadeolu.oneshot.stress;

import io.github.kusoroadeolu.oneshot.FutureError;
import io.github.kusoroadeolu.oneshot.FutureValue;
import io.github.kusoroadeolu.oneshot.ValueHolder;

import java.util.ArrayList;
import java.util.Random;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stress driver looking for lost wakeups and double deliveries under real thread scheduling.
 *
 * Strategy:
 *  - Each round creates one future, a producer that completes it after a small random delay,
 *    and a handful of consumers racing to get it.
 *  - Exactly one consumer must receive the value, the rest must see INVALID_STATE.
 *  - A consumer that times out although the producer finished long ago is a lost wakeup.
 */
public class HandoffStressDriver {

    // ---- Tuning knobs ----
    static final int ROUNDS           = 2_000;
    static final int CONSUMERS        = 4;
    static final int MAX_DELAY_MICROS = 200;
    static final int GET_TIMEOUT_MS   = 5_000; //Far longer than any producer delay
    static final long TEST_TIMEOUT_SEC = 120;

    // ---- Counters ----
    static final AtomicInteger deliveries     = new AtomicInteger();
    static final AtomicInteger doubleDelivery = new AtomicInteger();
    static final AtomicInteger lostWakeups    = new AtomicInteger();
    static final AtomicInteger unexpected     = new AtomicInteger();

    public static void main(String[] args) throws InterruptedException {
        System.out.println("=== Handoff Stress Test ===");
        System.out.printf("Rounds: %d | Consumers: %d | Max delay: %dus%n%n", ROUNDS, CONSUMERS, MAX_DELAY_MICROS);

        var executor = Executors.newFixedThreadPool(CONSUMERS + 1);
        var rng = new Random(31L);
        long start = System.currentTimeMillis();

        try {
            for (int i = 0; i < ROUNDS; i++) {
                runRound(executor, i, rng.nextInt(MAX_DELAY_MICROS));
            }
        } finally {
            executor.shutdown();
        }

        boolean finished = executor.awaitTermination(TEST_TIMEOUT_SEC, TimeUnit.SECONDS);
        long elapsed = System.currentTimeMillis() - start;

        System.out.println("=== Results ===");
        System.out.printf("Elapsed         : %dms%n", elapsed);
        System.out.printf("Deliveries      : %d%n", deliveries.get());
        System.out.printf("Double delivery : %d%n", doubleDelivery.get());
        System.out.printf("Lost wakeups    : %d%n", lostWakeups.get());
        System.out.printf("Unexpected codes: %d%n", unexpected.get());

        if (!finished || deliveries.get() != ROUNDS || doubleDelivery.get() + lostWakeups.get() + unexpected.get() > 0) {
            System.out.println("\n!!! HANDOFF INVARIANT BROKEN");
            System.exit(1);
        } else {
            System.out.println("\n✓ Every value delivered exactly once.");
        }
    }

    static void runRound(ExecutorService executor, int round, int delayMicros) throws InterruptedException {
        var future = FutureValue.create(Integer.class);
        var startGate = new CountDownLatch(1);
        var results = new ArrayList<Future<FutureError>>();

        for (int c = 0; c < CONSUMERS; c++) {
            results.add(executor.submit(() -> {
                startGate.await();
                var holder = ValueHolder.of(Integer.class);
                var err = future.get(GET_TIMEOUT_MS, holder);
                if (err.isSuccess() && holder.value() != round) unexpected.incrementAndGet();
                return err;
            }));
        }

        executor.submit(() -> {
            startGate.await();
            TimeUnit.MICROSECONDS.sleep(delayMicros);
            return future.complete(round);
        });

        startGate.countDown();

        int successes = 0;
        for (var result : results) {
            try {
                switch (result.get()) {
                    case SUCCESS -> successes++;
                    case INVALID_STATE -> { }
                    case TIMED_OUT -> lostWakeups.incrementAndGet();
                    default -> unexpected.incrementAndGet();
                }
            } catch (ExecutionException e) {
                System.out.println("!!! Consumer threw exception in round " + round + ": " + e.getCause());
                unexpected.incrementAndGet();
            }
        }

        if (successes == 1) deliveries.incrementAndGet();
        else if (successes > 1) doubleDelivery.incrementAndGet();
        future.delete();
    }
}
