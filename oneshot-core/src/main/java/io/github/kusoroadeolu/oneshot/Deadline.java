package io.github.kusoroadeolu.oneshot;

import java.util.concurrent.TimeUnit;

/**
 * An absolute point in {@link System#nanoTime()} time, computed once when a blocking call starts so
 * repeated wakeups never extend the total wait.
 */
public final class Deadline {
    private final long startNanos;
    private final long deadlineNanos;

    private Deadline(long startNanos, long timeoutNanos) {
        this.startNanos = startNanos;
        this.deadlineNanos = startNanos + timeoutNanos;
    }

    //Negative timeouts behave like zero, a single non blocking check
    public static Deadline afterMillis(int timeoutMs) {
        long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0, timeoutMs));
        return new Deadline(System.nanoTime(), timeoutNanos);
    }

    public long remainingNanos() {
        return deadlineNanos - System.nanoTime();
    }

    public boolean isExpired() {
        return remainingNanos() <= 0;
    }

    public long elapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
