package io.github.kusoroadeolu.oneshot;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static io.github.kusoroadeolu.oneshot.FutureError.*;
import static io.github.kusoroadeolu.oneshot.FutureState.*;

/**
 * A one shot future: completed once by a single producer, consumed once by {@link #get(int, ValueHolder)}.
 * Any number of threads may {@link #await(int)} without consuming.
 *
 * <p>Expected outcomes are reported as a {@link FutureError}, nothing is thrown across threads.
 * Callers must make sure no other thread is inside {@code await} or {@code get} when they call
 * {@link #destroy()} or {@link #delete()}. Such waiters are woken and see {@link FutureError#INVALID_STATE}.
 */
public class FutureValue<V> implements AutoCloseable {
    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class
    );

    private final Class<V> valueType;
    private final ReentrantLock lock;
    private final Condition completion;

    //Both guarded by lock
    private FutureState state;
    private @Nullable V value;

    private FutureValue(Class<V> valueType) {
        this.valueType = valueType;
        this.lock = new ReentrantLock();
        this.completion = lock.newCondition();
        this.state = CREATED;
    }

    public static <V> @NonNull FutureValue<V> create(@NonNull Class<V> valueType) {
        Objects.requireNonNull(valueType, "valueType");
        try {
            return new FutureValue<>(boxed(valueType));
        } catch (OutOfMemoryError e) {
            throw new FutureException(ALLOCATION_FAILURE, e);
        }
    }

    public FutureError complete(@NonNull V value) {
        Objects.requireNonNull(value, "value");
        if (!valueType.isInstance(value)) return SIZE_MISMATCH; //Only reachable through raw types

        lock.lock();
        try {
            if (state != CREATED) return INVALID_STATE;
            this.value = value;
            this.state = COMPLETED;
            completion.signalAll();
            return SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    //Does not consume, may be called by any number of threads, any number of times
    public FutureError await(int timeoutMs) {
        var deadline = Deadline.afterMillis(timeoutMs);
        lock.lock();
        try {
            return awaitCompletion(deadline);
        } finally {
            lock.unlock();
        }
    }

    public FutureError get(int timeoutMs, @NonNull ValueHolder<?> destination) {
        Objects.requireNonNull(destination, "destination");
        if (!destination.type().equals(valueType)) return SIZE_MISMATCH; //Fail before we block

        var deadline = Deadline.afterMillis(timeoutMs);
        lock.lock();
        try {
            var err = awaitCompletion(deadline);
            if (err != SUCCESS) return err;

            destination.set(value);
            this.value = null;
            this.state = CONSUMED;
            return SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    public @NonNull V getOrThrow(int timeoutMs) {
        var holder = ValueHolder.of(valueType);
        var err = get(timeoutMs, holder);
        if (err != SUCCESS) throw new FutureException(err);
        return holder.value();
    }

    //Teardown for a future owned by another object, the owner keeps its reference
    public FutureError destroy() {
        lock.lock();
        try {
            if (state == DESTROYED) return INVALID_STATE;
            this.state = DESTROYED;
            this.value = null;
            completion.signalAll(); //Stragglers wake up and see DESTROYED
            return SUCCESS;
        } finally {
            lock.unlock();
        }
    }

    //Teardown for a future handed out by create()
    public FutureError delete() {
        return destroy();
    }

    @Override
    public void close() {
        delete();
    }

    public FutureState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isComplete() {
        return state().isPublished();
    }

    public boolean isValid() {
        return state().isValid();
    }

    public Class<V> valueType() {
        return valueType;
    }

    //Must hold lock. The loop guards against spurious wakeups, the deadline never moves
    private FutureError awaitCompletion(Deadline deadline) {
        while (state == CREATED) {
            long remaining = deadline.remainingNanos();
            if (remaining <= 0L) return TIMED_OUT;
            try {
                completion.awaitNanos(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return INTERRUPTED;
            } catch (IllegalMonitorStateException e) {
                return UNKNOWN_ERROR;
            }
        }

        return state == COMPLETED ? SUCCESS : INVALID_STATE;
    }

    @SuppressWarnings("unchecked")
    static <T> Class<T> boxed(Class<T> type) {
        if (!type.isPrimitive()) return type;
        if (type == void.class) throw new IllegalArgumentException("void cannot be a value type");
        return (Class<T>) WRAPPERS.get(type);
    }

    @Override
    public String toString() {
        return "FutureValue[" + valueType.getSimpleName() + ", " + state() + "]";
    }
}
