package io.github.kusoroadeolu.oneshot;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Destination for {@link FutureValue#get(int, ValueHolder)}. The holder's type must match the
 * future's value type exactly, otherwise the get fails with {@link FutureError#SIZE_MISMATCH}.
 */
public final class ValueHolder<T> {
    private final Class<T> type;
    private @Nullable T value;
    private boolean isSet;

    private ValueHolder(Class<T> type) {
        this.type = type;
    }

    public static <T> ValueHolder<T> of(@NonNull Class<T> type) {
        return new ValueHolder<>(FutureValue.boxed(Objects.requireNonNull(type, "type")));
    }

    public Class<T> type() {
        return type;
    }

    public boolean isSet() {
        return isSet;
    }

    public @NonNull T value() {
        if (!isSet) throw new IllegalStateException("No value has been received");
        return value;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public void clear() {
        this.value = null;
        this.isSet = false;
    }

    //Only the future writes here, after it has checked the type
    void set(Object value) {
        this.value = type.cast(value);
        this.isSet = true;
    }
}
