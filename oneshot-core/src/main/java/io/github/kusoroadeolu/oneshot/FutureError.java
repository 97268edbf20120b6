package io.github.kusoroadeolu.oneshot;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of every {@link FutureValue} operation. Expected outcomes are returned, never thrown.
 */
public enum FutureError {
    SUCCESS("success"),
    TIMED_OUT("timed out waiting for completion"), //Recoverable, the future is still valid
    INVALID_STATE("future is already completed, consumed or destroyed"),
    SIZE_MISMATCH("destination type does not match the future's value type"),
    ALLOCATION_FAILURE("could not allocate the future"),
    INTERRUPTED("interrupted while waiting for completion"),
    UNKNOWN_ERROR("lock or condition failed unexpectedly");

    private final String description;

    FutureError(String description) {
        this.description = description;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    public String description() {
        return description;
    }

    public static @NonNull String errorToString(@Nullable FutureError error) {
        if (error == null) return "unknown error code";
        return error.description;
    }
}
