package io.github.kusoroadeolu.oneshot;

import java.util.Objects;

/**
 * Raised where a {@link FutureError} cannot be returned, i.e. when a future cannot be created, or
 * when the caller asked for exceptions through {@link FutureValue#getOrThrow(int)}.
 */
public class FutureException extends RuntimeException {
    private final FutureError error;

    public FutureException(FutureError error) {
        super(FutureError.errorToString(error));
        this.error = Objects.requireNonNull(error, "error");
    }

    public FutureException(FutureError error, Throwable cause) {
        super(FutureError.errorToString(error), cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    public FutureError error() {
        return error;
    }
}
