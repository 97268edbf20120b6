package io.github.kusoroadeolu.oneshot;

/*
* CREATED -> COMPLETED -> CONSUMED
* CREATED | COMPLETED | CONSUMED -> DESTROYED
* Only mutated while holding the owning future's lock
* */
public enum FutureState {
    CREATED,
    COMPLETED,
    CONSUMED,
    DESTROYED;

    public boolean isValid() {
        return this == CREATED || this == COMPLETED;
    }

    public boolean isPublished() {
        return this == COMPLETED || this == CONSUMED;
    }
}
