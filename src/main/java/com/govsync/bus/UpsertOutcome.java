package com.govsync.bus;

/** Result of an insert-or-replace keyed by log id. */
public enum UpsertOutcome {
    CREATED,
    UPDATED,
    UNCHANGED;

    public MutationType mutation() {
        return switch (this) {
            case CREATED -> MutationType.CREATED;
            case UPDATED -> MutationType.UPDATED;
            case UNCHANGED -> throw new IllegalStateException("unchanged entries are not published");
        };
    }
}
