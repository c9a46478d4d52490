package com.regulatory.conflict.store;

import com.regulatory.conflict.core.model.Conflict;

/**
 * Result of writing a detection candidate to the conflict store.
 *
 * @param conflict the conflict as stored after the write
 * @param kind     what the write did
 */
public record UpsertResult(Conflict conflict, Kind kind) {

    public enum Kind {
        /** A new conflict row was created. */
        CREATED,
        /** The active conflict for the key received new facts. */
        UPDATED,
        /** The stored conflict already reflected the facts; nothing was written. */
        UNCHANGED
    }

    public boolean isChanged() {
        return kind != Kind.UNCHANGED;
    }
}
