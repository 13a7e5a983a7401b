package org.endlesssource.playtally.api;

import java.time.Instant;
import java.util.Objects;

/**
 * Small persisted record of engine-wide bookkeeping.
 *
 * @param librarySeeded  whether the first-run library walk has completed
 * @param lastFullSyncAt when the last full catalog reconciliation finished
 */
public record EngineState(boolean librarySeeded, Instant lastFullSyncAt) {
    public EngineState(boolean librarySeeded, Instant lastFullSyncAt) {
        this.librarySeeded = librarySeeded;
        this.lastFullSyncAt = Objects.requireNonNull(lastFullSyncAt, "lastFullSyncAt must not be null");
    }

    public static EngineState initial() {
        return new EngineState(false, Instant.EPOCH);
    }

    public EngineState withLibrarySeeded(boolean seeded) {
        return new EngineState(seeded, lastFullSyncAt);
    }

    public EngineState withLastFullSyncAt(Instant syncedAt) {
        return new EngineState(librarySeeded, syncedAt);
    }
}
