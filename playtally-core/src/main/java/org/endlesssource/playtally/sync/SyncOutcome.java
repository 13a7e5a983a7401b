package org.endlesssource.playtally.sync;

import java.util.Objects;

/**
 * What a scheduled sync did.
 */
public record SyncOutcome(Kind kind, ReconciliationReport report) {

    public enum Kind {
        /** Whole catalog reconciled. */
        FULL,
        /** Only the currently playing track reconciled. */
        QUICK,
        /** Nothing to do, or another sync was already running. */
        SKIPPED
    }

    public SyncOutcome {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(report, "report must not be null");
    }

    public static SyncOutcome full(ReconciliationReport report) {
        return new SyncOutcome(Kind.FULL, report);
    }

    public static SyncOutcome quick(ReconciliationReport report) {
        return new SyncOutcome(Kind.QUICK, report);
    }

    public static SyncOutcome skipped() {
        return new SyncOutcome(Kind.SKIPPED, ReconciliationReport.empty());
    }
}
