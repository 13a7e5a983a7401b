package org.endlesssource.playtally.api;

/**
 * How far a platform's library keeps its own play counters.
 * Counter reconciliation only finds plays that happened while the engine was
 * not listening when the counters exist.
 */
public enum PlayCounterSupport {
    /** The system library counts every play. */
    SYSTEM,
    /** Counters exist only if the active player publishes them. */
    PLAYER_DEPENDENT,
    /** No counters; only live listens are recorded. */
    NONE;

    /**
     * @return true when this support level is more useful than {@code other}
     */
    public boolean isBetterThan(PlayCounterSupport other) {
        return ordinal() < other.ordinal();
    }
}
