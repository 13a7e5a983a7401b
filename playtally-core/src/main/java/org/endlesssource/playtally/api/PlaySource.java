package org.endlesssource.playtally.api;

/**
 * Where a {@link PlayFact} came from.
 */
public enum PlaySource {
    /** Observed while the engine was watching playback. */
    LIVE,
    /** Recovered from a system play counter increment; timestamp is estimated. */
    COUNTER_SYNC
}
