package org.endlesssource.playtally.tracking;

/**
 * Receives qualifying listens from a {@link LiveTrackingSession}.
 */
@FunctionalInterface
public interface LivePlayRecorder {

    /**
     * Persist a detected play.
     * @throws org.endlesssource.playtally.api.PersistenceException if the play could not be stored
     */
    void record(LivePlay play);
}
