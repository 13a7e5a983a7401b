package org.endlesssource.playtally.sync;

/**
 * Progress callback for long catalog passes, invoked after every committed batch.
 */
@FunctionalInterface
public interface SyncProgressListener {
    SyncProgressListener NONE = (processed, total, lastTrack) -> {};

    /**
     * @param processed tracks committed so far
     * @param total     tracks in the catalog snapshot
     * @param lastTrack label of the last track of the batch
     */
    void onProgress(int processed, int total, String lastTrack);
}
