package org.endlesssource.playtally.api;

import java.util.Optional;

/**
 * Listener for playback notifications delivered by a {@link MediaCatalog}
 */
public interface PlaybackListener {

    /**
     * Called when the now playing item changes
     * @param track The new now playing track (empty if none)
     */
    default void onNowPlayingChanged(Optional<CatalogTrack> track) {}

    /**
     * Called when playback state changes
     * @param state The new playback state
     */
    default void onPlaybackStateChanged(PlaybackState state) {}
}
