package org.endlesssource.playtally.api;

import java.util.List;
import java.util.Optional;

/**
 * Access to the user's media library and the system player observing it.
 * Implementations are supplied by platform modules.
 */
public interface MediaCatalog extends AutoCloseable {

    /**
     * Enumerate every track of the library, in stable catalog order.
     * @return library snapshot including current system play counters
     * @throws PermissionDeniedException if library access is not granted
     * @throws CatalogUnavailableException if the library cannot be read right now
     */
    List<CatalogTrack> enumerateTracks();

    /**
     * Whether the play counters returned by {@link #enumerateTracks()} are kept
     * by the library. When false every counter reads 0 and only live listens
     * can be recorded.
     */
    default boolean reportsPlayCounts() {
        return true;
    }

    /**
     * Get the track the system player currently has loaded
     * @return Optional containing the track, or empty if nothing is loaded
     */
    Optional<CatalogTrack> currentlyPlaying();

    /**
     * Get the current playback state of the system player
     * @return The current playback state
     */
    PlaybackState getPlaybackState();

    /**
     * Find a single library entry.
     * @param trackId stable library identifier
     * @return Optional containing the track if the library has it
     */
    default Optional<CatalogTrack> findTrack(String trackId) {
        Optional<CatalogTrack> playing = currentlyPlaying();
        if (playing.isPresent() && playing.get().id().equals(trackId)) {
            return playing;
        }
        return enumerateTracks().stream()
                .filter(track -> track.id().equals(trackId))
                .findFirst();
    }

    /**
     * Add a listener for playback notifications
     * @param listener The listener to add
     */
    void addPlaybackListener(PlaybackListener listener);

    /**
     * Remove a playback listener
     * @param listener The listener to remove
     */
    void removePlaybackListener(PlaybackListener listener);

    /**
     * Close and release resources held by this catalog.
     */
    @Override
    void close();
}
