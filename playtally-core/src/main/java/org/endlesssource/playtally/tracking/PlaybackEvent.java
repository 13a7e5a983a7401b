package org.endlesssource.playtally.tracking;

import org.endlesssource.playtally.api.CatalogTrack;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Discrete playback fact reported by the {@link PlaybackSampler}.
 *
 * @param type    what happened
 * @param track   now playing track at the time of the event, if any
 * @param playing whether the player is running after the event
 * @param at      when the sampler observed it
 */
public record PlaybackEvent(Type type, Optional<CatalogTrack> track, boolean playing, Instant at) {

    public enum Type {
        TRACK_CHANGED,
        PLAYBACK_STARTED,
        PLAYBACK_PAUSED,
        PLAYBACK_STOPPED,
        PLAYBACK_INTERRUPTED
    }

    public PlaybackEvent {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(track, "track must not be null");
        Objects.requireNonNull(at, "at must not be null");
    }

    public static PlaybackEvent trackChanged(CatalogTrack track, boolean playing, Instant at) {
        return new PlaybackEvent(Type.TRACK_CHANGED, Optional.ofNullable(track), playing, at);
    }

    public static PlaybackEvent started(CatalogTrack track, Instant at) {
        return new PlaybackEvent(Type.PLAYBACK_STARTED, Optional.ofNullable(track), true, at);
    }

    public static PlaybackEvent paused(CatalogTrack track, Instant at) {
        return new PlaybackEvent(Type.PLAYBACK_PAUSED, Optional.ofNullable(track), false, at);
    }

    public static PlaybackEvent stopped(CatalogTrack track, Instant at) {
        return new PlaybackEvent(Type.PLAYBACK_STOPPED, Optional.ofNullable(track), false, at);
    }

    public static PlaybackEvent interrupted(CatalogTrack track, Instant at) {
        return new PlaybackEvent(Type.PLAYBACK_INTERRUPTED, Optional.ofNullable(track), false, at);
    }
}
