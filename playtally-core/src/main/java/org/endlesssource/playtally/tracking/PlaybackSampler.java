package org.endlesssource.playtally.tracking;

import org.endlesssource.playtally.api.CatalogTrack;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PlaybackListener;
import org.endlesssource.playtally.api.PlaybackState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Turns the catalog's playback notifications into discrete {@link PlaybackEvent}s.
 * Metadata refreshes of the same track and repeated states are dropped.
 * <p>
 * A now-playing notification is compared by track id only, so a player on
 * repeat-one that starts the same track over continues the current listen.
 * At most one live play is reported for it; the extra plays reach the tally
 * through counter reconciliation.
 */
public class PlaybackSampler implements PlaybackListener, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackSampler.class);

    private final MediaCatalog catalog;
    private final Consumer<PlaybackEvent> sink;
    private final Clock clock;

    private Optional<CatalogTrack> lastTrack = Optional.empty();
    private PlaybackState lastState = PlaybackState.UNKNOWN;
    private boolean started;

    public PlaybackSampler(MediaCatalog catalog, Consumer<PlaybackEvent> sink, Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Subscribe to the catalog and report what is playing right now.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        catalog.addPlaybackListener(this);
        lastState = catalog.getPlaybackState();
        lastTrack = catalog.currentlyPlaying();
        if (lastTrack.isPresent()) {
            logger.debug("Initial now playing: {} ({})", lastTrack.get().label(), lastState);
            sink.accept(PlaybackEvent.trackChanged(lastTrack.get(), lastState == PlaybackState.PLAYING,
                    clock.instant()));
        }
    }

    @Override
    public synchronized void onNowPlayingChanged(Optional<CatalogTrack> track) {
        if (sameTrack(lastTrack, track)) {
            lastTrack = track;
            return;
        }
        lastTrack = track;
        logger.debug("Now playing changed: {}", track.map(CatalogTrack::label).orElse("<none>"));
        sink.accept(PlaybackEvent.trackChanged(track.orElse(null), lastState == PlaybackState.PLAYING,
                clock.instant()));
    }

    @Override
    public synchronized void onPlaybackStateChanged(PlaybackState state) {
        if (state == lastState || state == PlaybackState.UNKNOWN) {
            return;
        }
        lastState = state;
        CatalogTrack current = lastTrack.orElse(null);
        switch (state) {
            case PLAYING -> sink.accept(PlaybackEvent.started(current, clock.instant()));
            case PAUSED -> sink.accept(PlaybackEvent.paused(current, clock.instant()));
            case STOPPED -> sink.accept(PlaybackEvent.stopped(current, clock.instant()));
            case INTERRUPTED -> sink.accept(PlaybackEvent.interrupted(current, clock.instant()));
            default -> {
                // unknown states carry no transition
            }
        }
    }

    public synchronized Optional<CatalogTrack> getLastTrack() {
        return lastTrack;
    }

    private static boolean sameTrack(Optional<CatalogTrack> a, Optional<CatalogTrack> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty();
        }
        return a.get().id().equals(b.get().id());
    }

    @Override
    public synchronized void close() {
        if (started) {
            catalog.removePlaybackListener(this);
            started = false;
        }
    }
}
