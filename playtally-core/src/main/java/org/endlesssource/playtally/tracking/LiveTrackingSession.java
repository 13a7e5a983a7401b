package org.endlesssource.playtally.tracking;

import org.endlesssource.playtally.api.CatalogTrack;
import org.endlesssource.playtally.api.PlayTallyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks listened time of the currently playing track and reports at most one
 * {@link LivePlay} per continuous listen.
 * <p>
 * The session is either idle or tracking. While idle it may retain the last
 * track so that a resume continues the same listen. Not thread-safe: all calls
 * are expected from the engine's single playback thread.
 */
public class LiveTrackingSession {
    private static final Logger logger = LoggerFactory.getLogger(LiveTrackingSession.class);

    public enum State {
        IDLE,
        TRACKING
    }

    private final LivePlayRecorder recorder;

    private CatalogTrack track;
    private Instant sessionStartedAt;
    private Instant segmentStartedAt;
    private Duration accumulated = Duration.ZERO;
    private boolean completionEmitted;
    private State state = State.IDLE;

    public LiveTrackingSession(LivePlayRecorder recorder) {
        this.recorder = Objects.requireNonNull(recorder, "recorder must not be null");
    }

    public void onEvent(PlaybackEvent event) {
        Instant now = event.at();
        switch (event.type()) {
            case TRACK_CHANGED -> {
                finalizeSession(now);
                if (event.playing() && event.track().isPresent()) {
                    startTracking(event.track().get(), now);
                }
            }
            case PLAYBACK_STARTED -> onStarted(event.track(), now);
            case PLAYBACK_PAUSED, PLAYBACK_STOPPED, PLAYBACK_INTERRUPTED -> pause(now);
        }
    }

    private void onStarted(Optional<CatalogTrack> playing, Instant now) {
        if (playing.isEmpty()) {
            if (track != null && state == State.IDLE) {
                resume(now);
            }
            return;
        }
        CatalogTrack current = playing.get();
        if (track != null && track.id().equals(current.id())) {
            if (state == State.IDLE) {
                resume(now);
            }
            return;
        }
        // A different track started without a change notification reaching us first.
        finalizeSession(now);
        startTracking(current, now);
    }

    private void startTracking(CatalogTrack newTrack, Instant now) {
        logger.debug("Starting playback tracking: {}", newTrack.label());
        track = newTrack;
        sessionStartedAt = now;
        segmentStartedAt = now;
        accumulated = Duration.ZERO;
        completionEmitted = false;
        state = State.TRACKING;
    }

    private void resume(Instant now) {
        logger.debug("Resuming playback tracking: {}", track.label());
        segmentStartedAt = now;
        state = State.TRACKING;
    }

    private void pause(Instant now) {
        if (state != State.TRACKING) {
            return;
        }
        accumulated = accumulated.plus(elapsedSince(segmentStartedAt, now));
        segmentStartedAt = null;
        state = State.IDLE;
        logger.debug("Pausing playback tracking: {} ({}s listened)", track.label(), accumulated.toSeconds());
    }

    /**
     * Periodic progress check while tracking.
     */
    public void tick(Instant now) {
        if (state != State.TRACKING || completionEmitted) {
            return;
        }
        Duration provisional = accumulated.plus(elapsedSince(segmentStartedAt, now));
        if (CompletionEvaluator.isComplete(provisional, track.duration())) {
            emit(provisional, now);
        }
    }

    /**
     * Close the current listen: emit it if it qualified and was not reported yet,
     * then forget the track.
     */
    public void finalizeSession(Instant now) {
        if (track == null) {
            return;
        }
        if (state == State.TRACKING) {
            accumulated = accumulated.plus(elapsedSince(segmentStartedAt, now));
        }
        if (!completionEmitted) {
            if (CompletionEvaluator.isComplete(accumulated, track.duration())) {
                emit(accumulated, now);
            } else if (track.duration().isZero()) {
                logger.debug("Skipped {}: no track duration available", track.label());
            } else {
                logger.debug("Skipped {}: {}% listened", track.label(),
                        Math.round(CompletionEvaluator.completionRatio(accumulated, track.duration()) * 100));
            }
        }
        track = null;
        sessionStartedAt = null;
        segmentStartedAt = null;
        accumulated = Duration.ZERO;
        completionEmitted = false;
        state = State.IDLE;
    }

    private void emit(Duration listened, Instant now) {
        // Set first: a failed write is dropped, never retried.
        completionEmitted = true;
        double ratio = CompletionEvaluator.completionRatio(listened, track.duration());
        LivePlay play = new LivePlay(track, now, listened, track.duration(), ratio);
        logger.info("Play completed: {} ({}s / {}s, {}%)", track.label(), listened.toSeconds(),
                track.duration().toSeconds(), Math.round(ratio * 100));
        try {
            recorder.record(play);
        } catch (PlayTallyException e) {
            logger.warn("Dropped live play of {}: {}", track.label(), e.getMessage());
        }
    }

    private static Duration elapsedSince(Instant start, Instant now) {
        if (start == null || now.isBefore(start)) {
            return Duration.ZERO;
        }
        return Duration.between(start, now);
    }

    public State getState() {
        return state;
    }

    public Optional<CatalogTrack> getTrack() {
        return Optional.ofNullable(track);
    }

    public Optional<Instant> getSessionStartedAt() {
        return Optional.ofNullable(sessionStartedAt);
    }

    /**
     * @return listened time of closed segments, excluding the running one
     */
    public Duration getAccumulated() {
        return accumulated;
    }

    public boolean isCompletionEmitted() {
        return completionEmitted;
    }
}
