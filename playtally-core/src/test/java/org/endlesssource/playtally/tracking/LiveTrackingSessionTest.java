package org.endlesssource.playtally.tracking;

import org.endlesssource.playtally.api.CatalogTrack;
import org.endlesssource.playtally.api.PersistenceException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LiveTrackingSessionTest {
    private static final Instant T0 = Instant.parse("2026-10-17T10:00:00Z");
    private static final CatalogTrack SONG = new CatalogTrack("a", "Song A", "Artist", "Album",
            Duration.ofSeconds(200), 4);
    private static final CatalogTrack OTHER = new CatalogTrack("b", "Song B", "Artist", "Album",
            Duration.ofSeconds(100), 0);
    private static final CatalogTrack NO_DURATION = new CatalogTrack("c", "Stream", "Artist", "",
            Duration.ZERO, 0);

    private final List<LivePlay> plays = new ArrayList<>();
    private final LiveTrackingSession session = new LiveTrackingSession(plays::add);

    private static Instant at(long seconds) {
        return T0.plusSeconds(seconds);
    }

    private void tickEverySecond(long fromSeconds, long toSeconds) {
        for (long s = fromSeconds; s <= toSeconds; s++) {
            session.tick(at(s));
        }
    }

    @Test
    void trackChangeWhilePlaying_startsTracking() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));

        assertEquals(LiveTrackingSession.State.TRACKING, session.getState());
        assertEquals("a", session.getTrack().orElseThrow().id());
        assertEquals(at(0), session.getSessionStartedAt().orElseThrow());
        assertEquals(Duration.ZERO, session.getAccumulated());
    }

    @Test
    void trackChangeWhilePaused_staysIdleWithoutTrack() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, false, at(0)));

        assertEquals(LiveTrackingSession.State.IDLE, session.getState());
        assertTrue(session.getTrack().isEmpty());
    }

    @Test
    void tick_emitsOnceWhenHalfwayIsCrossed() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));

        tickEverySecond(1, 99);
        assertTrue(plays.isEmpty());

        session.tick(at(100));
        assertEquals(1, plays.size());
        LivePlay play = plays.get(0);
        assertEquals(Duration.ofSeconds(100), play.listened());
        assertEquals(Duration.ofSeconds(200), play.trackDuration());
        assertEquals(0.5, play.completionRatio(), 1e-9);
        assertEquals(at(100), play.completedAt());
        assertTrue(session.isCompletionEmitted());
    }

    @Test
    void continuousListenToTheEnd_thenPause_emitsExactlyOnce() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));
        tickEverySecond(1, 200);
        session.onEvent(PlaybackEvent.paused(SONG, at(200)));
        session.finalizeSession(at(300));

        assertEquals(1, plays.size());
    }

    @Test
    void pauseAndResume_accumulatesAcrossSegments() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));
        session.onEvent(PlaybackEvent.paused(SONG, at(60)));
        assertEquals(LiveTrackingSession.State.IDLE, session.getState());
        assertEquals(Duration.ofSeconds(60), session.getAccumulated());

        // time spent paused does not count
        session.tick(at(500));
        assertTrue(plays.isEmpty());

        session.onEvent(PlaybackEvent.started(SONG, at(1000)));
        assertEquals(LiveTrackingSession.State.TRACKING, session.getState());
        assertEquals(Duration.ofSeconds(60), session.getAccumulated());

        session.tick(at(1039));
        assertTrue(plays.isEmpty());
        session.tick(at(1040));
        assertEquals(1, plays.size());
        assertEquals(Duration.ofSeconds(100), plays.get(0).listened());
    }

    @Test
    void stopAndInterruption_pauseWithoutFinalizing() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));
        session.onEvent(PlaybackEvent.interrupted(SONG, at(30)));
        session.onEvent(PlaybackEvent.started(SONG, at(40)));
        session.onEvent(PlaybackEvent.stopped(SONG, at(70)));

        assertEquals(Duration.ofSeconds(60), session.getAccumulated());
        assertEquals("a", session.getTrack().orElseThrow().id());
        assertTrue(plays.isEmpty());
    }

    @Test
    void finalize_catchesQualifyingListenMissedByTicks() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));
        // app suspended: no ticks delivered
        session.onEvent(PlaybackEvent.trackChanged(OTHER, true, at(150)));

        assertEquals(1, plays.size());
        assertEquals("a", plays.get(0).track().id());
        assertEquals(Duration.ofSeconds(150), plays.get(0).listened());
        assertEquals("b", session.getTrack().orElseThrow().id());
        assertFalse(session.isCompletionEmitted());
    }

    @Test
    void skippedTrack_isNotCounted() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));
        session.onEvent(PlaybackEvent.trackChanged(OTHER, true, at(30)));

        assertTrue(plays.isEmpty());
    }

    @Test
    void unknownDuration_isNeverCounted() {
        session.onEvent(PlaybackEvent.trackChanged(NO_DURATION, true, at(0)));
        tickEverySecond(1, 600);
        session.finalizeSession(at(600));

        assertTrue(plays.isEmpty());
    }

    @Test
    void startedWithDifferentTrack_finalizesPrevious() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));
        session.onEvent(PlaybackEvent.paused(SONG, at(120)));
        session.onEvent(PlaybackEvent.started(OTHER, at(130)));

        assertEquals(1, plays.size());
        assertEquals("a", plays.get(0).track().id());
        assertEquals("b", session.getTrack().orElseThrow().id());
        assertEquals(LiveTrackingSession.State.TRACKING, session.getState());
    }

    @Test
    void startedFromIdle_withoutRetainedTrack_startsNewSession() {
        session.onEvent(PlaybackEvent.started(OTHER, at(0)));
        session.tick(at(50));

        assertEquals(1, plays.size());
        assertEquals("b", plays.get(0).track().id());
    }

    @Test
    void finalize_resetsToIdleWithoutTrack() {
        session.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));
        session.finalizeSession(at(10));

        assertEquals(LiveTrackingSession.State.IDLE, session.getState());
        assertTrue(session.getTrack().isEmpty());
        assertEquals(Duration.ZERO, session.getAccumulated());
    }

    @Test
    void failedWrite_isDroppedAndNotRetried() {
        List<LivePlay> attempts = new ArrayList<>();
        LiveTrackingSession failing = new LiveTrackingSession(play -> {
            attempts.add(play);
            throw new PersistenceException("disk full");
        });

        failing.onEvent(PlaybackEvent.trackChanged(SONG, true, at(0)));
        failing.tick(at(100));
        failing.tick(at(150));
        failing.finalizeSession(at(200));

        assertEquals(1, attempts.size());
    }
}
