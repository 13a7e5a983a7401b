package org.endlesssource.playtally.tracking;

import org.endlesssource.playtally.api.PlaybackState;
import org.endlesssource.playtally.test.FakeMediaCatalog;
import org.endlesssource.playtally.test.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PlaybackSamplerTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-17T10:00:00Z"));
    private final FakeMediaCatalog catalog = new FakeMediaCatalog()
            .add("a", "Song A", 200, 1)
            .add("b", "Song B", 180, 0);
    private final List<PlaybackEvent> events = new ArrayList<>();

    @Test
    void start_reportsTrackAlreadyPlaying() {
        catalog.preload("a", PlaybackState.PLAYING);
        PlaybackSampler sampler = new PlaybackSampler(catalog, events::add, clock);

        sampler.start();

        assertEquals(1, events.size());
        PlaybackEvent event = events.get(0);
        assertEquals(PlaybackEvent.Type.TRACK_CHANGED, event.type());
        assertTrue(event.playing());
        assertEquals("a", event.track().orElseThrow().id());
        assertEquals(1, catalog.listenerCount());
    }

    @Test
    void start_withNothingLoaded_reportsNothing() {
        new PlaybackSampler(catalog, events::add, clock).start();
        assertTrue(events.isEmpty());
    }

    @Test
    void playPauseAndSkip_becomeDiscreteEvents() {
        PlaybackSampler sampler = new PlaybackSampler(catalog, events::add, clock);
        sampler.start();

        catalog.play("a");
        catalog.pause();
        catalog.play("a");
        catalog.play("b");
        catalog.stop();

        List<PlaybackEvent.Type> types = events.stream().map(PlaybackEvent::type).toList();
        assertEquals(List.of(
                PlaybackEvent.Type.TRACK_CHANGED,
                PlaybackEvent.Type.PLAYBACK_STARTED,
                PlaybackEvent.Type.PLAYBACK_PAUSED,
                PlaybackEvent.Type.PLAYBACK_STARTED,
                PlaybackEvent.Type.TRACK_CHANGED,
                PlaybackEvent.Type.PLAYBACK_STOPPED), types);
        assertEquals("b", events.get(4).track().orElseThrow().id());
        assertTrue(events.get(4).playing());
    }

    @Test
    void repeatOfSameTrack_continuesTheListen() {
        PlaybackSampler sampler = new PlaybackSampler(catalog, events::add, clock);
        sampler.start();
        catalog.play("a");
        int before = events.size();

        catalog.replay();

        assertEquals(before, events.size());
        assertEquals("a", sampler.getLastTrack().orElseThrow().id());
    }

    @Test
    void sameTrackRefresh_andRepeatedState_areSuppressed() {
        PlaybackSampler sampler = new PlaybackSampler(catalog, events::add, clock);
        sampler.start();

        sampler.onPlaybackStateChanged(PlaybackState.PLAYING);
        sampler.onPlaybackStateChanged(PlaybackState.PLAYING);
        sampler.onNowPlayingChanged(Optional.of(catalog.track("a")));
        sampler.onNowPlayingChanged(Optional.of(catalog.track("a")));
        sampler.onPlaybackStateChanged(PlaybackState.UNKNOWN);

        assertEquals(2, events.size());
    }

    @Test
    void nowPlayingCleared_isATrackChangeToNothing() {
        PlaybackSampler sampler = new PlaybackSampler(catalog, events::add, clock);
        sampler.start();
        catalog.play("a");

        sampler.onNowPlayingChanged(Optional.empty());

        PlaybackEvent last = events.get(events.size() - 1);
        assertEquals(PlaybackEvent.Type.TRACK_CHANGED, last.type());
        assertTrue(last.track().isEmpty());
    }

    @Test
    void interruption_isReported() {
        PlaybackSampler sampler = new PlaybackSampler(catalog, events::add, clock);
        sampler.start();
        catalog.play("a");
        catalog.setState(PlaybackState.INTERRUPTED);

        assertEquals(PlaybackEvent.Type.PLAYBACK_INTERRUPTED, events.get(events.size() - 1).type());
    }

    @Test
    void eventsCarryClockTime() {
        PlaybackSampler sampler = new PlaybackSampler(catalog, events::add, clock);
        sampler.start();
        catalog.play("a");
        clock.advance(java.time.Duration.ofSeconds(42));
        catalog.pause();

        assertEquals(Instant.parse("2026-10-17T10:00:42Z"), events.get(events.size() - 1).at());
    }

    @Test
    void close_unsubscribes() {
        PlaybackSampler sampler = new PlaybackSampler(catalog, events::add, clock);
        sampler.start();
        sampler.close();

        catalog.play("a");

        assertEquals(0, catalog.listenerCount());
        assertTrue(events.isEmpty());
    }
}
