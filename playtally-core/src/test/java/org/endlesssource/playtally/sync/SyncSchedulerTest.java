package org.endlesssource.playtally.sync;

import org.endlesssource.playtally.api.CatalogUnavailableException;
import org.endlesssource.playtally.api.EngineState;
import org.endlesssource.playtally.api.PlaybackState;
import org.endlesssource.playtally.store.InMemoryPlayStore;
import org.endlesssource.playtally.test.FakeMediaCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class SyncSchedulerTest {
    private static final Duration FOUR_HOURS = Duration.ofHours(4);
    private static final Instant LAST_FULL = Instant.parse("2026-10-17T06:00:00Z");

    private FakeMediaCatalog catalog;
    private InMemoryPlayStore store;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        catalog = new FakeMediaCatalog()
                .add("a", "Song A", 200, 3)
                .add("b", "Song B", 180, 1);
        store = new InMemoryPlayStore();
        CounterReconciler reconciler = new CounterReconciler(catalog, store, new ReentrantLock(), 100,
                new Random(7));
        reconciler.reconcileAll(LAST_FULL);
        store.saveEngineState(new EngineState(true, LAST_FULL));
        scheduler = new SyncScheduler(reconciler, catalog, store, FOUR_HOURS);
    }

    @Test
    void fullSyncThreshold_isInclusive() {
        assertFalse(scheduler.shouldRunFullSync(LAST_FULL, LAST_FULL.plus(FOUR_HOURS).minusMillis(1)));
        assertTrue(scheduler.shouldRunFullSync(LAST_FULL, LAST_FULL.plus(FOUR_HOURS)));
        assertTrue(SyncScheduler.shouldRunFullSync(Instant.EPOCH, LAST_FULL, FOUR_HOURS));
    }

    @Test
    void exactlyFourHoursLater_runsFullSyncAndRecordsIt() {
        Instant now = LAST_FULL.plus(FOUR_HOURS);
        catalog.incrementPlayCount("b", 2);

        SyncOutcome outcome = scheduler.runScheduledSync(now);

        assertEquals(SyncOutcome.Kind.FULL, outcome.kind());
        assertEquals(2, outcome.report().playFactsCreated());
        assertEquals(now, store.loadEngineState().lastFullSyncAt());
        assertTrue(store.loadEngineState().librarySeeded());
    }

    @Test
    void recentFullSync_checksOnlyCurrentTrack() {
        Instant now = LAST_FULL.plus(Duration.ofHours(1));
        catalog.preload("a", PlaybackState.PAUSED);
        catalog.incrementPlayCount("a", 1);
        catalog.incrementPlayCount("b", 1);
        int enumerationsBefore = catalog.getEnumerations();

        SyncOutcome outcome = scheduler.runScheduledSync(now);

        assertEquals(SyncOutcome.Kind.QUICK, outcome.kind());
        assertEquals(1, outcome.report().playFactsCreated());
        assertEquals(1, store.countPlayFacts("a"));
        assertEquals(0, store.countPlayFacts("b"));
        assertEquals(enumerationsBefore, catalog.getEnumerations());
        assertEquals(LAST_FULL, store.loadEngineState().lastFullSyncAt());
    }

    @Test
    void recentFullSync_withNothingLoaded_skips() {
        SyncOutcome outcome = scheduler.runScheduledSync(LAST_FULL.plus(Duration.ofMinutes(5)));

        assertEquals(SyncOutcome.Kind.SKIPPED, outcome.kind());
        assertFalse(scheduler.isSyncing());
    }

    @Test
    void failedFullSync_doesNotAdvanceLastFullSync() {
        catalog.makeUnavailable();

        assertThrows(CatalogUnavailableException.class,
                () -> scheduler.runScheduledSync(LAST_FULL.plus(Duration.ofHours(5))));

        assertEquals(LAST_FULL, store.loadEngineState().lastFullSyncAt());
        assertFalse(scheduler.isSyncing());

        catalog.restore();
        assertEquals(SyncOutcome.Kind.FULL, scheduler.runScheduledSync(LAST_FULL.plus(Duration.ofHours(6))).kind());
    }
}
