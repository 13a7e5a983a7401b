package org.endlesssource.playtally.sync;

import org.endlesssource.playtally.api.PermissionDeniedException;
import org.endlesssource.playtally.store.InMemoryPlayStore;
import org.endlesssource.playtally.test.FakeMediaCatalog;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

import static org.junit.jupiter.api.Assertions.*;

class LibrarySeederTest {
    private static final Instant NOW = Instant.parse("2026-10-17T09:30:00Z");

    private final FakeMediaCatalog catalog = new FakeMediaCatalog()
            .add("a", "Song A", 200, 40)
            .add("b", "Song B", 180, 0)
            .add("c", "Song C", 240, 7);
    private final InMemoryPlayStore store = new InMemoryPlayStore();
    private final LibrarySeeder seeder = new LibrarySeeder(
            new CounterReconciler(catalog, store, new ReentrantLock(), 2, new Random(3)), store);

    @Test
    void seed_importsCountersAsBaselinesAndMarksSeeded() {
        assertFalse(seeder.isSeeded());
        List<Integer> progress = new ArrayList<>();

        ReconciliationReport report = seeder.seed(NOW, (done, total, last) -> progress.add(done));

        assertTrue(seeder.isSeeded());
        assertEquals(NOW, store.loadEngineState().lastFullSyncAt());
        assertEquals(3, report.tracksCreated());
        assertEquals(40, store.findTrack("a").orElseThrow().getBaselineCounter());
        assertEquals(0, store.countPlayFacts("a"));
        assertEquals(List.of(2, 3), progress);
    }

    @Test
    void failedSeed_staysUnseeded() {
        catalog.denyAccess();

        assertThrows(PermissionDeniedException.class, () -> seeder.seed(NOW, SyncProgressListener.NONE));
        assertFalse(seeder.isSeeded());
    }
}
