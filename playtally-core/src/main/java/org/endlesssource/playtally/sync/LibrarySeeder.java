package org.endlesssource.playtally.sync;

import org.endlesssource.playtally.api.EngineState;
import org.endlesssource.playtally.spi.PlayStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;

/**
 * First-run walk of the whole library. Every track starts tracking with its
 * system counter as baseline; historical plays never become play facts.
 */
public class LibrarySeeder {
    private static final Logger logger = LoggerFactory.getLogger(LibrarySeeder.class);

    private final CounterReconciler reconciler;
    private final PlayStore store;

    public LibrarySeeder(CounterReconciler reconciler, PlayStore store) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    public boolean isSeeded() {
        return store.loadEngineState().librarySeeded();
    }

    /**
     * Seed the library and mark it seeded. A seed that fails part way is
     * repeated in full on the next launch; already stored tracks are then
     * reconciled instead of re-created.
     */
    public ReconciliationReport seed(Instant now, SyncProgressListener progress) {
        logger.info("Starting library seed");
        ReconciliationReport report = reconciler.reconcileAll(now, progress);
        EngineState state = store.loadEngineState();
        store.saveEngineState(state.withLibrarySeeded(true).withLastFullSyncAt(now));
        logger.info("Library seed completed: {} tracks added", report.tracksCreated());
        return report;
    }
}
