package org.endlesssource.playtally.sync;

import org.endlesssource.playtally.api.CatalogTrack;
import org.endlesssource.playtally.api.EngineState;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.spi.PlayStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Two-tier sync policy for app launch and foreground: a full catalog pass when
 * the last one is older than the configured interval, otherwise a quick check
 * of the track the user is most likely resuming.
 */
public class SyncScheduler {
    private static final Logger logger = LoggerFactory.getLogger(SyncScheduler.class);

    private final CounterReconciler reconciler;
    private final MediaCatalog catalog;
    private final PlayStore store;
    private final Duration fullSyncInterval;
    private final AtomicBoolean syncing = new AtomicBoolean();

    public SyncScheduler(CounterReconciler reconciler, MediaCatalog catalog, PlayStore store,
                         Duration fullSyncInterval) {
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.fullSyncInterval = Objects.requireNonNull(fullSyncInterval, "fullSyncInterval must not be null");
    }

    public boolean shouldRunFullSync(Instant lastFullSyncAt, Instant now) {
        return shouldRunFullSync(lastFullSyncAt, now, fullSyncInterval);
    }

    public static boolean shouldRunFullSync(Instant lastFullSyncAt, Instant now, Duration interval) {
        return Duration.between(lastFullSyncAt, now).compareTo(interval) >= 0;
    }

    public SyncOutcome onLaunch(Instant now) {
        logger.debug("Launch sync at {}", now);
        return runScheduledSync(now);
    }

    public SyncOutcome onForeground(Instant now) {
        logger.debug("Foreground sync at {}", now);
        return runScheduledSync(now);
    }

    /**
     * Run the sync due at {@code now}. A full pass records {@code now} as the last
     * full sync only after it completed.
     *
     * @return what was done; {@link SyncOutcome.Kind#SKIPPED} if a sync is already running
     *         or the quick path has no current track
     */
    public SyncOutcome runScheduledSync(Instant now) {
        if (!syncing.compareAndSet(false, true)) {
            logger.debug("Sync already in progress, skipping");
            return SyncOutcome.skipped();
        }
        try {
            EngineState state = store.loadEngineState();
            if (shouldRunFullSync(state.lastFullSyncAt(), now)) {
                logger.debug("Last full sync at {}, running full sync", state.lastFullSyncAt());
                ReconciliationReport report = reconciler.reconcileAll(now);
                store.saveEngineState(store.loadEngineState().withLastFullSyncAt(now));
                return SyncOutcome.full(report);
            }
            Optional<CatalogTrack> playing = catalog.currentlyPlaying();
            if (playing.isEmpty()) {
                return SyncOutcome.skipped();
            }
            return SyncOutcome.quick(reconciler.reconcileOne(playing.get(), now));
        } finally {
            syncing.set(false);
        }
    }

    public boolean isSyncing() {
        return syncing.get();
    }
}
