package org.endlesssource.playtally.sync;

import org.endlesssource.playtally.api.CatalogTrack;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PersistenceException;
import org.endlesssource.playtally.api.PlayFact;
import org.endlesssource.playtally.api.Track;
import org.endlesssource.playtally.spi.PlayStore;
import org.endlesssource.playtally.spi.StoreBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.locks.Lock;

/**
 * Compares the system play counter of each library entry with the last value
 * accounted for and turns new plays into {@link org.endlesssource.playtally.api.PlaySource#COUNTER_SYNC}
 * play facts.
 * <p>
 * Rules per catalog track:
 * <ul>
 *     <li>unknown track: start tracking with the counter as baseline, create no play facts;</li>
 *     <li>counter unchanged: nothing;</li>
 *     <li>counter lower: external reset, remember the lower value, drop pending live plays,
 *     create no play facts;</li>
 *     <li>counter higher: match the increase against pending live plays first, then create one
 *     play fact per remaining play with a timestamp drawn uniformly from
 *     {@code (lastReconciledAt, now]}.</li>
 * </ul>
 * A full pass commits in batches and holds the reconciliation lock only while
 * building and committing one batch.
 */
public class CounterReconciler {
    private static final Logger logger = LoggerFactory.getLogger(CounterReconciler.class);

    private final MediaCatalog catalog;
    private final PlayStore store;
    private final Lock reconciliationLock;
    private final int batchSize;
    private final Random random;

    public CounterReconciler(MediaCatalog catalog, PlayStore store, Lock reconciliationLock, int batchSize) {
        this(catalog, store, reconciliationLock, batchSize, new Random());
    }

    public CounterReconciler(MediaCatalog catalog,
                             PlayStore store,
                             Lock reconciliationLock,
                             int batchSize,
                             Random random) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.reconciliationLock = Objects.requireNonNull(reconciliationLock, "reconciliationLock must not be null");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = batchSize;
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public ReconciliationReport reconcileAll(Instant now) {
        return reconcileAll(now, SyncProgressListener.NONE);
    }

    /**
     * Reconcile every track of the catalog.
     * @throws org.endlesssource.playtally.api.PermissionDeniedException if the library cannot be accessed
     * @throws org.endlesssource.playtally.api.CatalogUnavailableException if enumeration fails
     * @throws PersistenceException if a batch does not commit; earlier batches stay committed
     */
    public ReconciliationReport reconcileAll(Instant now, SyncProgressListener progress) {
        List<CatalogTrack> catalogTracks = catalog.enumerateTracks();
        int total = catalogTracks.size();
        logger.info("Starting full reconciliation of {} tracks", total);

        Tally tally = new Tally();
        for (int start = 0; start < total; start += batchSize) {
            int end = Math.min(start + batchSize, total);
            StoreBatch batch = new StoreBatch();
            reconciliationLock.lock();
            try {
                for (int position = start; position < end; position++) {
                    reconcileTrack(catalogTracks.get(position), position, now, batch, tally);
                }
                store.commit(batch);
            } catch (PersistenceException e) {
                logger.error("Reconciliation aborted at batch {}-{} of {} tracks", start, end, total, e);
                throw e;
            } finally {
                reconciliationLock.unlock();
            }
            tally.batches++;
            tally.processed = end;
            progress.onProgress(end, total, catalogTracks.get(end - 1).label());
        }

        ReconciliationReport report = tally.toReport();
        logger.info("Full reconciliation completed: {} tracks, {} new, {} play facts, {} matched live plays",
                report.tracksProcessed(), report.tracksCreated(), report.playFactsCreated(),
                report.liveCreditsAbsorbed());
        return report;
    }

    /**
     * Reconcile a single library entry looked up through the catalog.
     * @return report of the pass; empty if the catalog does not know the track
     */
    public ReconciliationReport reconcileOne(String trackId, Instant now) {
        Optional<CatalogTrack> found = catalog.findTrack(trackId);
        if (found.isEmpty()) {
            logger.debug("Track {} not found in catalog, nothing to reconcile", trackId);
            return ReconciliationReport.empty();
        }
        return reconcileOne(found.get(), now);
    }

    /**
     * Reconcile a single library entry from a fresh catalog snapshot.
     */
    public ReconciliationReport reconcileOne(CatalogTrack catalogTrack, Instant now) {
        Tally tally = new Tally();
        StoreBatch batch = new StoreBatch();
        reconciliationLock.lock();
        try {
            reconcileTrack(catalogTrack, Track.UNKNOWN_CATALOG_POSITION, now, batch, tally);
            store.commit(batch);
        } finally {
            reconciliationLock.unlock();
        }
        tally.processed = 1;
        tally.batches = batch.isEmpty() ? 0 : 1;
        if (tally.facts > 0) {
            logger.info("Quick reconciliation of {}: {} new plays", catalogTrack.label(), tally.facts);
        }
        return tally.toReport();
    }

    private void reconcileTrack(CatalogTrack source, int position, Instant now, StoreBatch batch, Tally tally) {
        Optional<Track> existing = batch.stagedTrack(source.id()).or(() -> store.findTrack(source.id()));
        if (existing.isEmpty()) {
            batch.putTrack(Track.firstSeen(source, position, now));
            tally.created++;
            logger.debug("Added new track: {} (system: {} plays)", source.label(), source.playCount());
            return;
        }

        Track track = existing.get();
        Track updated = refreshDisplayInfo(track, source, position);
        int counter = source.playCount();
        int delta = counter - track.getLastSyncedCounter();

        if (delta < 0) {
            logger.info("System play counter of {} went back from {} to {}", source.label(),
                    track.getLastSyncedCounter(), counter);
            // live plays waiting for their increment belong to the counter that was reset
            updated = updated.withSyncedCounter(counter, now).withPendingLiveCredits(0);
            tally.resets++;
        } else if (delta > 0) {
            int credits = track.getPendingLiveCredits();
            int absorbed = Math.min(delta, credits);
            int newPlays = delta - absorbed;
            if (newPlays > 0) {
                batch.addPlayFacts(distribute(track, newPlays, track.getLastReconciledAt(), now));
                logger.debug("Detected {} new plays for {}", newPlays, source.label());
            }
            updated = updated.withSyncedCounter(counter, now).withPendingLiveCredits(credits - absorbed);
            tally.facts += newPlays;
            tally.absorbed += absorbed;
        }

        if (!updated.equals(track)) {
            batch.putTrack(updated);
        }
    }

    private static Track refreshDisplayInfo(Track track, CatalogTrack source, int position) {
        Track updated = track;
        if (track.getCatalogPosition() != position && position != Track.UNKNOWN_CATALOG_POSITION) {
            updated = updated.withCatalogPosition(position);
        }
        if (!track.getTitle().equals(source.title())
                || !track.getArtist().equals(source.artist())
                || !track.getAlbum().equals(source.album())
                || (!source.duration().isZero() && !track.getDuration().equals(source.duration()))) {
            updated = updated.withDisplayInfo(source);
        }
        return updated;
    }

    /**
     * Spread plays uniformly over {@code (from, to]}, oldest first.
     */
    List<PlayFact> distribute(Track track, int count, Instant from, Instant to) {
        long windowMillis = Duration.between(from, to).toMillis();
        List<Instant> timestamps = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            timestamps.add(windowMillis <= 0 ? to : from.plusMillis(1 + random.nextLong(windowMillis)));
        }
        timestamps.sort(Comparator.naturalOrder());
        List<PlayFact> facts = new ArrayList<>(count);
        for (Instant timestamp : timestamps) {
            facts.add(PlayFact.counterSync(track.getId(), timestamp, track.getDuration()));
        }
        return facts;
    }

    private static final class Tally {
        int processed;
        int created;
        int facts;
        int absorbed;
        int resets;
        int batches;

        ReconciliationReport toReport() {
            return new ReconciliationReport(processed, created, facts, absorbed, resets, batches);
        }
    }
}
