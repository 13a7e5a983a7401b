package org.endlesssource.playtally.engine;

import org.endlesssource.playtally.api.CatalogTrack;
import org.endlesssource.playtally.api.CatalogUnavailableException;
import org.endlesssource.playtally.api.ChartPeriod;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PermissionDeniedException;
import org.endlesssource.playtally.api.PersistenceException;
import org.endlesssource.playtally.api.PlayFact;
import org.endlesssource.playtally.api.PlayTallyOptions;
import org.endlesssource.playtally.api.Track;
import org.endlesssource.playtally.chart.ChartAggregator;
import org.endlesssource.playtally.chart.ChartEntry;
import org.endlesssource.playtally.chart.RankChangeListener;
import org.endlesssource.playtally.spi.PlayStore;
import org.endlesssource.playtally.spi.StoreBatch;
import org.endlesssource.playtally.sync.CounterReconciler;
import org.endlesssource.playtally.sync.LibrarySeeder;
import org.endlesssource.playtally.sync.ReconciliationReport;
import org.endlesssource.playtally.sync.SyncOutcome;
import org.endlesssource.playtally.sync.SyncProgressListener;
import org.endlesssource.playtally.sync.SyncScheduler;
import org.endlesssource.playtally.tracking.LivePlay;
import org.endlesssource.playtally.tracking.LiveTrackingSession;
import org.endlesssource.playtally.tracking.PlaybackEvent;
import org.endlesssource.playtally.tracking.PlaybackSampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Ties live play detection and counter reconciliation together.
 * <p>
 * Playback events and progress ticks run in order on one scheduler thread, so
 * a track change always finalizes the outgoing listen before the next one
 * starts. Live play recording and reconciliation batches share one lock, so a
 * counter update can never land between a live session's completion check and
 * its write.
 */
public class PlayTallyEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PlayTallyEngine.class);

    private final MediaCatalog catalog;
    private final PlayStore store;
    private final PlayTallyOptions options;
    private final Clock clock;
    private final Lock reconciliationLock = new ReentrantLock();
    private final ScheduledExecutorService executor;
    private final LiveTrackingSession session;
    private final PlaybackSampler sampler;
    private final SyncScheduler syncScheduler;
    private final LibrarySeeder seeder;
    private final ChartAggregator charts;
    private volatile boolean started;
    private volatile boolean closed;
    private volatile boolean missingCountersReported;

    public PlayTallyEngine(MediaCatalog catalog, PlayStore store, PlayTallyOptions options) {
        this(catalog, store, options, Clock.systemUTC(), new Random());
    }

    public PlayTallyEngine(MediaCatalog catalog, PlayStore store, PlayTallyOptions options, Clock clock,
                           Random random) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "playtally-engine");
            thread.setDaemon(true);
            return thread;
        });
        this.session = new LiveTrackingSession(this::recordLivePlay);
        this.sampler = new PlaybackSampler(catalog, this::dispatch, clock);
        CounterReconciler reconciler = new CounterReconciler(catalog, store, reconciliationLock,
                options.getReconcileBatchSize(), random);
        this.syncScheduler = new SyncScheduler(reconciler, catalog, store, options.getFullSyncInterval());
        this.seeder = new LibrarySeeder(reconciler, store);
        this.charts = new ChartAggregator(store, options.getChartZone());
    }

    /**
     * Seed the library on first run, otherwise run the launch sync, then start
     * watching playback.
     *
     * @throws PermissionDeniedException if the platform refuses library access
     */
    public synchronized void start(SyncProgressListener seedProgress) {
        if (started) {
            return;
        }
        if (!seeder.isSeeded()) {
            runSeed(seedProgress);
        } else {
            runSync("launch", syncScheduler::onLaunch);
        }
        long tickMillis = options.getTickInterval().toMillis();
        executor.scheduleAtFixedRate(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        sampler.start();
        started = true;
        logger.info("Play tracking started");
    }

    public void start() {
        start(SyncProgressListener.NONE);
    }

    /**
     * App came back to the foreground: catch up on plays that happened meanwhile.
     *
     * @return what the sync did, empty if it failed with a recoverable error
     * @throws PermissionDeniedException if the platform refuses library access
     */
    public Optional<SyncOutcome> onForeground() {
        return runSync("foreground", syncScheduler::onForeground);
    }

    private void runSeed(SyncProgressListener progress) {
        try {
            ReconciliationReport report = seeder.seed(clock.instant(), progress);
            afterReconciliation(report);
        } catch (CatalogUnavailableException | PersistenceException e) {
            logger.warn("Library seed failed, will retry on next launch: {}", e.getMessage());
        }
    }

    private Optional<SyncOutcome> runSync(String trigger, Function<Instant, SyncOutcome> sync) {
        try {
            SyncOutcome outcome = sync.apply(clock.instant());
            logger.info("{} sync: {} ({} new plays)", trigger, outcome.kind(), outcome.report().playFactsCreated());
            afterReconciliation(outcome.report());
            return Optional.of(outcome);
        } catch (CatalogUnavailableException e) {
            logger.warn("{} sync skipped, catalog unavailable: {}", trigger, e.getMessage());
        } catch (PersistenceException e) {
            logger.error("{} sync failed to persist, will retry on next sync", trigger, e);
        }
        return Optional.empty();
    }

    private void afterReconciliation(ReconciliationReport report) {
        if (!missingCountersReported && !catalog.reportsPlayCounts()) {
            missingCountersReported = true;
            logger.warn("Catalog keeps no play counters, only plays heard live will be counted");
        }
        if (report.createdPlayFacts()) {
            refreshRanks();
        }
    }

    /**
     * @return true if plays made while the engine was not watching can be caught up from catalog counters
     */
    public boolean isCounterSyncActive() {
        return catalog.reportsPlayCounts();
    }

    /**
     * Queue a playback event for the live session.
     */
    void dispatch(PlaybackEvent event) {
        submit(() -> session.onEvent(event));
    }

    private void tick() {
        try {
            session.tick(clock.instant());
        } catch (RuntimeException e) {
            logger.error("Progress tick failed", e);
        }
    }

    /**
     * Queue an immediate progress check, in addition to the periodic ones.
     */
    void requestTick() {
        submit(this::tick);
    }

    private void submit(Runnable task) {
        if (closed) {
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("Playback task failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("Engine closed, dropping playback task");
        }
    }

    /**
     * Wait until every queued playback event has been handled.
     */
    public void awaitIdle() throws InterruptedException {
        try {
            executor.submit(() -> { }).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Engine queue failed", e.getCause());
        } catch (RejectedExecutionException e) {
            logger.debug("Engine closed, nothing to wait for");
        }
    }

    /**
     * Write a live play unless counter sync got to it first: when the stored
     * counter already moved past the value seen at the start of the listen, a
     * reconciliation pass has turned this listen into a counter sync play.
     */
    private void recordLivePlay(LivePlay play) {
        CatalogTrack source = play.track();
        reconciliationLock.lock();
        try {
            Optional<Track> stored = store.findTrack(source.id());
            if (stored.isPresent() && stored.get().getLastSyncedCounter() > source.playCount()) {
                logger.info("Dropped live play of {}: already counted by sync (counter {} -> {})",
                        source.label(), source.playCount(), stored.get().getLastSyncedCounter());
                return;
            }
            Track track = stored
                    .orElseGet(() -> Track.firstSeen(source, Track.UNKNOWN_CATALOG_POSITION, play.completedAt()));
            PlayFact fact = PlayFact.live(track.getId(), play.completedAt(), play.listened(), play.trackDuration(),
                    play.completionRatio());
            store.commit(new StoreBatch()
                    .putTrack(track.withPendingLiveCredits(track.getPendingLiveCredits() + 1))
                    .addPlayFact(fact));
            logger.info("Recorded live play for {}, total plays: {}", track.label(), charts.totalPlayCount(track));
        } finally {
            reconciliationLock.unlock();
        }
        refreshRanks();
    }

    private void refreshRanks() {
        try {
            charts.rankedTracks(ChartPeriod.ALL_TIME, clock.instant());
        } catch (RuntimeException e) {
            logger.warn("Failed to update rankings", e);
        }
    }

    public List<ChartEntry> rankedTracks(ChartPeriod period) {
        return charts.rankedTracks(period, clock.instant());
    }

    public long totalPlayCount(String trackId) {
        return charts.totalPlayCount(trackId);
    }

    public long periodPlayCount(String trackId, Instant since) {
        return charts.periodPlayCount(trackId, since);
    }

    public void addRankChangeListener(RankChangeListener listener) {
        charts.addRankChangeListener(listener);
    }

    public void removeRankChangeListener(RankChangeListener listener) {
        charts.removeRankChangeListener(listener);
    }

    /**
     * Forget every track, play, rank and the seeded flag. The next {@link #start}
     * of a new engine seeds the library again.
     */
    public void resetAllData() throws InterruptedException {
        submit(() -> session.finalizeSession(clock.instant()));
        awaitIdle();
        reconciliationLock.lock();
        try {
            store.deleteAll();
        } finally {
            reconciliationLock.unlock();
        }
        logger.info("All tracking data deleted");
    }

    public Optional<CatalogTrack> getCurrentTrack() {
        return sampler.getLastTrack();
    }

    /**
     * Finalize the running listen and stop watching playback.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        sampler.close();
        try {
            executor.submit(() -> session.finalizeSession(clock.instant())).get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.warn("Failed to finalize live session on close", e);
        }
        closed = true;
        executor.shutdown();
        logger.info("Play tracking stopped");
    }
}
