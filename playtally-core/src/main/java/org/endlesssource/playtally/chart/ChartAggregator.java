package org.endlesssource.playtally.chart;

import org.endlesssource.playtally.api.ChartPeriod;
import org.endlesssource.playtally.api.PlayFact;
import org.endlesssource.playtally.api.PlaySource;
import org.endlesssource.playtally.api.Track;
import org.endlesssource.playtally.spi.PlayStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Folds the play log into per-track counts and ranked charts.
 * <p>
 * All-time counts are {@code baselineCounter + play facts}. Period counts use
 * play facts only, since the baseline has no timestamp, and leave out tracks
 * without plays in the period.
 */
public class ChartAggregator {
    private static final Logger logger = LoggerFactory.getLogger(ChartAggregator.class);

    private final PlayStore store;
    private final ZoneId zone;
    private final List<RankChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ChartAggregator(PlayStore store, ZoneId zone) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public long totalPlayCount(String trackId) {
        return store.findTrack(trackId).map(this::totalPlayCount).orElse(0L);
    }

    public long totalPlayCount(Track track) {
        return track.getBaselineCounter() + store.countPlayFacts(track.getId());
    }

    /**
     * @return play facts of the track with {@code timestamp >= since}
     */
    public long periodPlayCount(String trackId, Instant since) {
        return store.countPlayFacts(trackId, since);
    }

    /**
     * @param since start of the period, or empty for all time (baseline included)
     */
    public SourceBreakdown sourceBreakdown(String trackId, Optional<Instant> since) {
        List<PlayFact> facts = since.map(start -> store.findPlayFacts(trackId, start))
                .orElseGet(() -> store.findPlayFacts(trackId));
        long live = facts.stream().filter(fact -> fact.getSource() == PlaySource.LIVE).count();
        long sync = facts.size() - live;
        long baseline = since.isPresent()
                ? 0
                : store.findTrack(trackId).map(Track::getBaselineCounter).orElse(0);
        return new SourceBreakdown(live, sync, baseline);
    }

    /**
     * Compute the chart for a period, record the new ranks and publish a
     * {@link RankChange} for every track that held a different rank at the
     * previous computation of this chart.
     */
    public synchronized List<ChartEntry> rankedTracks(ChartPeriod period, Instant now) {
        Optional<Instant> since = period.startFor(now, zone);
        List<Counted> counted = new ArrayList<>();
        for (Track track : store.findAllTracks()) {
            long count = since.map(start -> periodPlayCount(track.getId(), start))
                    .orElseGet(() -> totalPlayCount(track));
            if (since.isPresent() && count == 0) {
                continue;
            }
            counted.add(new Counted(track, count));
        }
        counted.sort(Comparator.comparingLong(Counted::count).reversed()
                .thenComparingInt(c -> c.track().getCatalogPosition())
                .thenComparing(c -> c.track().getTitle(), String.CASE_INSENSITIVE_ORDER)
                .thenComparing(c -> c.track().getId()));

        Map<String, Integer> previousRanks = store.findRanks(period);
        Map<String, Integer> newRanks = new HashMap<>();
        List<ChartEntry> entries = new ArrayList<>(counted.size());
        List<RankChange> changes = new ArrayList<>();
        for (int i = 0; i < counted.size(); i++) {
            int rank = i + 1;
            Track track = counted.get(i).track();
            Integer previous = previousRanks.get(track.getId());
            newRanks.put(track.getId(), rank);
            entries.add(new ChartEntry(rank, track, counted.get(i).count(), RankMovement.between(previous, rank),
                    sourceBreakdown(track.getId(), since)));
            if (previous != null && previous != rank) {
                changes.add(new RankChange(track, period, previous, rank));
            }
        }
        store.saveRanks(period, newRanks);
        changes.forEach(this::publish);
        return entries;
    }

    public void addRankChangeListener(RankChangeListener listener) {
        listeners.add(listener);
    }

    public void removeRankChangeListener(RankChangeListener listener) {
        listeners.remove(listener);
    }

    private void publish(RankChange change) {
        logger.debug("Rank change [{}]: {} #{} -> #{}", change.period(), change.track().label(),
                change.oldRank(), change.newRank());
        for (RankChangeListener listener : listeners) {
            try {
                listener.onRankChanged(change);
            } catch (RuntimeException e) {
                logger.warn("Rank change listener failed for {}", change.track().label(), e);
            }
        }
    }

    private record Counted(Track track, long count) {
    }
}
