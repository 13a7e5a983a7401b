package org.endlesssource.playtally.store;

import org.endlesssource.playtally.api.ChartPeriod;
import org.endlesssource.playtally.api.EngineState;
import org.endlesssource.playtally.api.PersistenceException;
import org.endlesssource.playtally.api.PlayFact;
import org.endlesssource.playtally.api.Track;
import org.endlesssource.playtally.spi.PlayStore;
import org.endlesssource.playtally.spi.StoreBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Heap-backed {@link PlayStore}. A commit is validated in full before any
 * write is applied, so a rejected batch leaves the store untouched.
 */
public class InMemoryPlayStore implements PlayStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryPlayStore.class);
    private static final Comparator<PlayFact> CHRONOLOGICAL = Comparator.comparing(PlayFact::getTimestamp);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Track> tracks = new LinkedHashMap<>();
    private final Map<String, List<PlayFact>> playFacts = new HashMap<>();
    private final Map<ChartPeriod, Map<String, Integer>> ranks = new EnumMap<>(ChartPeriod.class);
    private EngineState engineState = EngineState.initial();

    @Override
    public Optional<Track> findTrack(String trackId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(tracks.get(trackId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Track> findAllTracks() {
        lock.readLock().lock();
        try {
            return List.copyOf(tracks.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<PlayFact> findPlayFacts(String trackId) {
        lock.readLock().lock();
        try {
            return List.copyOf(playFacts.getOrDefault(trackId, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<PlayFact> findPlayFacts(String trackId, Instant since) {
        lock.readLock().lock();
        try {
            return playFacts.getOrDefault(trackId, List.of()).stream()
                    .filter(fact -> !fact.getTimestamp().isBefore(since))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<PlayFact> findPlayFactsBetween(Instant from, Instant to) {
        lock.readLock().lock();
        try {
            return playFacts.values().stream()
                    .flatMap(List::stream)
                    .filter(fact -> !fact.getTimestamp().isBefore(from) && fact.getTimestamp().isBefore(to))
                    .sorted(CHRONOLOGICAL)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long countPlayFacts(String trackId) {
        lock.readLock().lock();
        try {
            return playFacts.getOrDefault(trackId, List.of()).size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void commit(StoreBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            validate(batch);
            for (Track track : batch.getTracks()) {
                tracks.put(track.getId(), track);
            }
            Set<String> touched = new HashSet<>();
            for (PlayFact fact : batch.getPlayFacts()) {
                playFacts.computeIfAbsent(fact.getTrackId(), id -> new ArrayList<>()).add(fact);
                touched.add(fact.getTrackId());
            }
            touched.forEach(id -> playFacts.get(id).sort(CHRONOLOGICAL));
            logger.debug("Committed {} tracks and {} play facts", batch.trackCount(), batch.getPlayFacts().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Reject batches that would leave a play fact without its track or store
     * the same fact twice.
     */
    protected void validate(StoreBatch batch) {
        Set<String> factIds = new HashSet<>();
        for (PlayFact fact : batch.getPlayFacts()) {
            String trackId = fact.getTrackId();
            if (!tracks.containsKey(trackId) && batch.stagedTrack(trackId).isEmpty()) {
                throw new PersistenceException("Play fact references unknown track " + trackId);
            }
            if (!factIds.add(fact.getId())
                    || playFacts.getOrDefault(trackId, List.of()).contains(fact)) {
                throw new PersistenceException("Duplicate play fact " + fact.getId());
            }
        }
    }

    @Override
    public int deleteTrack(String trackId) {
        lock.writeLock().lock();
        try {
            if (tracks.remove(trackId) == null) {
                return -1;
            }
            ranks.values().forEach(book -> book.remove(trackId));
            List<PlayFact> removed = playFacts.remove(trackId);
            return removed == null ? 0 : removed.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteAll() {
        lock.writeLock().lock();
        try {
            tracks.clear();
            playFacts.clear();
            ranks.clear();
            engineState = EngineState.initial();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Map<String, Integer> findRanks(ChartPeriod period) {
        lock.readLock().lock();
        try {
            return Map.copyOf(ranks.getOrDefault(period, Map.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void saveRanks(ChartPeriod period, Map<String, Integer> newRanks) {
        lock.writeLock().lock();
        try {
            ranks.put(period, new HashMap<>(newRanks));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public EngineState loadEngineState() {
        lock.readLock().lock();
        try {
            return engineState;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void saveEngineState(EngineState state) {
        lock.writeLock().lock();
        try {
            engineState = state;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
