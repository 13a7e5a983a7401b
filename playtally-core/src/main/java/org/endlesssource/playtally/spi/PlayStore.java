package org.endlesssource.playtally.spi;

import org.endlesssource.playtally.api.ChartPeriod;
import org.endlesssource.playtally.api.EngineState;
import org.endlesssource.playtally.api.PersistenceException;
import org.endlesssource.playtally.api.PlayFact;
import org.endlesssource.playtally.api.Track;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Transactional record store holding tracks, their play facts and the small
 * amount of engine bookkeeping. Implementations must be safe for concurrent use.
 */
public interface PlayStore {

    /**
     * Find a tracked library entry
     * @param trackId stable library identifier
     * @return Optional containing the track if it is tracked
     */
    Optional<Track> findTrack(String trackId);

    /**
     * @return every tracked library entry, in insertion order
     */
    List<Track> findAllTracks();

    /**
     * @return play facts of one track, oldest first
     */
    List<PlayFact> findPlayFacts(String trackId);

    /**
     * @return play facts of one track with {@code timestamp >= since}, oldest first
     */
    List<PlayFact> findPlayFacts(String trackId, Instant since);

    /**
     * @return play facts of all tracks with {@code from <= timestamp < to}, oldest first
     */
    List<PlayFact> findPlayFactsBetween(Instant from, Instant to);

    default long countPlayFacts(String trackId) {
        return findPlayFacts(trackId).size();
    }

    default long countPlayFacts(String trackId, Instant since) {
        return findPlayFacts(trackId, since).size();
    }

    /**
     * Apply every write in the batch atomically.
     * @throws PersistenceException if the batch could not be committed; nothing was applied
     */
    void commit(StoreBatch batch);

    /**
     * Delete a track and, by cascade, its play facts.
     * @return number of play facts removed with the track, or -1 if the track was unknown
     */
    int deleteTrack(String trackId);

    /**
     * Delete every track, play fact, rank and the engine state.
     */
    void deleteAll();

    /**
     * @return rank assigned to each track id at the last computation of the given chart
     */
    Map<String, Integer> findRanks(ChartPeriod period);

    /**
     * Replace the recorded ranks of a chart.
     */
    void saveRanks(ChartPeriod period, Map<String, Integer> ranks);

    EngineState loadEngineState();

    void saveEngineState(EngineState state);
}
