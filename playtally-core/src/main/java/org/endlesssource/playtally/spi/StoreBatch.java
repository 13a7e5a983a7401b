package org.endlesssource.playtally.spi;

import org.endlesssource.playtally.api.PlayFact;
import org.endlesssource.playtally.api.Track;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes that a {@link PlayStore} applies atomically: all of them or none.
 * Later track writes for the same id replace earlier ones in the batch.
 */
public final class StoreBatch {
    private final Map<String, Track> tracks = new LinkedHashMap<>();
    private final List<PlayFact> playFacts = new ArrayList<>();

    public StoreBatch putTrack(Track track) {
        tracks.put(track.getId(), track);
        return this;
    }

    public StoreBatch addPlayFact(PlayFact fact) {
        playFacts.add(fact);
        return this;
    }

    public StoreBatch addPlayFacts(List<PlayFact> facts) {
        playFacts.addAll(facts);
        return this;
    }

    /**
     * Track staged in this batch, if any.
     */
    public Optional<Track> stagedTrack(String trackId) {
        return Optional.ofNullable(tracks.get(trackId));
    }

    public List<Track> getTracks() {
        return Collections.unmodifiableList(new ArrayList<>(tracks.values()));
    }

    public List<PlayFact> getPlayFacts() {
        return Collections.unmodifiableList(playFacts);
    }

    public boolean isEmpty() {
        return tracks.isEmpty() && playFacts.isEmpty();
    }

    public int trackCount() {
        return tracks.size();
    }
}
