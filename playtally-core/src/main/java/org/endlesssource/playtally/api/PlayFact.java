package org.endlesssource.playtally.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * One asserted play of a track. Play facts are append-only and never change
 * after creation.
 */
public final class PlayFact {
    private final String id;
    private final String trackId;
    private final Instant timestamp;
    private final PlaySource source;
    private final Duration listenedDuration;
    private final Duration trackDurationAtPlay;
    private final Double completionRatio;

    private PlayFact(String id,
                     String trackId,
                     Instant timestamp,
                     PlaySource source,
                     Duration listenedDuration,
                     Duration trackDurationAtPlay,
                     Double completionRatio) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.trackId = Objects.requireNonNull(trackId, "trackId must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.listenedDuration = listenedDuration;
        this.trackDurationAtPlay = trackDurationAtPlay;
        this.completionRatio = completionRatio;
    }

    /**
     * A play observed while watching playback.
     *
     * @param completionRatio listened / track duration as measured by the live session
     */
    public static PlayFact live(String trackId,
                                Instant timestamp,
                                Duration listened,
                                Duration trackDuration,
                                double completionRatio) {
        return new PlayFact(UUID.randomUUID().toString(), trackId, timestamp, PlaySource.LIVE,
                listened, trackDuration, completionRatio);
    }

    /**
     * A play recovered from a system counter increment.
     */
    public static PlayFact counterSync(String trackId, Instant timestamp, Duration trackDuration) {
        Duration known = trackDuration == null || trackDuration.isZero() ? null : trackDuration;
        return new PlayFact(UUID.randomUUID().toString(), trackId, timestamp, PlaySource.COUNTER_SYNC,
                null, known, null);
    }

    public String getId() {
        return id;
    }

    public String getTrackId() {
        return trackId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public PlaySource getSource() {
        return source;
    }

    public Optional<Duration> getListenedDuration() {
        return Optional.ofNullable(listenedDuration);
    }

    public Optional<Duration> getTrackDurationAtPlay() {
        return Optional.ofNullable(trackDurationAtPlay);
    }

    public Optional<Double> getCompletionRatio() {
        return Optional.ofNullable(completionRatio);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PlayFact other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "PlayFact{" +
                "trackId='" + trackId + '\'' +
                ", timestamp=" + timestamp +
                ", source=" + source +
                '}';
    }
}
