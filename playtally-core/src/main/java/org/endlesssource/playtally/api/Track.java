package org.endlesssource.playtally.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A tracked library entry. Instances are immutable; updates produce copies that
 * are written back through the store.
 */
public final class Track {
    public static final int UNKNOWN_CATALOG_POSITION = Integer.MAX_VALUE;

    private final String id;
    private final String title;
    private final String artist;
    private final String album;
    private final Duration duration;
    private final int baselineCounter;
    private final int lastSyncedCounter;
    private final int pendingLiveCredits;
    private final Instant lastReconciledAt;
    private final int catalogPosition;

    private Track(String id,
                  String title,
                  String artist,
                  String album,
                  Duration duration,
                  int baselineCounter,
                  int lastSyncedCounter,
                  int pendingLiveCredits,
                  Instant lastReconciledAt,
                  int catalogPosition) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.title = Objects.requireNonNull(title, "title must not be null");
        this.artist = Objects.requireNonNull(artist, "artist must not be null");
        this.album = album == null ? "" : album;
        this.duration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        this.baselineCounter = requireNonNegative("baselineCounter", baselineCounter);
        this.lastSyncedCounter = requireNonNegative("lastSyncedCounter", lastSyncedCounter);
        this.pendingLiveCredits = requireNonNegative("pendingLiveCredits", pendingLiveCredits);
        this.lastReconciledAt = Objects.requireNonNull(lastReconciledAt, "lastReconciledAt must not be null");
        this.catalogPosition = catalogPosition;
    }

    /**
     * Start tracking a library entry. The current system counter becomes the
     * baseline: plays already counted by the system are never turned into
     * individual play facts.
     *
     * @param source          catalog snapshot
     * @param catalogPosition position in catalog order, or {@link #UNKNOWN_CATALOG_POSITION}
     * @param now             creation time, recorded as the first reconciliation
     */
    public static Track firstSeen(CatalogTrack source, int catalogPosition, Instant now) {
        return new Track(source.id(), source.title(), source.artist(), source.album(), source.duration(),
                source.playCount(), source.playCount(), 0, now, catalogPosition);
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getArtist() {
        return artist;
    }

    public String getAlbum() {
        return album;
    }

    /**
     * @return track length, {@link Duration#ZERO} when unknown
     */
    public Duration getDuration() {
        return duration;
    }

    /**
     * @return system play count when tracking began; plays with no known timestamp
     */
    public int getBaselineCounter() {
        return baselineCounter;
    }

    /**
     * @return last system counter value observed and accounted for
     */
    public int getLastSyncedCounter() {
        return lastSyncedCounter;
    }

    /**
     * @return live plays still waiting for their system counter increment
     */
    public int getPendingLiveCredits() {
        return pendingLiveCredits;
    }

    public Instant getLastReconciledAt() {
        return lastReconciledAt;
    }

    public int getCatalogPosition() {
        return catalogPosition;
    }

    public Track withSyncedCounter(int counter, Instant reconciledAt) {
        return new Track(id, title, artist, album, duration, baselineCounter, counter, pendingLiveCredits,
                reconciledAt, catalogPosition);
    }

    public Track withPendingLiveCredits(int credits) {
        return new Track(id, title, artist, album, duration, baselineCounter, lastSyncedCounter, credits,
                lastReconciledAt, catalogPosition);
    }

    public Track withCatalogPosition(int position) {
        return new Track(id, title, artist, album, duration, baselineCounter, lastSyncedCounter, pendingLiveCredits,
                lastReconciledAt, position);
    }

    public Track withDisplayInfo(CatalogTrack source) {
        return new Track(id, source.title(), source.artist(), source.album(), source.duration(), baselineCounter,
                lastSyncedCounter, pendingLiveCredits, lastReconciledAt, catalogPosition);
    }

    public String label() {
        return artist + " - " + title;
    }

    private static int requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Track other)) {
            return false;
        }
        return baselineCounter == other.baselineCounter
                && lastSyncedCounter == other.lastSyncedCounter
                && pendingLiveCredits == other.pendingLiveCredits
                && catalogPosition == other.catalogPosition
                && id.equals(other.id)
                && title.equals(other.title)
                && artist.equals(other.artist)
                && album.equals(other.album)
                && duration.equals(other.duration)
                && lastReconciledAt.equals(other.lastReconciledAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, artist, album, duration, baselineCounter, lastSyncedCounter,
                pendingLiveCredits, lastReconciledAt, catalogPosition);
    }

    @Override
    public String toString() {
        return "Track{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", baselineCounter=" + baselineCounter +
                ", lastSyncedCounter=" + lastSyncedCounter +
                ", pendingLiveCredits=" + pendingLiveCredits +
                ", lastReconciledAt=" + lastReconciledAt +
                '}';
    }
}
