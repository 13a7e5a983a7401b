package org.endlesssource.playtally.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Snapshot of one library entry as reported by a {@link MediaCatalog}.
 *
 * @param id        stable library identifier
 * @param title     display title
 * @param artist    display artist
 * @param album     display album, may be empty
 * @param duration  track length, {@link Duration#ZERO} when unknown
 * @param playCount system play counter, 0 when the platform does not report one
 */
public record CatalogTrack(String id, String title, String artist, String album, Duration duration, int playCount) {
    public CatalogTrack(String id, String title, String artist, String album, Duration duration, int playCount) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.title = title == null || title.isBlank() ? "Unknown Title" : title;
        this.artist = artist == null || artist.isBlank() ? "Unknown Artist" : artist;
        this.album = album == null ? "" : album;
        this.duration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        this.playCount = Math.max(0, playCount);
    }

    public String label() {
        return artist + " - " + title;
    }
}
