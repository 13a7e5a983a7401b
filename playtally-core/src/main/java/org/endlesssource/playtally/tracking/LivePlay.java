package org.endlesssource.playtally.tracking;

import org.endlesssource.playtally.api.CatalogTrack;

import java.time.Duration;
import java.time.Instant;

/**
 * A qualifying listen detected by a {@link LiveTrackingSession}.
 */
public record LivePlay(CatalogTrack track, Instant completedAt, Duration listened, Duration trackDuration,
                       double completionRatio) {
}
