package org.endlesssource.playtally;

import org.endlesssource.playtally.api.PlayCounterSupport;

import java.util.Objects;

/**
 * What a catalog provider can offer on this machine: whether it can be created
 * at all, and whether its library keeps play counters for reconciliation.
 */
public record PlatformSupport(String platform, boolean available, PlayCounterSupport playCounters, String reason) {
    public PlatformSupport(String platform, boolean available, PlayCounterSupport playCounters, String reason) {
        this.platform = Objects.requireNonNull(platform, "platform must not be null");
        this.available = available;
        this.playCounters = available ? Objects.requireNonNull(playCounters, "playCounters must not be null")
                : PlayCounterSupport.NONE;
        this.reason = reason == null ? "" : reason;
    }

    public static PlatformSupport available(String platform, PlayCounterSupport playCounters) {
        return new PlatformSupport(platform, true, playCounters, "");
    }

    public static PlatformSupport unavailable(String platform, String reason) {
        return new PlatformSupport(platform, false, PlayCounterSupport.NONE, reason);
    }

    /**
     * @return true if plays made while the engine was not running can be caught up
     */
    public boolean canCatchUpMissedPlays() {
        return available && playCounters != PlayCounterSupport.NONE;
    }
}
