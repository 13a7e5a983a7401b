package org.endlesssource.playtally.chart;

import org.endlesssource.playtally.api.ChartPeriod;
import org.endlesssource.playtally.api.Track;

/**
 * A track moved to a different position than the one it had at the previous
 * computation of the same chart.
 */
public record RankChange(Track track, ChartPeriod period, int oldRank, int newRank) {

    public boolean isClimb() {
        return newRank < oldRank;
    }

    public RankMovement movement() {
        return RankMovement.between(oldRank, newRank);
    }
}
