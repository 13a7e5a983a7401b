package org.endlesssource.playtally.chart;

import org.endlesssource.playtally.api.Track;

/**
 * One row of a chart.
 */
public record ChartEntry(int rank, Track track, long playCount, RankMovement movement, SourceBreakdown breakdown) {
}
