package org.endlesssource.playtally.chart;

/**
 * Play counts split by origin. {@code baseline} is only non-zero for all-time views.
 */
public record SourceBreakdown(long live, long counterSync, long baseline) {

    public long total() {
        return live + counterSync + baseline;
    }
}
