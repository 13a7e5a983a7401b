package org.endlesssource.playtally.chart;

/**
 * Receives rank changes, e.g. to notify the user about chart movement.
 */
@FunctionalInterface
public interface RankChangeListener {

    void onRankChanged(RankChange change);
}
