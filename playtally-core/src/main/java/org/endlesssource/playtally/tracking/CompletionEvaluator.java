package org.endlesssource.playtally.tracking;

import java.time.Duration;

/**
 * Decides whether an accumulated listen counts as a play: at least half of a
 * known track duration. There is no absolute minimum and no cap.
 */
public final class CompletionEvaluator {
    public static final double COMPLETION_THRESHOLD = 0.5d;

    private CompletionEvaluator() {
    }

    /**
     * @param listenedSeconds      accumulated listened time
     * @param trackDurationSeconds track length, zero or negative when unknown
     * @return true when the listen reaches the completion threshold of a known duration
     */
    public static boolean isComplete(double listenedSeconds, double trackDurationSeconds) {
        if (trackDurationSeconds <= 0) {
            return false;
        }
        return listenedSeconds / trackDurationSeconds >= COMPLETION_THRESHOLD;
    }

    public static boolean isComplete(Duration listened, Duration trackDuration) {
        return isComplete(toSeconds(listened), toSeconds(trackDuration));
    }

    /**
     * @return listened / duration, or 0 when the duration is unknown
     */
    public static double completionRatio(Duration listened, Duration trackDuration) {
        double durationSeconds = toSeconds(trackDuration);
        return durationSeconds <= 0 ? 0.0d : toSeconds(listened) / durationSeconds;
    }

    private static double toSeconds(Duration duration) {
        return duration == null ? 0.0d : duration.toNanos() / 1_000_000_000.0d;
    }
}
