package org.endlesssource.playtally.chart;

import java.util.Objects;

/**
 * Change of a chart position relative to the previous computation of the same chart.
 *
 * @param direction kind of movement
 * @param positions number of places moved; 0 for {@link Direction#NEW} and {@link Direction#UNCHANGED}
 */
public record RankMovement(Direction direction, int positions) {

    public enum Direction {
        UP,
        DOWN,
        UNCHANGED,
        NEW
    }

    public static final RankMovement NEW = new RankMovement(Direction.NEW, 0);
    public static final RankMovement UNCHANGED = new RankMovement(Direction.UNCHANGED, 0);

    public RankMovement {
        Objects.requireNonNull(direction, "direction must not be null");
        if (positions < 0) {
            throw new IllegalArgumentException("positions must not be negative");
        }
    }

    public static RankMovement up(int positions) {
        return new RankMovement(Direction.UP, positions);
    }

    public static RankMovement down(int positions) {
        return new RankMovement(Direction.DOWN, positions);
    }

    /**
     * @param previousRank rank at the previous computation, or null if the track was not ranked
     * @param currentRank  rank now
     */
    public static RankMovement between(Integer previousRank, int currentRank) {
        if (previousRank == null) {
            return NEW;
        }
        if (currentRank < previousRank) {
            return up(previousRank - currentRank);
        }
        if (currentRank > previousRank) {
            return down(currentRank - previousRank);
        }
        return UNCHANGED;
    }

    public String symbol() {
        return switch (direction) {
            case UP -> "↑" + positions;
            case DOWN -> "↓" + positions;
            case UNCHANGED -> "=";
            case NEW -> "NEW";
        };
    }
}
