package org.endlesssource.playtally.api;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.time.temporal.WeekFields;
import java.util.Locale;
import java.util.Optional;

/**
 * Time window a chart is computed over.
 */
public enum ChartPeriod {
    ALL_TIME("All Time"),
    THIS_WEEK("This Week"),
    THIS_MONTH("This Month"),
    THIS_YEAR("This Year");

    private final String displayName;

    ChartPeriod(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Start of the calendar period containing {@code now}.
     * @return start instant, or empty for {@link #ALL_TIME}
     */
    public Optional<Instant> startFor(Instant now, ZoneId zone) {
        LocalDate today = now.atZone(zone).toLocalDate();
        LocalDate start;
        switch (this) {
            case THIS_WEEK -> {
                DayOfWeek firstDay = WeekFields.of(Locale.getDefault()).getFirstDayOfWeek();
                start = today.with(TemporalAdjusters.previousOrSame(firstDay));
            }
            case THIS_MONTH -> start = today.withDayOfMonth(1);
            case THIS_YEAR -> start = today.withDayOfYear(1);
            default -> {
                return Optional.empty();
            }
        }
        return Optional.of(start.atStartOfDay(zone).toInstant());
    }
}
