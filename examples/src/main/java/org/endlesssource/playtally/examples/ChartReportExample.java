package org.endlesssource.playtally.examples;

import org.endlesssource.playtally.PlatformSupport;
import org.endlesssource.playtally.PlayTally;
import org.endlesssource.playtally.api.ChartPeriod;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PlayTallyOptions;
import org.endlesssource.playtally.chart.ChartEntry;
import org.endlesssource.playtally.engine.PlayTallyEngine;
import org.endlesssource.playtally.store.InMemoryPlayStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Seeds the library from the system player and prints each chart.
 */
public final class ChartReportExample {
    private static final Logger logger = LoggerFactory.getLogger(ChartReportExample.class);
    private static final int TOP = 10;

    public static void main(String[] args) {
        PlatformSupport support = PlayTally.getCurrentPlatformSupport();
        if (!support.available()) {
            logger.error("No catalog available: {}", support.reason());
            return;
        }
        if (!support.canCatchUpMissedPlays()) {
            logger.warn("{} keeps no play counters, only live plays are counted", support.platform());
        }

        PlayTallyOptions options = PlayTallyOptions.defaults().withEventDrivenEnabled(false);
        try (MediaCatalog catalog = PlayTally.createCatalog(options);
             PlayTallyEngine engine = new PlayTallyEngine(catalog, new InMemoryPlayStore(), options)) {
            engine.start();
            for (ChartPeriod period : ChartPeriod.values()) {
                List<ChartEntry> chart = engine.rankedTracks(period);
                logger.info("== {} ({} tracks) ==", period.getDisplayName(), chart.size());
                chart.stream().limit(TOP).forEach(entry -> logger.info("{}. {} - {} plays [{}]",
                        entry.rank(), entry.track().label(), entry.playCount(), entry.movement().symbol()));
            }
        }
    }

    private ChartReportExample() {
    }
}
