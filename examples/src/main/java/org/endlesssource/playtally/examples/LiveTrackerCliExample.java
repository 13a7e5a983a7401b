package org.endlesssource.playtally.examples;

import org.endlesssource.playtally.PlatformSupport;
import org.endlesssource.playtally.PlayTally;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PlayTallyOptions;
import org.endlesssource.playtally.engine.PlayTallyEngine;
import org.endlesssource.playtally.store.InMemoryPlayStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Tracks plays of the system player until "quit" is entered.
 * <p>
 * Commands: {@code sync} catches up on counter changes, {@code now} shows the
 * current track, {@code quit} exits.
 */
public final class LiveTrackerCliExample {
    private static final Logger logger = LoggerFactory.getLogger(LiveTrackerCliExample.class);

    public static void main(String[] args) throws IOException {
        PlatformSupport support = PlayTally.getCurrentPlatformSupport();
        if (!support.available()) {
            logger.error("Platform {} unsupported: {}", support.platform(), support.reason());
            return;
        }

        PlayTallyOptions options = PlayTallyOptions.defaults();
        if (args.length > 0) {
            options = options.withPreferredPlayer(args[0]);
        }

        try (MediaCatalog catalog = PlayTally.createCatalog(options);
             PlayTallyEngine engine = new PlayTallyEngine(catalog, new InMemoryPlayStore(), options)) {
            engine.addRankChangeListener(change -> logger.info("{} {} #{} -> #{}",
                    change.isClimb() ? "Climbed:" : "Dropped:", change.track().label(),
                    change.oldRank(), change.newRank()));
            engine.start((processed, total, last) -> logger.info("Seeding {}/{}: {}", processed, total, last));
            logger.info("Tracking on {} (play counters: {}, catching up missed plays: {})", support.platform(),
                    support.playCounters(), engine.isCounterSyncActive() ? "yes" : "no");

            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line;
            while ((line = in.readLine()) != null) {
                switch (line.trim()) {
                    case "sync" -> engine.onForeground()
                            .ifPresent(outcome -> logger.info("{} sync: {} new plays", outcome.kind(),
                                    outcome.report().playFactsCreated()));
                    case "now" -> logger.info("Now playing: {}", engine.getCurrentTrack()
                            .map(track -> track.label() + " (" + engine.totalPlayCount(track.id()) + " plays)")
                            .orElse("nothing"));
                    case "quit" -> {
                        return;
                    }
                    default -> logger.info("Commands: sync, now, quit");
                }
            }
        }
    }

    private LiveTrackerCliExample() {
    }
}
