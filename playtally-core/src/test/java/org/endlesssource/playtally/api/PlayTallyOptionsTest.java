package org.endlesssource.playtally.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlayTallyOptionsTest {

    @Test
    void defaults_areExpected() {
        PlayTallyOptions defaults = PlayTallyOptions.defaults();
        assertTrue(defaults.isEventDrivenEnabled());
        assertEquals(Duration.ofSeconds(1), defaults.getTickInterval());
        assertEquals(Duration.ofHours(4), defaults.getFullSyncInterval());
        assertEquals(100, defaults.getReconcileBatchSize());
        assertEquals(PlayTallyOptions.DEFAULT_CATALOG_POLL_INTERVAL, defaults.getCatalogPollInterval());
        assertEquals(PlayTallyOptions.DEFAULT_CATALOG_UPDATE_INTERVAL, defaults.getCatalogUpdateInterval());
        assertTrue(defaults.getPreferredPlayer().isEmpty());
    }

    @Test
    void withMethods_returnCopies() {
        PlayTallyOptions defaults = PlayTallyOptions.defaults();
        PlayTallyOptions custom = defaults
                .withReconcileBatchSize(25)
                .withPreferredPlayer("rhythmbox")
                .withChartZone(ZoneOffset.UTC)
                .withEventDrivenEnabled(false);

        assertEquals(25, custom.getReconcileBatchSize());
        assertEquals("rhythmbox", custom.getPreferredPlayer().orElseThrow());
        assertEquals(ZoneOffset.UTC, custom.getChartZone());
        assertFalse(custom.isEventDrivenEnabled());
        assertEquals(100, defaults.getReconcileBatchSize());
    }

    @Test
    void blankPreferredPlayer_meansAnyPlayer() {
        assertTrue(PlayTallyOptions.defaults().withPreferredPlayer("  ").getPreferredPlayer().isEmpty());
    }

    @Test
    void withIntervals_rejectsZeroOrNegative() {
        PlayTallyOptions defaults = PlayTallyOptions.defaults();
        assertThrows(IllegalArgumentException.class, () -> defaults.withTickInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> defaults.withFullSyncInterval(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> defaults.withCatalogPollInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> defaults.withCatalogUpdateInterval(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> defaults.withReconcileBatchSize(0));
        assertThrows(NullPointerException.class, () -> defaults.withChartZone(null));
    }
}
