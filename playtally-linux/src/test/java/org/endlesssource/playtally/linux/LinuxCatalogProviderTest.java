package org.endlesssource.playtally.linux;

import org.endlesssource.playtally.PlatformSupport;
import org.endlesssource.playtally.api.PlayCounterSupport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinuxCatalogProviderTest {
    private final LinuxCatalogProvider provider = new LinuxCatalogProvider();

    @Test
    void platformId_isLinux() {
        assertEquals("linux", provider.platformId());
    }

    @Test
    void support_isConsistentWithOs() {
        PlatformSupport support = provider.checkSupport();

        assertEquals("linux", support.platform());
        if (!provider.supportsCurrentOs()) {
            assertFalse(support.available());
        }
        if (support.available()) {
            assertEquals(PlayCounterSupport.PLAYER_DEPENDENT, support.playCounters());
        } else {
            assertFalse(support.reason().isBlank());
            assertFalse(support.canCatchUpMissedPlays());
        }
    }
}
