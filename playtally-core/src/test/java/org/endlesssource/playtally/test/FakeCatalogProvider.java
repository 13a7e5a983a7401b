package org.endlesssource.playtally.test;

import org.endlesssource.playtally.PlatformSupport;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PlayCounterSupport;
import org.endlesssource.playtally.api.PlayTallyOptions;
import org.endlesssource.playtally.spi.PlatformCatalogProvider;

import java.util.concurrent.atomic.AtomicReference;

public final class FakeCatalogProvider implements PlatformCatalogProvider {
    private static final AtomicReference<PlayTallyOptions> LAST_OPTIONS = new AtomicReference<>();

    @Override
    public String platformId() {
        return "test-fake";
    }

    @Override
    public boolean supportsCurrentOs() {
        return true;
    }

    @Override
    public PlatformSupport checkSupport() {
        return PlatformSupport.available(platformId(), PlayCounterSupport.SYSTEM);
    }

    @Override
    public MediaCatalog create(PlayTallyOptions options) {
        LAST_OPTIONS.set(options);
        return new FakeMediaCatalog().add("fake-1", "Fake Song", 180, 3);
    }

    public static PlayTallyOptions consumeLastOptions() {
        return LAST_OPTIONS.getAndSet(null);
    }
}
