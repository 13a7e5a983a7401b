package org.endlesssource.playtally.spi;

import org.endlesssource.playtally.PlatformSupport;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PlayTallyOptions;

/**
 * SPI implemented by platform-specific modules, discovered with {@link java.util.ServiceLoader}.
 */
public interface PlatformCatalogProvider {

    /**
     * Stable platform id, e.g. linux.
     */
    String platformId();

    /**
     * True when this provider targets the current operating system.
     */
    boolean supportsCurrentOs();

    /**
     * Check whether a catalog can be created here and which play counters it will expose.
     * Must not open the library itself.
     */
    PlatformSupport checkSupport();

    /**
     * Create the platform media catalog.
     * @throws org.endlesssource.playtally.api.CatalogUnavailableException if the library cannot be reached
     */
    MediaCatalog create(PlayTallyOptions options);
}
