package org.endlesssource.playtally;

import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PlayCounterSupport;
import org.endlesssource.playtally.api.PlayTallyOptions;
import org.endlesssource.playtally.spi.PlatformCatalogProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

public final class PlayTally {
    private static final Logger logger = LoggerFactory.getLogger(PlayTally.class);

    private PlayTally() {}

    /**
     * Create a media catalog for the current platform
     * @return MediaCatalog implementation for current OS
     * @throws UnsupportedOperationException if no provider can run here
     */
    public static MediaCatalog createCatalog() {
        return createCatalog(PlayTallyOptions.defaults());
    }

    /**
     * Create a media catalog for the current platform with options.
     * When several providers are available, the one with the best play counter
     * support wins, then the lowest platform id.
     * @param options Configuration options
     * @return MediaCatalog implementation for current OS
     * @throws UnsupportedOperationException if no provider can run here
     */
    public static MediaCatalog createCatalog(PlayTallyOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        return createCatalog(loadProviders(), options);
    }

    static MediaCatalog createCatalog(List<PlatformCatalogProvider> providers, PlayTallyOptions options) {
        List<PlatformCatalogProvider> candidates = providers.stream()
                .filter(PlatformCatalogProvider::supportsCurrentOs)
                .toList();
        if (candidates.isEmpty()) {
            throw new UnsupportedOperationException("No catalog provider for " + System.getProperty("os.name"));
        }

        PlatformCatalogProvider best = null;
        PlatformSupport bestSupport = null;
        List<String> reasons = new ArrayList<>();
        for (PlatformCatalogProvider provider : sortedById(candidates)) {
            PlatformSupport support = provider.checkSupport();
            logger.debug("Provider {}: available={}, play counters={}", provider.platformId(),
                    support.available(), support.playCounters());
            if (!support.available()) {
                reasons.add(provider.platformId() + ": " + support.reason());
            } else if (bestSupport == null || support.playCounters().isBetterThan(bestSupport.playCounters())) {
                best = provider;
                bestSupport = support;
            }
        }
        if (best == null) {
            throw new UnsupportedOperationException("No catalog provider is available: " + String.join("; ", reasons));
        }

        if (bestSupport.playCounters() == PlayCounterSupport.NONE) {
            logger.warn("Catalog provider {} keeps no play counters; plays made elsewhere will not be counted",
                    best.platformId());
        } else {
            logger.info("Using catalog provider {} (play counters: {})", best.platformId(), bestSupport.playCounters());
        }
        return best.create(options);
    }

    /**
     * Check if the current platform is supported
     * @return true if a catalog provider can run here
     */
    public static boolean isPlatformSupported() {
        return getCurrentPlatformSupport().available();
    }

    /**
     * Support of the provider {@link #createCatalog()} would pick, or the reasons none can run.
     */
    public static PlatformSupport getCurrentPlatformSupport() {
        List<PlatformSupport> supports = listPlatformSupport();
        PlatformSupport best = null;
        for (PlatformSupport support : supports) {
            if (support.available() && (best == null || support.playCounters().isBetterThan(best.playCounters()))) {
                best = support;
            }
        }
        if (best != null) {
            return best;
        }
        String reasons = supports.stream()
                .map(PlatformSupport::reason)
                .filter(reason -> !reason.isBlank())
                .collect(Collectors.joining("; "));
        return PlatformSupport.unavailable(System.getProperty("os.name", "unknown"),
                reasons.isBlank() ? "No catalog provider for this platform" : reasons);
    }

    /**
     * Support of every provider targeting this OS, ordered by platform id.
     */
    public static List<PlatformSupport> listPlatformSupport() {
        return sortedById(loadProviders()).stream()
                .filter(PlatformCatalogProvider::supportsCurrentOs)
                .map(PlatformCatalogProvider::checkSupport)
                .toList();
    }

    private static List<PlatformCatalogProvider> sortedById(List<PlatformCatalogProvider> providers) {
        return providers.stream()
                .sorted(Comparator.comparing(PlatformCatalogProvider::platformId))
                .toList();
    }

    private static List<PlatformCatalogProvider> loadProviders() {
        ServiceLoader<PlatformCatalogProvider> loader = ServiceLoader.load(PlatformCatalogProvider.class);
        List<PlatformCatalogProvider> providers = new ArrayList<>();
        loader.iterator().forEachRemaining(providers::add);
        if (logger.isDebugEnabled()) {
            logger.debug("Discovered catalog providers: {}",
                    providers.stream().map(PlatformCatalogProvider::platformId).collect(Collectors.joining(", ")));
        }
        return providers;
    }
}
