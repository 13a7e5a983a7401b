package org.endlesssource.playtally.api;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration options for the tracking engine and {@link MediaCatalog} implementations.
 */
public final class PlayTallyOptions {
    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_FULL_SYNC_INTERVAL = Duration.ofHours(4);
    public static final int DEFAULT_RECONCILE_BATCH_SIZE = 100;
    public static final Duration DEFAULT_CATALOG_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CATALOG_UPDATE_INTERVAL = Duration.ofMillis(200);

    private final Duration tickInterval;
    private final Duration fullSyncInterval;
    private final int reconcileBatchSize;
    private final boolean eventDrivenEnabled;
    private final Duration catalogPollInterval;
    private final Duration catalogUpdateInterval;
    private final String preferredPlayer;
    private final ZoneId chartZone;

    private PlayTallyOptions(Duration tickInterval,
                             Duration fullSyncInterval,
                             int reconcileBatchSize,
                             boolean eventDrivenEnabled,
                             Duration catalogPollInterval,
                             Duration catalogUpdateInterval,
                             String preferredPlayer,
                             ZoneId chartZone) {
        this.tickInterval = requirePositive("tickInterval", tickInterval);
        this.fullSyncInterval = requirePositive("fullSyncInterval", fullSyncInterval);
        if (reconcileBatchSize <= 0) {
            throw new IllegalArgumentException("reconcileBatchSize must be positive");
        }
        this.reconcileBatchSize = reconcileBatchSize;
        this.eventDrivenEnabled = eventDrivenEnabled;
        this.catalogPollInterval = requirePositive("catalogPollInterval", catalogPollInterval);
        this.catalogUpdateInterval = requirePositive("catalogUpdateInterval", catalogUpdateInterval);
        this.preferredPlayer = preferredPlayer == null || preferredPlayer.isBlank() ? null : preferredPlayer;
        this.chartZone = Objects.requireNonNull(chartZone, "chartZone must not be null");
    }

    public static PlayTallyOptions defaults() {
        return new PlayTallyOptions(DEFAULT_TICK_INTERVAL, DEFAULT_FULL_SYNC_INTERVAL, DEFAULT_RECONCILE_BATCH_SIZE,
                true, DEFAULT_CATALOG_POLL_INTERVAL, DEFAULT_CATALOG_UPDATE_INTERVAL, null, ZoneId.systemDefault());
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public Duration getFullSyncInterval() {
        return fullSyncInterval;
    }

    public int getReconcileBatchSize() {
        return reconcileBatchSize;
    }

    public boolean isEventDrivenEnabled() {
        return eventDrivenEnabled;
    }

    public Duration getCatalogPollInterval() {
        return catalogPollInterval;
    }

    public Duration getCatalogUpdateInterval() {
        return catalogUpdateInterval;
    }

    /**
     * Player application to bind to, matched case-insensitively as a substring
     * of the player name. Empty means the first suitable player.
     */
    public Optional<String> getPreferredPlayer() {
        return Optional.ofNullable(preferredPlayer);
    }

    public ZoneId getChartZone() {
        return chartZone;
    }

    public PlayTallyOptions withTickInterval(Duration interval) {
        return new PlayTallyOptions(interval, fullSyncInterval, reconcileBatchSize, eventDrivenEnabled,
                catalogPollInterval, catalogUpdateInterval, preferredPlayer, chartZone);
    }

    public PlayTallyOptions withFullSyncInterval(Duration interval) {
        return new PlayTallyOptions(tickInterval, interval, reconcileBatchSize, eventDrivenEnabled,
                catalogPollInterval, catalogUpdateInterval, preferredPlayer, chartZone);
    }

    public PlayTallyOptions withReconcileBatchSize(int batchSize) {
        return new PlayTallyOptions(tickInterval, fullSyncInterval, batchSize, eventDrivenEnabled,
                catalogPollInterval, catalogUpdateInterval, preferredPlayer, chartZone);
    }

    public PlayTallyOptions withEventDrivenEnabled(boolean enabled) {
        return new PlayTallyOptions(tickInterval, fullSyncInterval, reconcileBatchSize, enabled,
                catalogPollInterval, catalogUpdateInterval, preferredPlayer, chartZone);
    }

    public PlayTallyOptions withCatalogPollInterval(Duration interval) {
        return new PlayTallyOptions(tickInterval, fullSyncInterval, reconcileBatchSize, eventDrivenEnabled,
                interval, catalogUpdateInterval, preferredPlayer, chartZone);
    }

    public PlayTallyOptions withCatalogUpdateInterval(Duration interval) {
        return new PlayTallyOptions(tickInterval, fullSyncInterval, reconcileBatchSize, eventDrivenEnabled,
                catalogPollInterval, interval, preferredPlayer, chartZone);
    }

    public PlayTallyOptions withPreferredPlayer(String player) {
        return new PlayTallyOptions(tickInterval, fullSyncInterval, reconcileBatchSize, eventDrivenEnabled,
                catalogPollInterval, catalogUpdateInterval, player, chartZone);
    }

    public PlayTallyOptions withChartZone(ZoneId zone) {
        return new PlayTallyOptions(tickInterval, fullSyncInterval, reconcileBatchSize, eventDrivenEnabled,
                catalogPollInterval, catalogUpdateInterval, preferredPlayer, zone);
    }

    private static Duration requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }
}
