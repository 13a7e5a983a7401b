package org.endlesssource.playtally.linux;

import org.endlesssource.playtally.api.CatalogTrack;
import org.endlesssource.playtally.api.CatalogUnavailableException;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PermissionDeniedException;
import org.endlesssource.playtally.api.PlayTallyException;
import org.endlesssource.playtally.api.PlayTallyOptions;
import org.endlesssource.playtally.api.PlaybackListener;
import org.endlesssource.playtally.api.PlaybackState;
import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.freedesktop.dbus.interfaces.DBus;
import org.freedesktop.dbus.interfaces.Properties;
import org.freedesktop.dbus.types.Variant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Media catalog backed by an MPRIS player on the D-Bus session bus.
 * <p>
 * The library is the player's track list (when it exposes one) plus every
 * track seen playing since the catalog was opened. Play counters come from
 * {@code xesam:useCount}; until a track carrying one is seen the catalog
 * reports no play counts.
 */
public class MprisMediaCatalog implements MediaCatalog {
    private static final Logger logger = LoggerFactory.getLogger(MprisMediaCatalog.class);

    private static final String BUS_PREFIX = "org.mpris.MediaPlayer2.";
    private static final String OBJECT_PATH = "/org/mpris/MediaPlayer2";
    private static final String ROOT_INTERFACE = "org.mpris.MediaPlayer2";
    private static final String PLAYER_INTERFACE = "org.mpris.MediaPlayer2.Player";
    private static final String TRACKLIST_INTERFACE = "org.mpris.MediaPlayer2.TrackList";

    private final DBusConnection connection;
    private final PlayTallyOptions options;
    private final List<PlaybackListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, CatalogTrack> knownTracks = new LinkedHashMap<>();
    private final ScheduledExecutorService executor;

    private volatile String busName;
    private volatile long lastDiscoveryNanos;
    private volatile Optional<CatalogTrack> cachedTrack = Optional.empty();
    private volatile PlaybackState cachedState = PlaybackState.UNKNOWN;
    private volatile boolean closed;
    private volatile boolean useCountSeen;

    public MprisMediaCatalog(PlayTallyOptions options) throws DBusException {
        this(DBusConnectionBuilder.forSessionBus().build(), options);
    }

    MprisMediaCatalog(DBusConnection connection, PlayTallyOptions options) {
        this.connection = connection;
        this.options = options;
        this.executor = options.isEventDrivenEnabled()
                ? Executors.newSingleThreadScheduledExecutor(runnable -> {
                    Thread thread = new Thread(runnable, "playtally-mpris");
                    thread.setDaemon(true);
                    return thread;
                })
                : null;
        discoverPlayer();
        if (executor != null) {
            checkForChanges();
            long intervalMs = options.getCatalogUpdateInterval().toMillis();
            executor.scheduleWithFixedDelay(this::checkForChanges, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public List<CatalogTrack> enumerateTracks() {
        String player = requirePlayer();
        try {
            Properties properties = properties(player);
            Object hasTrackList = MprisMetadataUtils.unwrap(properties.Get(ROOT_INTERFACE, "HasTrackList"));
            if (Boolean.TRUE.equals(hasTrackList)) {
                List<DBusPath> trackIds = trackPaths(properties.Get(TRACKLIST_INTERFACE, "Tracks"));
                if (!trackIds.isEmpty()) {
                    MprisTrackList trackList = connection.getRemoteObject(player, OBJECT_PATH, MprisTrackList.class);
                    for (Map<String, Variant<?>> metadata : trackList.GetTracksMetadata(trackIds)) {
                        MprisMetadataUtils.toMetadataMap(metadata)
                                .flatMap(this::toCatalogTrack)
                                .ifPresent(this::remember);
                    }
                }
            }
            queryNowPlaying(properties).ifPresent(this::remember);
        } catch (DBusException | DBusExecutionException e) {
            throw translate("enumerate tracks of " + player, e);
        }
        synchronized (knownTracks) {
            logger.debug("Enumerated {} tracks from {}", knownTracks.size(), player);
            return new ArrayList<>(knownTracks.values());
        }
    }

    @Override
    public boolean reportsPlayCounts() {
        return useCountSeen;
    }

    @Override
    public Optional<CatalogTrack> currentlyPlaying() {
        if (executor != null) {
            return cachedTrack;
        }
        String player = currentPlayer();
        if (player == null) {
            return Optional.empty();
        }
        try {
            return queryNowPlaying(properties(player));
        } catch (DBusException | DBusExecutionException e) {
            logger.debug("Failed to read now playing from {}: {}", player, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public PlaybackState getPlaybackState() {
        if (executor != null) {
            return cachedState;
        }
        String player = currentPlayer();
        if (player == null) {
            return PlaybackState.STOPPED;
        }
        try {
            return queryPlaybackState(properties(player));
        } catch (DBusException | DBusExecutionException e) {
            logger.debug("Failed to read playback status from {}: {}", player, e.getMessage());
            return PlaybackState.UNKNOWN;
        }
    }

    @Override
    public void addPlaybackListener(PlaybackListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removePlaybackListener(PlaybackListener listener) {
        listeners.remove(listener);
    }

    /**
     * Bus name of the player in use, if any.
     */
    public Optional<String> getPlayerBusName() {
        return Optional.ofNullable(busName);
    }

    private void checkForChanges() {
        if (closed) {
            return;
        }
        String player = currentPlayer();
        if (player == null) {
            publish(Optional.empty(), PlaybackState.STOPPED);
            return;
        }
        try {
            Properties properties = properties(player);
            PlaybackState state = queryPlaybackState(properties);
            Optional<CatalogTrack> track = queryNowPlaying(properties);
            track.ifPresent(this::remember);
            publish(track, state);
        } catch (DBusException | DBusExecutionException e) {
            logger.debug("Lost player {}: {}", player, e.getMessage());
            busName = null;
        } catch (RuntimeException e) {
            logger.warn("Error checking for changes in {}", player, e);
        }
    }

    private void publish(Optional<CatalogTrack> track, PlaybackState state) {
        boolean trackChanged = !sameTrack(cachedTrack, track);
        cachedTrack = track;
        if (trackChanged) {
            listeners.forEach(listener -> listener.onNowPlayingChanged(track));
        }
        if (state != cachedState) {
            cachedState = state;
            listeners.forEach(listener -> listener.onPlaybackStateChanged(state));
        }
    }

    private static boolean sameTrack(Optional<CatalogTrack> a, Optional<CatalogTrack> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return a.isEmpty() && b.isEmpty();
        }
        return a.get().id().equals(b.get().id());
    }

    private Optional<CatalogTrack> queryNowPlaying(Properties properties) {
        Object metadata = properties.Get(PLAYER_INTERFACE, "Metadata");
        return MprisMetadataUtils.toMetadataMap(metadata).flatMap(this::toCatalogTrack);
    }

    private Optional<CatalogTrack> toCatalogTrack(Map<String, Object> metadata) {
        if (!useCountSeen && MprisMetadataUtils.hasUseCount(metadata)) {
            logger.info("Player publishes play counters (xesam:useCount)");
            useCountSeen = true;
        }
        return MprisMetadataUtils.toCatalogTrack(metadata);
    }

    private static PlaybackState queryPlaybackState(Properties properties) {
        return MprisMetadataUtils.parsePlaybackStatus(properties.Get(PLAYER_INTERFACE, "PlaybackStatus"));
    }

    private void remember(CatalogTrack track) {
        synchronized (knownTracks) {
            knownTracks.put(track.id(), track);
        }
    }

    private Properties properties(String player) throws DBusException {
        return connection.getRemoteObject(player, OBJECT_PATH, Properties.class);
    }

    private String requirePlayer() {
        String player = currentPlayer();
        if (player == null) {
            throw new CatalogUnavailableException("No MPRIS player found on the session bus");
        }
        return player;
    }

    private String currentPlayer() {
        String player = busName;
        long pollNanos = options.getCatalogPollInterval().toNanos();
        if (player == null && System.nanoTime() - lastDiscoveryNanos >= pollNanos) {
            player = discoverPlayer();
        }
        return player;
    }

    private synchronized String discoverPlayer() {
        lastDiscoveryNanos = System.nanoTime();
        try {
            DBus dbus = connection.getRemoteObject("org.freedesktop.DBus", "/org/freedesktop/DBus", DBus.class);
            List<String> players = Arrays.stream(dbus.ListNames())
                    .filter(name -> name.startsWith(BUS_PREFIX))
                    .sorted()
                    .toList();
            String chosen = choosePlayer(players);
            if (chosen != null && !chosen.equals(busName)) {
                logger.info("Using MPRIS player {}", chosen);
            }
            busName = chosen;
            return chosen;
        } catch (DBusException | DBusExecutionException e) {
            logger.error("Failed to discover MPRIS players", e);
            return null;
        }
    }

    private String choosePlayer(List<String> players) {
        Optional<String> preferred = options.getPreferredPlayer().map(String::toLowerCase);
        if (preferred.isPresent()) {
            Optional<String> match = players.stream()
                    .filter(name -> name.substring(BUS_PREFIX.length()).toLowerCase().contains(preferred.get()))
                    .findFirst();
            if (match.isPresent()) {
                return match.get();
            }
            logger.debug("Preferred player {} not running", preferred.get());
        }
        for (String name : players) {
            try {
                if (queryPlaybackState(properties(name)) == PlaybackState.PLAYING) {
                    return name;
                }
            } catch (DBusException | DBusExecutionException e) {
                logger.debug("Skipping unresponsive player {}: {}", name, e.getMessage());
            }
        }
        return players.isEmpty() ? null : players.get(0);
    }

    static List<DBusPath> trackPaths(Object tracksProperty) {
        Object value = MprisMetadataUtils.unwrap(tracksProperty);
        List<DBusPath> paths = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element instanceof DBusPath path) {
                    paths.add(path);
                } else if (element instanceof String text && !text.isBlank()) {
                    paths.add(new DBusPath(text));
                }
            }
        }
        return paths;
    }

    static PlayTallyException translate(String action, Exception e) {
        if (e instanceof DBusExecutionException execution
                && execution.getType() != null
                && execution.getType().endsWith("AccessDenied")) {
            return new PermissionDeniedException("Access denied while trying to " + action, e);
        }
        return new CatalogUnavailableException("Failed to " + action + ": " + e.getMessage(), e);
    }

    @Override
    public void close() {
        closed = true;
        if (executor != null) {
            executor.shutdownNow();
        }
        listeners.clear();
        try {
            connection.close();
        } catch (Exception e) {
            logger.error("Failed to close D-Bus connection", e);
        }
    }
}
