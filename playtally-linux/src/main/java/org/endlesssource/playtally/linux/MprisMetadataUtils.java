package org.endlesssource.playtally.linux;

import org.endlesssource.playtally.api.CatalogTrack;
import org.endlesssource.playtally.api.PlaybackState;
import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.types.Variant;

import java.lang.reflect.Array;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

final class MprisMetadataUtils {
    static final String NO_TRACK = "/org/mpris/MediaPlayer2/TrackList/NoTrack";

    private MprisMetadataUtils() {
    }

    static Optional<Map<String, Object>> toMetadataMap(Object metadata) {
        if (metadata == null) {
            return Optional.empty();
        }

        Object value;
        if (metadata instanceof Variant<?> metadataVariant) {
            value = metadataVariant.getValue();
        } else if (metadata instanceof Map<?, ?>) {
            // Firefox and a few others hand out the dictionary unwrapped
            value = metadata;
        } else {
            return Optional.empty();
        }

        if (!(value instanceof Map<?, ?> rawMetadata) || rawMetadata.isEmpty()) {
            return Optional.empty();
        }

        return Optional.of(normalizeMap(rawMetadata));
    }

    private static Map<String, Object> normalizeMap(Map<?, ?> rawMap) {
        Map<String, Object> normalized = new HashMap<>();
        rawMap.forEach((key, rawValue) -> {
            if (key instanceof String keyStr) {
                normalized.put(keyStr, unwrap(rawValue));
            }
        });
        return normalized;
    }

    static Object unwrap(Object value) {
        if (value instanceof Variant<?> variant) {
            return unwrap(variant.getValue());
        }
        if (value instanceof Map<?, ?> nestedMap) {
            return normalizeMap(nestedMap);
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(MprisMetadataUtils::unwrap)
                    .collect(Collectors.toList());
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> unwrapped = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                unwrapped.add(unwrap(Array.get(value, i)));
            }
            return unwrapped;
        }
        return value;
    }

    /**
     * Build a catalog entry from normalized MPRIS metadata.
     * <p>
     * The track URL is preferred as id because it survives player restarts;
     * many players generate {@code mpris:trackid} per session. The system
     * counter comes from {@code xesam:useCount}, 0 when the player does not
     * expose one.
     *
     * @return empty if the metadata identifies no track
     */
    static Optional<CatalogTrack> toCatalogTrack(Map<String, Object> metadata) {
        Optional<String> id = stringValue(metadata.get("xesam:url"))
                .or(() -> trackId(metadata).filter(path -> !NO_TRACK.equals(path)));
        if (id.isEmpty()) {
            return Optional.empty();
        }
        String title = stringValue(metadata.get("xesam:title")).orElse(null);
        String artist = joinedArtists(metadata).orElse(null);
        String album = stringValue(metadata.get("xesam:album")).orElse("");
        Duration length = longValue(metadata.get("mpris:length"))
                .filter(micros -> micros > 0)
                .map(micros -> Duration.ofNanos(micros * 1000))
                .orElse(Duration.ZERO);
        int useCount = longValue(metadata.get("xesam:useCount"))
                .map(count -> (int) Math.min(Integer.MAX_VALUE, Math.max(0, count)))
                .orElse(0);
        return Optional.of(new CatalogTrack(id.get(), title, artist, album, length, useCount));
    }

    /**
     * @return true if the player publishes a play counter for this track
     */
    static boolean hasUseCount(Map<String, Object> metadata) {
        return longValue(metadata.get("xesam:useCount")).isPresent();
    }

    static Optional<String> trackId(Map<String, Object> metadata) {
        Object value = metadata.get("mpris:trackid");
        if (value instanceof DBusPath path) {
            return Optional.of(path.getPath());
        }
        return stringValue(value);
    }

    static PlaybackState parsePlaybackStatus(Object status) {
        Object value = unwrap(status);
        if (!(value instanceof String text)) {
            return PlaybackState.UNKNOWN;
        }
        switch (text.toLowerCase()) {
            case "playing":
                return PlaybackState.PLAYING;
            case "paused":
                return PlaybackState.PAUSED;
            case "stopped":
                return PlaybackState.STOPPED;
            default:
                return PlaybackState.UNKNOWN;
        }
    }

    private static Optional<String> joinedArtists(Map<String, Object> metadata) {
        Object value = metadata.get("xesam:artist");
        if (value instanceof List<?> list) {
            List<String> names = new ArrayList<>();
            for (Object element : list) {
                stringValue(element).ifPresent(names::add);
            }
            if (!names.isEmpty()) {
                return Optional.of(String.join(", ", names));
            }
        } else {
            Optional<String> single = stringValue(value);
            if (single.isPresent()) {
                return single;
            }
        }
        return stringValue(metadata.get("xesam:albumArtist"));
    }

    private static Optional<String> stringValue(Object value) {
        if (value instanceof String str && !str.isBlank()) {
            return Optional.of(str);
        }
        if (value instanceof List<?> list && !list.isEmpty()) {
            return stringValue(list.get(0));
        }
        return Optional.empty();
    }

    private static Optional<Long> longValue(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (value instanceof String str) {
            try {
                return Optional.of(Long.parseLong(str.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
