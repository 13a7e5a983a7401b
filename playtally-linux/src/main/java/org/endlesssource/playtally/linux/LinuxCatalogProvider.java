package org.endlesssource.playtally.linux;

import org.endlesssource.playtally.PlatformSupport;
import org.endlesssource.playtally.api.CatalogUnavailableException;
import org.endlesssource.playtally.api.MediaCatalog;
import org.endlesssource.playtally.api.PlayCounterSupport;
import org.endlesssource.playtally.api.PlayTallyOptions;
import org.endlesssource.playtally.spi.PlatformCatalogProvider;
import org.freedesktop.dbus.exceptions.DBusException;

public final class LinuxCatalogProvider implements PlatformCatalogProvider {
    @Override
    public String platformId() {
        return "linux";
    }

    @Override
    public boolean supportsCurrentOs() {
        String os = System.getProperty("os.name", "").toLowerCase();
        return os.contains("nix") || os.contains("nux");
    }

    @Override
    public PlatformSupport checkSupport() {
        if (!supportsCurrentOs()) {
            return PlatformSupport.unavailable(platformId(), "Current OS is not Linux");
        }
        try {
            Class.forName("org.freedesktop.dbus.connections.impl.DBusConnectionBuilder");
        } catch (ClassNotFoundException e) {
            return PlatformSupport.unavailable(platformId(), "Missing D-Bus runtime classes");
        }
        String address = System.getenv("DBUS_SESSION_BUS_ADDRESS");
        if (address == null || address.isBlank()) {
            return PlatformSupport.unavailable(platformId(), "No D-Bus session bus address in environment");
        }
        // counters exist only when the player sends xesam:useCount
        return PlatformSupport.available(platformId(), PlayCounterSupport.PLAYER_DEPENDENT);
    }

    @Override
    public MediaCatalog create(PlayTallyOptions options) {
        try {
            return new MprisMediaCatalog(options);
        } catch (DBusException e) {
            throw new CatalogUnavailableException("Failed to connect to the D-Bus session bus: " + e.getMessage(), e);
        }
    }
}
