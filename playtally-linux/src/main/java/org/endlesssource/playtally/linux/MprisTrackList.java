package org.endlesssource.playtally.linux;

import org.freedesktop.dbus.DBusPath;
import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;
import org.freedesktop.dbus.types.Variant;

import java.util.List;
import java.util.Map;

@DBusInterfaceName("org.mpris.MediaPlayer2.TrackList")
interface MprisTrackList extends DBusInterface {
    List<Map<String, Variant<?>>> GetTracksMetadata(List<DBusPath> trackIds);
}
