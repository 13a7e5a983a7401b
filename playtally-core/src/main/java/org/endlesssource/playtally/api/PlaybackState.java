package org.endlesssource.playtally.api;

/**
 * Playback state enumeration
 */
public enum PlaybackState {
    PLAYING,
    PAUSED,
    STOPPED,
    INTERRUPTED,
    UNKNOWN
}
