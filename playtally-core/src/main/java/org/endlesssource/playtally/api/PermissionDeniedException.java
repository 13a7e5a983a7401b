package org.endlesssource.playtally.api;

/**
 * The platform refused access to the library or to playback notifications.
 * Nothing is retried until access is granted again.
 */
public class PermissionDeniedException extends PlayTallyException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
