package org.endlesssource.playtally.api;

/**
 * Base type of all failures raised by the tracking engine and its collaborators.
 */
public class PlayTallyException extends RuntimeException {

    public PlayTallyException(String message) {
        super(message);
    }

    public PlayTallyException(String message, Throwable cause) {
        super(message, cause);
    }
}
