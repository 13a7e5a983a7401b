package org.endlesssource.playtally.api;

/**
 * A store write did not commit. Nothing of the failed batch was applied.
 */
public class PersistenceException extends PlayTallyException {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
