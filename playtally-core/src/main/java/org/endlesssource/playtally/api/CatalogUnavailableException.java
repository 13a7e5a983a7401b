package org.endlesssource.playtally.api;

/**
 * Transient failure to read the library. Safe to retry on the next sync.
 */
public class CatalogUnavailableException extends PlayTallyException {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
