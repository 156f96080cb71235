package com.districtintel.engine.source;

/**
 * A row source could not deliver a snapshot. The store is left untouched and the
 * caller decides whether to retry.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
