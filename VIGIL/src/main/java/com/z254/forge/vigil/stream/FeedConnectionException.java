package com.z254.forge.vigil.stream;

/**
 * The sensor bus could not be reached, or an open subscription broke.
 */
public class FeedConnectionException extends Exception {

    public FeedConnectionException(String message) {
        super(message);
    }

    public FeedConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
