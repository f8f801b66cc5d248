package com.matey.anomaly.core.feed;

/**
 * Connection refused, reset, closed or silent for too long. Always recoverable by
 * reconnecting.
 */
public class FeedTransportException extends Exception {

    public FeedTransportException(String message) {
        super(message);
    }

    public FeedTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
