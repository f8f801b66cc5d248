package com.matey.anomaly.core.feed;

/**
 * One event delivered by a {@link FeedSession} into the connector's inbox.
 */
public record FeedFrame(Kind kind, String payload, Throwable error) {

    public enum Kind {
        TEXT,
        CLOSED,
        ERROR
    }

    public static FeedFrame text(String payload) {
        return new FeedFrame(Kind.TEXT, payload, null);
    }

    public static FeedFrame closed(String reason) {
        return new FeedFrame(Kind.CLOSED, reason, null);
    }

    public static FeedFrame error(Throwable error) {
        return new FeedFrame(Kind.ERROR, error == null ? null : error.getMessage(), error);
    }
}
