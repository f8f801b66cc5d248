package com.matey.anomaly.core.feed;

public interface FeedSession extends AutoCloseable {

    void send(String text) throws FeedTransportException;

    boolean isOpen();

    @Override
    void close();
}
