package com.matey.anomaly.core.feed;

import java.net.URI;
import java.util.concurrent.BlockingQueue;

/**
 * Opens upstream connections. Inbound text, close and error events are pushed into
 * the given inbox in arrival order.
 */
public interface FeedTransport {

    FeedSession connect(URI uri, BlockingQueue<FeedFrame> inbox) throws FeedTransportException;
}
