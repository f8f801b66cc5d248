package com.matey.anomaly.core.feed;

import java.util.List;

/**
 * Exchange-specific subscribe handshake over a streaming connection.
 */
public interface SubscriptionProtocol {

    String subscribeRequest(List<String> topics, long requestId) throws FeedTransportException;

    /**
     * @return true for acknowledgements, error replies, heartbeats and status frames,
     * which are handled here and never reach the message handler
     */
    boolean isControlFrame(String payload, long requestId);
}
