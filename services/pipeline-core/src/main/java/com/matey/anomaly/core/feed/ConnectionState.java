package com.matey.anomaly.core.feed;

/**
 * Lifecycle of the upstream feed connection.
 *
 * DISCONNECTED -> CONNECTING -> SUBSCRIBED -> STREAMING, and on any transport
 * failure RECONNECTING (waiting out the current delay) -> CONNECTING.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    SUBSCRIBED,
    STREAMING,
    RECONNECTING
}
