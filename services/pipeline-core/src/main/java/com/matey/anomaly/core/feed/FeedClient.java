package com.matey.anomaly.core.feed;

import java.util.function.Consumer;

/**
 * A long-running upstream source of raw messages. {@link #run(Consumer)} blocks on the
 * caller's thread, recovers from upstream failures on its own and returns once
 * {@link #stop()} has been called.
 */
public interface FeedClient {

    void run(Consumer<String> handler);

    void stop();
}
