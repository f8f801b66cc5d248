package com.matey.anomaly.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the feed bridge.
 *
 * Subscribes to the exchange trade streams and prints one canonical record per line on
 * stdout, ready to be piped into the detection forwarder. Runs without a web server.
 */
@SpringBootApplication
public class FeedBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedBridgeApplication.class, args);
    }
}
