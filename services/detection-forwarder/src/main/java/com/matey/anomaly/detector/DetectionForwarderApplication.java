package com.matey.anomaly.detector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the detection forwarder.
 *
 * With {@code app.pipeline.source=feed} it is the whole pipeline in one process:
 * exchange feed, normalization, batching and forwarding to the detection API. With
 * {@code app.pipeline.source=stdin} it reads canonical records produced by the feed
 * bridge and writes one detection result per record to stdout.
 */
@SpringBootApplication
public class DetectionForwarderApplication {

    public static void main(String[] args) {
        SpringApplication.run(DetectionForwarderApplication.class, args);
    }
}
