package com.matey.anomaly.supervisor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point for the pipeline supervisor.
 *
 * Launches the feed bridge piped into the detection forwarder, keeps an append-only log
 * of every detection result and sends confirmed anomalies on to the notification
 * endpoint in small batches.
 */
@SpringBootApplication
public class PipelineSupervisorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PipelineSupervisorApplication.class, args);
    }
}
