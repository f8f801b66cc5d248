package com.matey.anomaly.core.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes the Spring context (running every {@code @PreDestroy} shutdown hook) and exits
 * the JVM with the given code. Only the first request wins.
 *
 * The exit runs on its own thread so a caller that the context shutdown waits for
 * (a receiver or reader thread) is not blocked by it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationTerminator {

    private final ApplicationContext applicationContext;

    private final AtomicBoolean terminating = new AtomicBoolean();

    public void terminate(int exitCode, String reason) {
        if (!terminating.compareAndSet(false, true)) {
            log.debug("Termination already in progress; ignoring '{}'", reason);
            return;
        }
        if (exitCode == 0) {
            log.info("Shutting down: {}", reason);
        } else {
            log.error("Shutting down with exitCode={}: {}", exitCode, reason);
        }
        Thread exit = new Thread(
                () -> System.exit(SpringApplication.exit(applicationContext, () -> exitCode)),
                "app-terminator");
        exit.start();
    }

    public boolean isTerminating() {
        return terminating.get();
    }
}
