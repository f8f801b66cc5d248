package com.matey.anomaly.supervisor.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.config.JacksonConfig;
import com.matey.anomaly.core.io.AppendOnlyLog;
import com.matey.anomaly.core.lifecycle.ApplicationTerminator;
import com.matey.anomaly.core.notify.NotificationClient;
import com.matey.anomaly.supervisor.anomaly.DetectorOutputHandler;
import com.matey.anomaly.supervisor.anomaly.NotificationWorker;
import com.matey.anomaly.supervisor.metrics.SupervisorMetrics;
import com.matey.anomaly.supervisor.process.ChildProcessLauncher;
import com.matey.anomaly.supervisor.process.ProcessSupervisor;
import com.matey.anomaly.supervisor.process.SupervisorSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.web.client.RestTemplate;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Supervisor wiring. Child commands are whitespace separated; quoting is not supported,
 * so paths with spaces need a wrapper script.
 */
@Configuration
@Import({JacksonConfig.class, ApplicationTerminator.class})
public class SupervisorConfig {

    @Value("${app.supervisor.bridge-command}")
    private String bridgeCommand;

    @Value("${app.supervisor.detector-command}")
    private String detectorCommand;

    @Value("${app.supervisor.working-directory:}")
    private String workingDirectory;

    @Value("${app.supervisor.termination-grace-ms:20000}")
    private long terminationGraceMs;

    @Value("${app.supervisor.stream-log:logs/live-crypto.ndjson}")
    private String streamLogPath;

    @Value("${app.supervisor.anomaly-queue-capacity:10000}")
    private int anomalyQueueCapacity;

    @Value("${app.notification.url:https://us-central1-driftlock.cloudfunctions.net/analyzeAnomalies}")
    private String notificationUrl;

    @Value("${app.notification.query:Live stream soak test – Crypto Volatility (Binance)}")
    private String notificationQuery;

    @Value("${app.notification.journal:logs/live-notifications.ndjson}")
    private String journalPath;

    @Value("${app.notification.timeout-ms:30000}")
    private long notificationTimeoutMs;

    @Value("${app.notification.batch-size:5}")
    private int notificationBatchSize;

    @Value("${app.notification.batch-timeout-ms:60000}")
    private long notificationBatchTimeoutMs;

    @Value("${app.notification.poll-timeout-ms:1000}")
    private long pollTimeoutMs;

    @Bean
    public SupervisorSettings supervisorSettings() {
        return new SupervisorSettings(
                split(bridgeCommand),
                split(detectorCommand),
                workingDirectory.isBlank() ? null : new File(workingDirectory),
                Duration.ofMillis(terminationGraceMs));
    }

    @Bean
    public SupervisorMetrics supervisorMetrics() {
        return new SupervisorMetrics();
    }

    @Bean
    public BlockingQueue<JsonNode> anomalyQueue() {
        return new LinkedBlockingQueue<>(anomalyQueueCapacity);
    }

    @Bean
    public AppendOnlyLog streamLog() throws IOException {
        return AppendOnlyLog.open(Path.of(streamLogPath));
    }

    @Bean
    public AppendOnlyLog notificationJournal() throws IOException {
        return AppendOnlyLog.open(Path.of(journalPath));
    }

    @Bean
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(notificationTimeoutMs))
                .setReadTimeout(Duration.ofMillis(notificationTimeoutMs))
                .build();
    }

    @Bean
    public NotificationClient notificationClient(RestTemplate notificationRestTemplate, ObjectMapper objectMapper)
            throws IOException {
        return new NotificationClient(notificationRestTemplate, objectMapper, notificationUrl,
                notificationQuery, notificationJournal());
    }

    @Bean
    public DetectorOutputHandler detectorOutputHandler(ObjectMapper objectMapper) throws IOException {
        return new DetectorOutputHandler(streamLog(), objectMapper, anomalyQueue(), supervisorMetrics());
    }

    @Bean
    public NotificationWorker notificationWorker(NotificationClient notificationClient) {
        return new NotificationWorker(
                anomalyQueue(),
                notificationClient,
                supervisorMetrics(),
                notificationBatchSize,
                Duration.ofMillis(notificationBatchTimeoutMs),
                Duration.ofMillis(pollTimeoutMs),
                Duration.ofMillis(notificationTimeoutMs + pollTimeoutMs),
                Clock.systemUTC());
    }

    @Bean
    public ChildProcessLauncher childProcessLauncher() {
        return new ChildProcessLauncher();
    }

    @Bean
    public ProcessSupervisor processSupervisor(DetectorOutputHandler detectorOutputHandler,
                                               NotificationWorker notificationWorker) {
        return new ProcessSupervisor(childProcessLauncher(), supervisorSettings(),
                detectorOutputHandler, notificationWorker);
    }

    private static List<String> split(String command) {
        return Arrays.stream(command.trim().split("\\s+"))
                .filter(part -> !part.isEmpty())
                .toList();
    }
}
