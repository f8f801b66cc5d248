package com.matey.anomaly.detector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.config.FeedConfig;
import com.matey.anomaly.core.config.JacksonConfig;
import com.matey.anomaly.core.feed.FeedClient;
import com.matey.anomaly.core.forward.DetectionSettings;
import com.matey.anomaly.core.forward.FailurePolicy;
import com.matey.anomaly.core.forward.Forwarder;
import com.matey.anomaly.core.forward.RetrySettings;
import com.matey.anomaly.core.io.NdjsonWriter;
import com.matey.anomaly.core.lifecycle.ApplicationTerminator;
import com.matey.anomaly.core.normalize.RawMessageNormalizer;
import com.matey.anomaly.core.retry.BackoffPolicy;
import com.matey.anomaly.core.retry.Sleeper;
import com.matey.anomaly.detector.metrics.PipelineStats;
import com.matey.anomaly.detector.pipeline.BatchSettings;
import com.matey.anomaly.detector.pipeline.DetectionResultEmitter;
import com.matey.anomaly.detector.pipeline.FeedRecordSource;
import com.matey.anomaly.detector.pipeline.RecordSource;
import com.matey.anomaly.detector.pipeline.StdinRecordSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wiring of the detection pipeline.
 *
 * The record source is chosen by {@code app.pipeline.source}: {@code feed} reads the
 * exchange stream directly, {@code stdin} reads canonical records from the feed bridge
 * and also emits one detection result per record on stdout.
 */
@Slf4j
@Configuration
@Import({JacksonConfig.class, FeedConfig.class, ApplicationTerminator.class})
public class PipelineConfig {

    @Value("${app.detection.api-url:https://driftlock.web.app/api/v1}")
    private String apiUrl;

    @Value("${app.detection.api-key:}")
    private String apiKey;

    @Value("${app.detection.profile:standard}")
    private String profile;

    @Value("${app.detection.window-size:#{null}}")
    private Integer windowSize;

    @Value("${app.detection.baseline-lines:#{null}}")
    private Integer baselineLines;

    @Value("${app.detection.ncd-threshold:#{null}}")
    private Double ncdThreshold;

    @Value("${app.detection.p-value-threshold:#{null}}")
    private Double pValueThreshold;

    @Value("${app.detection.timeout-ms:10000}")
    private long timeoutMs;

    @Value("${app.detection.failure-policy:DROP}")
    private FailurePolicy failurePolicy;

    @Value("${app.detection.max-attempts:3}")
    private int maxAttempts;

    @Value("${app.detection.max-rate-limit-retries:0}")
    private int maxRateLimitRetries;

    @Value("${app.batch.size:10}")
    private int batchSize;

    @Value("${app.batch.interval-ms:5000}")
    private long batchIntervalMs;

    @Value("${app.batch.tick-ms:100}")
    private long batchTickMs;

    @Value("${app.pipeline.shutdown-grace-ms:15000}")
    private long shutdownGraceMs;

    @Bean
    public RestTemplate detectionRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    @Bean
    public DetectionSettings detectionSettings() {
        DetectionSettings settings = DetectionSettings.forProfile(profile)
                .withOverrides(windowSize, baselineLines, ncdThreshold, pValueThreshold);
        log.info("Detection settings: profile={} {}", profile, settings);
        return settings;
    }

    @Bean
    public Forwarder forwarder(RestTemplate detectionRestTemplate, ObjectMapper objectMapper,
                               DetectionSettings detectionSettings) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No detection API key configured (DRIFTLOCK_API_KEY); requests will be unauthenticated");
        }
        RetrySettings retry = RetrySettings.builder()
                .failurePolicy(failurePolicy)
                .maxAttempts(maxAttempts)
                .retryBackoff(BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(60)))
                .rateLimitBackoff(BackoffPolicy.exponential(Duration.ofSeconds(5), Duration.ofSeconds(60)))
                .maxRateLimitRetries(maxRateLimitRetries)
                .build();
        return new Forwarder(detectionRestTemplate, objectMapper, apiUrl, apiKey,
                detectionSettings, retry, Sleeper.SYSTEM);
    }

    @Bean
    public PipelineStats pipelineStats() {
        return new PipelineStats();
    }

    @Bean
    public BatchSettings batchSettings() {
        return new BatchSettings(
                batchSize,
                Duration.ofMillis(batchIntervalMs),
                Duration.ofMillis(batchTickMs),
                Duration.ofMillis(shutdownGraceMs));
    }

    @Bean
    @ConditionalOnProperty(name = "app.pipeline.source", havingValue = "feed", matchIfMissing = true)
    public RecordSource feedRecordSource(FeedClient feedClient, RawMessageNormalizer normalizer,
                                         PipelineStats pipelineStats) {
        return new FeedRecordSource(feedClient, normalizer, pipelineStats);
    }

    @Bean
    @ConditionalOnProperty(name = "app.pipeline.source", havingValue = "stdin")
    public RecordSource stdinRecordSource(ObjectMapper objectMapper, PipelineStats pipelineStats) {
        return new StdinRecordSource(System.in, objectMapper, pipelineStats);
    }

    @Bean
    @ConditionalOnProperty(name = "app.pipeline.source", havingValue = "stdin")
    public DetectionResultEmitter detectionResultEmitter(ObjectMapper objectMapper, PipelineStats pipelineStats,
                                                         ApplicationTerminator terminator) {
        return new DetectionResultEmitter(new NdjsonWriter(objectMapper, System.out), objectMapper,
                pipelineStats, terminator);
    }
}
