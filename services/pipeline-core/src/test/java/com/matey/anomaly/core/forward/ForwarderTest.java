package com.matey.anomaly.core.forward;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.matey.anomaly.core.model.CanonicalRecord;
import com.matey.anomaly.core.retry.BackoffPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withUnauthorizedRequest;

class ForwarderTest {

    private static final String DETECT_URL = "http://detector.test/v1/detect";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<Duration> sleeps = new ArrayList<>();

    private RestTemplate restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
    }

    private Forwarder forwarder(DetectionSettings settings, RetrySettings retry) {
        return new Forwarder(restTemplate, objectMapper, "http://detector.test/v1/", "secret-key",
                settings, retry, sleeps::add);
    }

    private Forwarder forwarder(RetrySettings retry) {
        return forwarder(DetectionSettings.standard(), retry);
    }

    private static CanonicalRecord record(String id) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("timestamp", "2024-01-01T00:00:00Z");
        fields.put("id", id);
        fields.put("symbol", "BTCUSDT");
        fields.put("message", "BUY 1.0000 BTCUSDT @ 100.00000000");
        return CanonicalRecord.of(fields);
    }

    @Test
    void postsBatchWithApiKeyAndParsesAnomalies() {
        server.expect(requestTo(DETECT_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(Forwarder.API_KEY_HEADER, "secret-key"))
                .andExpect(jsonPath("$.events.length()").value(2))
                .andExpect(jsonPath("$.events[0].id").value("1"))
                .andExpect(jsonPath("$.window_size").value(50))
                .andExpect(jsonPath("$.baseline_lines").value(100))
                .andExpect(jsonPath("$.ncd_threshold").doesNotExist())
                .andRespond(withSuccess(
                        "{\"anomalies\":[{\"index\":1,\"explanation\":\"burst\",\"metrics\":{\"ncd\":0.61},\"event_id\":\"2\"}]}",
                        MediaType.APPLICATION_JSON));

        ForwardResult result = forwarder(RetrySettings.defaults()).forward(List.of(record("1"), record("2")));

        server.verify();
        assertThat(result.getStatus()).isEqualTo(ForwardResult.Status.SUCCESS);
        assertThat(result.getAnomalies()).hasSize(1);
        assertThat(result.getAnomalies().get(0).getIndex()).isEqualTo(1);
        assertThat(result.getAnomalies().get(0).metric("ncd")).isEqualTo(0.61);
        assertThat(result.getAnomalies().get(0).getExtra()).containsEntry("event_id", "2");
    }

    @Test
    void sendsSensitiveThresholds() {
        server.expect(requestTo(DETECT_URL))
                .andExpect(jsonPath("$.window_size").value(20))
                .andExpect(jsonPath("$.baseline_lines").value(40))
                .andExpect(jsonPath("$.ncd_threshold").value(0.25))
                .andExpect(jsonPath("$.p_value_threshold").value(0.1))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        ForwardResult result = forwarder(DetectionSettings.sensitive(), RetrySettings.defaults()).forward(List.of(record("1")));

        server.verify();
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAnomalies()).isEmpty();
    }

    @Test
    void authFailureHaltsAllLaterBatches() {
        server.expect(requestTo(DETECT_URL)).andRespond(withUnauthorizedRequest());

        Forwarder forwarder = forwarder(RetrySettings.defaults());
        ForwardResult first = forwarder.forward(List.of(record("1")));
        ForwardResult second = forwarder.forward(List.of(record("2")));

        server.verify();
        assertThat(first.getStatus()).isEqualTo(ForwardResult.Status.AUTH_FAILED);
        assertThat(first.getHttpStatus()).isEqualTo(401);
        assertThat(second.getStatus()).isEqualTo(ForwardResult.Status.HALTED);
        assertThat(forwarder.isHalted()).isTrue();
        assertThat(second.isFatal()).isTrue();
    }

    @Test
    void forbiddenIsTreatedAsAuthFailure() {
        server.expect(requestTo(DETECT_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

        ForwardResult result = forwarder(RetrySettings.defaults()).forward(List.of(record("1")));

        assertThat(result.getStatus()).isEqualTo(ForwardResult.Status.AUTH_FAILED);
    }

    @Test
    void rateLimitedBatchIsResentAfterCoolOff() {
        server.expect(requestTo(DETECT_URL))
                .andExpect(jsonPath("$.events[0].id").value("7"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo(DETECT_URL))
                .andExpect(jsonPath("$.events[0].id").value("7"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo(DETECT_URL))
                .andExpect(jsonPath("$.events[0].id").value("7"))
                .andRespond(withSuccess("{\"anomalies\":[]}", MediaType.APPLICATION_JSON));

        Forwarder forwarder = forwarder(RetrySettings.defaults());
        ForwardResult result = forwarder.forward(List.of(record("7")));

        server.verify();
        assertThat(result.isSuccess()).isTrue();
        assertThat(sleeps).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(10));
        assertThat(forwarder.getStats().snapshot().getRateLimited()).isEqualTo(2);
    }

    @Test
    void boundedRateLimitRetriesEventuallyDrop() {
        server.expect(requestTo(DETECT_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        server.expect(requestTo(DETECT_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        RetrySettings retry = RetrySettings.builder().maxRateLimitRetries(1).build();
        ForwardResult result = forwarder(retry).forward(List.of(record("1")));

        server.verify();
        assertThat(result.getStatus()).isEqualTo(ForwardResult.Status.DROPPED);
        assertThat(result.getHttpStatus()).isEqualTo(429);
    }

    @Test
    void serverErrorIsDroppedUnderDropPolicy() {
        server.expect(requestTo(DETECT_URL)).andRespond(withServerError().body("boom"));

        Forwarder forwarder = forwarder(RetrySettings.defaults());
        ForwardResult result = forwarder.forward(List.of(record("1"), record("2")));

        server.verify();
        assertThat(result.getStatus()).isEqualTo(ForwardResult.Status.DROPPED);
        assertThat(sleeps).isEmpty();
        assertThat(forwarder.getStats().snapshot().getEventsDropped()).isEqualTo(2);
        assertThat(forwarder.isHalted()).isFalse();
    }

    @Test
    void serverErrorIsRetriedUnderRetryPolicy() {
        server.expect(requestTo(DETECT_URL)).andRespond(withServerError());
        server.expect(requestTo(DETECT_URL)).andRespond(withSuccess("{\"anomalies\":[]}", MediaType.APPLICATION_JSON));

        RetrySettings retry = RetrySettings.builder()
                .failurePolicy(FailurePolicy.RETRY)
                .maxAttempts(3)
                .retryBackoff(BackoffPolicy.exponential(Duration.ofSeconds(2), Duration.ofSeconds(30)))
                .build();
        ForwardResult result = forwarder(retry).forward(List.of(record("1")));

        server.verify();
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void networkErrorsAreRetriedThenDropped() {
        server.expect(requestTo(DETECT_URL)).andRespond(withException(new IOException("connection refused")));
        server.expect(requestTo(DETECT_URL)).andRespond(withException(new IOException("connection refused")));
        server.expect(requestTo(DETECT_URL)).andRespond(withException(new IOException("connection refused")));

        ForwardResult result = forwarder(RetrySettings.defaults()).forward(List.of(record("1")));

        server.verify();
        assertThat(result.getStatus()).isEqualTo(ForwardResult.Status.DROPPED);
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void malformedBodyIsDropped() {
        server.expect(requestTo(DETECT_URL)).andRespond(withSuccess("<html>", MediaType.TEXT_HTML));

        ForwardResult result = forwarder(RetrySettings.defaults()).forward(List.of(record("1")));

        assertThat(result.getStatus()).isEqualTo(ForwardResult.Status.DROPPED);
    }

    @Test
    void interruptedCoolOffDropsBatchAndKeepsInterruptFlag() {
        server.expect(requestTo(DETECT_URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        Forwarder forwarder = new Forwarder(restTemplate, objectMapper, "http://detector.test/v1", "k",
                DetectionSettings.standard(), RetrySettings.defaults(),
                d -> {
                    throw new InterruptedException();
                });
        try {
            ForwardResult result = forwarder.forward(List.of(record("1")));

            assertThat(result.getStatus()).isEqualTo(ForwardResult.Status.DROPPED);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void requestBodyCarriesRecordFieldsVerbatim() {
        server.expect(requestTo(DETECT_URL))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.events[0].message").value("BUY 1.0000 BTCUSDT @ 100.00000000"))
                .andRespond(withSuccess());

        ForwardResult result = forwarder(RetrySettings.defaults()).forward(List.of(record("1")));

        assertThat(result.isSuccess()).isTrue();
    }
}
