package com.matey.anomaly.core.feed;

import com.matey.anomaly.core.retry.BackoffPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class SseFeedClientTest {

    private static final URI STREAM = URI.create("https://stream.test/v2/stream/recentchange");

    private final RestTemplate restTemplate = new RestTemplate();
    private final MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
    private final List<String> received = new CopyOnWriteArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();

    private SseFeedClient client(int stopAfterSleeps) {
        SseFeedClient[] holder = new SseFeedClient[1];
        holder[0] = new SseFeedClient(restTemplate, STREAM, "anomaly-test/1.0",
                BackoffPolicy.exponential(Duration.ofSeconds(1), Duration.ofSeconds(30)),
                d -> {
                    sleeps.add(d);
                    if (sleeps.size() >= stopAfterSleeps) {
                        holder[0].stop();
                    }
                });
        return holder[0];
    }

    @Test
    void dispatchesDataOfEachEvent() {
        String body = ":ok\n"
                + "\n"
                + "event: message\n"
                + "id: [{\"topic\":\"recentchange\"}]\n"
                + "data: {\"title\":\"A\"}\n"
                + "\n"
                + "data: {\"title\":\n"
                + "data:\"B\"}\n"
                + "\n"
                + "data: {\"title\":\"unterminated\"}\n";
        server.expect(requestTo(STREAM))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Accept", "text/event-stream"))
                .andExpect(header("User-Agent", "anomaly-test/1.0"))
                .andRespond(withSuccess(body, MediaType.TEXT_EVENT_STREAM));
        SseFeedClient client = client(1);

        client.run(received::add);

        assertThat(received).containsExactly("{\"title\":\"A\"}", "{\"title\":\n\"B\"}");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
        server.verify();
    }

    @Test
    void reconnectsWithBackoffAndResetsOnceEventsFlow() {
        server.expect(requestTo(STREAM)).andRespond(withServerError());
        server.expect(requestTo(STREAM)).andRespond(withServerError());
        server.expect(requestTo(STREAM)).andRespond(withSuccess("data: {}\n\n", MediaType.TEXT_EVENT_STREAM));
        SseFeedClient client = client(3);

        client.run(received::add);

        assertThat(received).containsExactly("{}");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(1));
        server.verify();
    }

    @Test
    void stopBeforeRunDoesNotConnect() {
        SseFeedClient client = client(1);
        client.stop();

        client.run(received::add);

        assertThat(received).isEmpty();
        assertThat(sleeps).isEmpty();
        server.verify();
    }

    @Test
    void cannotRunTwice() {
        SseFeedClient client = client(1);
        client.stop();
        client.run(received::add);

        assertThatThrownBy(() -> client.run(received::add)).isInstanceOf(IllegalStateException.class);
    }
}
