package com.matey.anomaly.core.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Kraken public WebSocket: topics are pairs such as {@code XBT/USD}, subscribed to the
 * {@code trade} channel. Data arrives as JSON arrays; every JSON object
 * ({@code heartbeat}, {@code systemStatus}, {@code subscriptionStatus}) is control.
 */
@Slf4j
@RequiredArgsConstructor
public class KrakenSubscriptionProtocol implements SubscriptionProtocol {

    private final ObjectMapper objectMapper;

    @Override
    public String subscribeRequest(List<String> topics, long requestId) throws FeedTransportException {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("event", "subscribe");
        request.put("reqid", requestId);
        topics.forEach(request.putArray("pair")::add);
        request.putObject("subscription").put("name", "trade");
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new FeedTransportException("Cannot encode subscribe request", e);
        }
    }

    @Override
    public boolean isControlFrame(String payload, long requestId) {
        if (payload == null || !payload.stripLeading().startsWith("{")) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.has("event")) {
                return false;
            }
            if ("subscriptionStatus".equals(node.path("event").asText())
                    && "error".equals(node.path("status").asText())) {
                log.warn("Subscription rejected. id={} error={}", requestId, node.path("errorMessage").asText());
            }
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
