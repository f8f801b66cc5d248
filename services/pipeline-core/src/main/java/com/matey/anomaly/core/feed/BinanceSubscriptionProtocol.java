package com.matey.anomaly.core.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@code {"method":"SUBSCRIBE","params":[...],"id":n}}; the reply carries the same id
 * with either {@code result} or {@code error}.
 */
@Slf4j
@RequiredArgsConstructor
public class BinanceSubscriptionProtocol implements SubscriptionProtocol {

    private final ObjectMapper objectMapper;

    @Override
    public String subscribeRequest(List<String> topics, long requestId) throws FeedTransportException {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("method", "SUBSCRIBE");
        topics.forEach(request.putArray("params")::add);
        request.put("id", requestId);
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new FeedTransportException("Cannot encode subscribe request", e);
        }
    }

    @Override
    public boolean isControlFrame(String payload, long requestId) {
        if (payload == null || !payload.contains("\"id\"")) {
            return false;
        }
        try {
            JsonNode node = objectMapper.readTree(payload);
            if (node == null || !node.has("id") || node.get("id").asLong(-1) != requestId) {
                return false;
            }
            if (node.hasNonNull("error")) {
                log.warn("Subscription rejected. id={} error={}", requestId, node.get("error"));
                return true;
            }
            return node.has("result");
        } catch (JsonProcessingException e) {
            return false;
        }
    }
}
