package com.netflowradar.ingestion.adapter.evm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netflowradar.common.HexQuantity;
import com.netflowradar.ingestion.adapter.RpcException;
import com.netflowradar.ingestion.decoder.RawLog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the eth_subscribe request and parses frames received on the subscription socket.
 */
public class LogNotificationParser {

    static final int SUBSCRIBE_REQUEST_ID = 1;

    private final ObjectMapper objectMapper;

    public LogNotificationParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String subscribeRequest(String contractAddress, String eventSignatureHash) {
        Map<String, Object> filter = Map.of(
                "address", contractAddress,
                "topics", List.of(eventSignatureHash));
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", SUBSCRIBE_REQUEST_ID,
                "method", "eth_subscribe",
                "params", List.of("logs", filter));
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to build eth_subscribe request", e);
        }
    }

    public SubscriptionFrame parse(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new RpcException("Unparseable subscription frame: " + abbreviate(frame), e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            return SubscriptionFrame.error(error.toString());
        }
        if ("eth_subscription".equals(root.path("method").asText())) {
            JsonNode params = root.path("params");
            JsonNode result = params.path("result");
            if (!result.isObject()) {
                return SubscriptionFrame.ignored();
            }
            return SubscriptionFrame.log(params.path("subscription").asText(null), toRawLog(result));
        }
        if (root.path("id").asInt(-1) == SUBSCRIBE_REQUEST_ID && root.path("result").isTextual()) {
            return SubscriptionFrame.subscribed(root.path("result").asText());
        }
        return SubscriptionFrame.ignored();
    }

    private static RawLog toRawLog(JsonNode log) {
        List<String> topics = new ArrayList<>();
        log.path("topics").forEach(t -> topics.add(t.asText()));
        return new RawLog(
                log.path("address").asText(null),
                topics,
                log.path("data").asText(null),
                HexQuantity.parseLongOrNull(log.path("blockNumber").asText(null)),
                log.path("transactionHash").asText(null),
                HexQuantity.parseLongOrNull(log.path("logIndex").asText(null)));
    }

    private static String abbreviate(String s) {
        if (s == null) return "null";
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
