package com.servicetracker.irita.tendermint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicetracker.irita.event.Block;
import com.servicetracker.irita.event.BlockEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes Tendermint {@code status} and {@code block_results} responses into typed records.
 * Older nodes (0.34) base64-encode event attribute keys and values; newer ones send plain strings.
 */
@Component
@RequiredArgsConstructor
public class TendermintBlockParser {

    private final ObjectMapper objectMapper;

    public long parseLatestHeight(String json) {
        JsonNode result = result(json, "status");
        JsonNode height = result.path("sync_info").path("latest_block_height");
        if (height.isMissingNode() || height.isNull()) {
            throw new RpcException("status: missing sync_info.latest_block_height");
        }
        return parseHeight(height, "status");
    }

    public Block parseBlockResults(String json, boolean base64Attributes) {
        JsonNode result = result(json, "block_results");
        long height = parseHeight(result.path("height"), "block_results");
        JsonNode events = result.path("end_block_events");
        if (!events.isArray()) {
            // CometBFT 0.38 merged begin/end block events into finalize_block_events
            events = result.path("finalize_block_events");
        }
        List<BlockEvent> decoded = new ArrayList<>();
        if (events.isArray()) {
            for (JsonNode event : events) {
                decoded.add(toBlockEvent(event, base64Attributes));
            }
        }
        return new Block(height, decoded);
    }

    private BlockEvent toBlockEvent(JsonNode event, boolean base64Attributes) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (JsonNode attr : event.path("attributes")) {
            String key = text(attr.path("key"), base64Attributes);
            if (key == null) {
                continue;
            }
            // 0.34 sends null for an empty value
            String value = text(attr.path("value"), base64Attributes);
            attributes.putIfAbsent(key, value == null ? "" : value);
        }
        return new BlockEvent(event.path("type").asText(null), attributes);
    }

    private JsonNode result(String json, String method) {
        if (json == null || json.isBlank()) {
            throw new RpcException(method + ": empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException(method + ": invalid JSON", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error " + error.path("code").asText()
                    + ": " + error.path("message").asText() + " " + error.path("data").asText(""));
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode() || result.isNull()) {
            throw new RpcException(method + ": missing result");
        }
        return result;
    }

    private static long parseHeight(JsonNode node, String method) {
        try {
            return node.isNumber() ? node.asLong() : Long.parseLong(node.asText());
        } catch (NumberFormatException e) {
            throw new RpcException(method + ": bad height '" + node.asText() + "'", e);
        }
    }

    private static String text(JsonNode node, boolean base64) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String raw = node.asText();
        if (!base64) {
            return raw;
        }
        try {
            return new String(Base64.getDecoder().decode(raw), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException notBase64) {
            return raw;
        }
    }
}
