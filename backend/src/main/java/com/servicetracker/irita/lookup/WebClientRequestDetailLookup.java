package com.servicetracker.irita.lookup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicetracker.common.RetryPolicy;
import com.servicetracker.domain.ServiceRequest;
import com.servicetracker.irita.config.IritaLcdProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Looks up service requests through the IRITA LCD gateway.
 * Accepts both the gRPC-gateway shape ({@code {"request": {...}}}) and the legacy REST shape ({@code {"result": {...}}}).
 */
@Slf4j
@Component
public class WebClientRequestDetailLookup implements RequestDetailLookup {

    private final WebClient webClient;
    private final IritaLcdProperties properties;
    private final RetryPolicy retryPolicy;
    private final ObjectMapper objectMapper;

    public WebClientRequestDetailLookup(WebClient.Builder webClientBuilder,
                                        IritaLcdProperties properties,
                                        RetryPolicy iritaRetryPolicy,
                                        ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.baseUrl(properties.getUrl()).build();
        this.properties = properties;
        this.retryPolicy = iritaRetryPolicy;
        this.objectMapper = objectMapper;
    }

    @Override
    public ServiceRequest queryServiceRequest(String requestId) {
        if (requestId == null || requestId.isBlank()) {
            throw new RequestLookupException("Request id is required");
        }
        return parse(requestId, fetchWithRetry(requestId));
    }

    private String fetchWithRetry(String requestId) {
        RuntimeException last = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(retryPolicy.delayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RequestLookupException("Interrupted looking up request " + requestId, e);
                }
            }
            try {
                String body = webClient.get()
                        .uri(properties.getRequestPath(), requestId)
                        .retrieve()
                        .bodyToMono(String.class)
                        .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
                if (body == null) {
                    throw new RequestLookupException("Empty response for request " + requestId);
                }
                return body;
            } catch (WebClientResponseException e) {
                if (e.getStatusCode().is4xxClientError() && e.getStatusCode().value() != HttpStatus.TOO_MANY_REQUESTS.value()) {
                    throw new RequestLookupException("Request " + requestId + " not available: " + e.getStatusCode(), e);
                }
                last = e;
            } catch (WebClientRequestException | IllegalStateException e) {
                last = e;
            }
            log.debug("Lookup of request {} attempt {} failed: {}", requestId, attempt + 1, last.getMessage());
        }
        throw new RequestLookupException("Lookup of request " + requestId + " failed after "
                + retryPolicy.getMaxAttempts() + " attempt(s)", last);
    }

    ServiceRequest parse(String requestId, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RequestLookupException("Invalid JSON for request " + requestId, e);
        }
        JsonNode node = root.has("request") ? root.path("request") : root.path("result");
        if (!node.isObject() || node.path("id").asText("").isEmpty()) {
            throw new RequestLookupException("No request body for " + requestId);
        }
        return new ServiceRequest(
                node.path("id").asText(),
                node.path("service_name").asText(null),
                node.path("provider").asText(null),
                node.path("consumer").asText(null),
                node.path("input").asText(null),
                fee(node.path("service_fee")),
                node.path("request_height").asLong(0L),
                node.path("expiration_height").asLong(0L),
                node.path("request_context_id").asText(null),
                node.path("request_context_batch_counter").asLong(0L));
    }

    private static String fee(JsonNode coins) {
        if (!coins.isArray() || coins.isEmpty()) {
            return null;
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode coin : coins) {
            parts.add(coin.path("amount").asText("") + coin.path("denom").asText(""));
        }
        return String.join(",", parts);
    }
}
