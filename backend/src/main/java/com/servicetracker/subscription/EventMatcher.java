package com.servicetracker.subscription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicetracker.domain.Interest;
import com.servicetracker.irita.event.BlockEvent;
import com.servicetracker.irita.event.EventQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Extracts the service request ids addressed to an interest from a block's end-block events.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventMatcher {

    public static final String NEW_BATCH_REQUEST_PROVIDER = "new_batch_request_provider";
    public static final String NEW_BATCH_REQUEST = "new_batch_request";
    public static final String ATTR_SERVICE_NAME = "service_name";
    public static final String ATTR_PROVIDER = "provider";
    public static final String ATTR_REQUESTS = "requests";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /**
     * Subscription filter for an interest: blocks carrying a batch request for the provider and service.
     */
    public static EventQuery queryFor(Interest interest) {
        return EventQuery.builder()
                .eq(NEW_BATCH_REQUEST_PROVIDER, ATTR_PROVIDER, interest.provider())
                .eq(NEW_BATCH_REQUEST, ATTR_SERVICE_NAME, interest.serviceName())
                .build();
    }

    /**
     * Request ids from every provider-batch event addressed to {@code interest}, duplicates collapsed,
     * in first-seen order. Malformed id lists contribute nothing.
     */
    public Set<String> match(List<BlockEvent> events, Interest interest) {
        Set<String> ids = new LinkedHashSet<>();
        if (events == null) {
            return ids;
        }
        for (BlockEvent event : events) {
            if (event == null || !event.isType(NEW_BATCH_REQUEST_PROVIDER)) {
                continue;
            }
            ProviderBatchRequest batch = decode(event);
            if (!batch.matches(interest)) {
                continue;
            }
            if (batch.malformed()) {
                log.debug("Skipping malformed request list for {}: {}", interest, event.attribute(ATTR_REQUESTS));
                continue;
            }
            ids.addAll(batch.requestIds());
        }
        return ids;
    }

    ProviderBatchRequest decode(BlockEvent event) {
        String serviceName = event.attribute(ATTR_SERVICE_NAME);
        String provider = event.attribute(ATTR_PROVIDER);
        String raw = event.attribute(ATTR_REQUESTS);
        if (raw == null || raw.isBlank()) {
            return ProviderBatchRequest.malformed(serviceName, provider);
        }
        try {
            List<String> ids = objectMapper.readValue(raw, STRING_LIST);
            if (ids == null) {
                return ProviderBatchRequest.malformed(serviceName, provider);
            }
            return ProviderBatchRequest.of(serviceName, provider, ids.stream()
                    .filter(Objects::nonNull)
                    .filter(id -> !id.isBlank())
                    .toList());
        } catch (JsonProcessingException e) {
            return ProviderBatchRequest.malformed(serviceName, provider);
        }
    }
}
