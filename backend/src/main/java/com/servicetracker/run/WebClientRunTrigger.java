package com.servicetracker.run;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicetracker.domain.Interest;
import com.servicetracker.domain.RunRequest;
import com.servicetracker.run.config.RunnerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates runs through the job runner's REST API ({@code POST /v2/specs/{jobId}/runs}).
 * No retries: a failed trigger is reported to the caller, which drops that request.
 */
@Slf4j
@Component
public class WebClientRunTrigger implements RunTrigger {

    static final String ACCESS_KEY_HEADER = "X-Chainlink-EA-AccessKey";
    static final String SECRET_HEADER = "X-Chainlink-EA-Secret";

    private final WebClient webClient;
    private final RunnerProperties properties;
    private final ObjectMapper objectMapper;

    public WebClientRunTrigger(WebClient.Builder webClientBuilder, RunnerProperties properties, ObjectMapper objectMapper) {
        this.webClient = webClientBuilder.baseUrl(properties.getUrl()).build();
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String create(String jobId, Interest interest, String parentRunId, RunRequest runRequest) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("data", runRequest != null ? runRequest.data() : Map.of());
        body.put("initiator", Map.of(
                "type", "irita_log",
                "serviceProvider", interest.provider(),
                "serviceName", interest.serviceName()));
        if (parentRunId != null) {
            body.put("parentRunId", parentRunId);
        }
        String response;
        try {
            response = webClient.post()
                    .uri(properties.getRunsPath(), jobId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (properties.getAccessKey() != null && properties.getSecret() != null) {
                            h.set(ACCESS_KEY_HEADER, properties.getAccessKey());
                            h.set(SECRET_HEADER, properties.getSecret());
                        }
                    })
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
        } catch (WebClientResponseException e) {
            throw new RunTriggerException("Runner rejected run for job " + jobId + ": " + e.getStatusCode()
                    + " " + e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException | IllegalStateException e) {
            throw new RunTriggerException("Runner unreachable for job " + jobId + ": " + e.getMessage(), e);
        }
        return parseRunId(jobId, response);
    }

    String parseRunId(String jobId, String response) {
        if (response == null || response.isBlank()) {
            throw new RunTriggerException("Empty runner response for job " + jobId);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new RunTriggerException("Invalid runner response for job " + jobId, e);
        }
        String runId = root.path("data").path("id").asText(root.path("id").asText(""));
        if (runId.isBlank()) {
            throw new RunTriggerException("Runner response for job " + jobId + " has no run id");
        }
        log.debug("Runner created run {} for job {}", runId, jobId);
        return runId;
    }
}
