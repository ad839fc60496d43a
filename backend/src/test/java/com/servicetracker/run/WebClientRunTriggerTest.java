package com.servicetracker.run;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicetracker.domain.Interest;
import com.servicetracker.domain.RunRequest;
import com.servicetracker.run.config.RunnerProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ClientHttpRequest;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientRunTriggerTest {

    private static final Interest INTEREST = new Interest("iaa1p", "oracle");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<ClientRequest> captured = new AtomicReference<>();

    @Test
    @DisplayName("posts to the job's runs endpoint with credentials and returns the run id")
    void create_ok() throws Exception {
        RunnerProperties properties = properties();
        properties.setAccessKey("key");
        properties.setSecret("s3cret");
        WebClientRunTrigger trigger = trigger(properties, HttpStatus.OK, "{\"data\":{\"type\":\"runs\",\"id\":\"run-7\"}}");

        String runId = trigger.create("job-1", INTEREST, null, RunRequest.empty());

        assertThat(runId).isEqualTo("run-7");
        ClientRequest request = captured.get();
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().getPath()).isEqualTo("/v2/specs/job-1/runs");
        assertThat(request.headers().getFirst(WebClientRunTrigger.ACCESS_KEY_HEADER)).isEqualTo("key");
        assertThat(request.headers().getFirst(WebClientRunTrigger.SECRET_HEADER)).isEqualTo("s3cret");

        JsonNode body = objectMapper.readTree(bodyOf(request));
        assertThat(body.path("data").isObject()).isTrue();
        assertThat(body.path("data").size()).isZero();
        assertThat(body.path("initiator").path("serviceProvider").asText()).isEqualTo("iaa1p");
        assertThat(body.has("parentRunId")).isFalse();
    }

    @Test
    void create_withParentRun_sendsIt() throws Exception {
        WebClientRunTrigger trigger = trigger(properties(), HttpStatus.OK, "{\"id\":\"run-8\"}");

        assertThat(trigger.create("job-1", INTEREST, "run-1", new RunRequest(Map.of("k", "v")))).isEqualTo("run-8");

        JsonNode body = objectMapper.readTree(bodyOf(captured.get()));
        assertThat(body.path("parentRunId").asText()).isEqualTo("run-1");
        assertThat(body.path("data").path("k").asText()).isEqualTo("v");
        assertThat(captured.get().headers().containsKey(WebClientRunTrigger.ACCESS_KEY_HEADER)).isFalse();
    }

    @Test
    @DisplayName("runner rejection surfaces as RunTriggerException")
    void create_rejected() {
        WebClientRunTrigger trigger = trigger(properties(), HttpStatus.UNPROCESSABLE_ENTITY, "{\"errors\":[{\"detail\":\"job not active\"}]}");

        assertThatThrownBy(() -> trigger.create("job-1", INTEREST, null, RunRequest.empty()))
                .isInstanceOf(RunTriggerException.class)
                .hasMessageContaining("422");
    }

    @Test
    void parseRunId_missingId_throws() {
        WebClientRunTrigger trigger = trigger(properties(), HttpStatus.OK, "{}");

        assertThatThrownBy(() -> trigger.parseRunId("job-1", "{\"data\":{}}"))
                .isInstanceOf(RunTriggerException.class)
                .hasMessageContaining("no run id");
        assertThatThrownBy(() -> trigger.parseRunId("job-1", "<html>"))
                .isInstanceOf(RunTriggerException.class);
        assertThatThrownBy(() -> trigger.parseRunId("job-1", ""))
                .isInstanceOf(RunTriggerException.class);
    }

    private WebClientRunTrigger trigger(RunnerProperties properties, HttpStatus status, String response) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            captured.set(req);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(response)
                    .build());
        });
        return new WebClientRunTrigger(builder, properties, objectMapper);
    }

    private static RunnerProperties properties() {
        RunnerProperties properties = new RunnerProperties();
        properties.setUrl("http://runner:6688");
        properties.setRequestTimeoutMs(2_000);
        return properties;
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest http = new MockClientHttpRequest(HttpMethod.POST, URI.create("http://runner"));
        @SuppressWarnings("unchecked")
        BodyInserter<Object, ClientHttpRequest> inserter = (BodyInserter<Object, ClientHttpRequest>) request.body();
        inserter.insert(http, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Collections.emptyMap();
            }
        }).block();
        return http.getBodyAsString().block();
    }
}
