package com.servicetracker.irita.lookup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.servicetracker.common.RetryPolicy;
import com.servicetracker.domain.ServiceRequest;
import com.servicetracker.irita.config.IritaLcdProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientRequestDetailLookupTest {

    private static final String REQUEST_JSON = """
            {"request":{
              "id":"req-42",
              "service_name":"oracle",
              "provider":"iaa1p",
              "consumer":"iaa1c",
              "input":"{\\"header\\":{},\\"body\\":{\\"pair\\":\\"iris-usdt\\"}}",
              "service_fee":[{"denom":"upoint","amount":"100"}],
              "superMode":false,
              "request_height":"1200",
              "expiration_height":"1300",
              "request_context_id":"ctx-1",
              "request_context_batch_counter":"7"
            }}
            """;

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();

    @Test
    @DisplayName("parses the gateway request shape into a ServiceRequest")
    void queryServiceRequest_ok() {
        WebClientRequestDetailLookup lookup = lookup(req -> json(HttpStatus.OK, REQUEST_JSON));

        ServiceRequest request = lookup.queryServiceRequest("req-42");

        assertThat(request.id()).isEqualTo("req-42");
        assertThat(request.serviceName()).isEqualTo("oracle");
        assertThat(request.provider()).isEqualTo("iaa1p");
        assertThat(request.consumer()).isEqualTo("iaa1c");
        assertThat(request.input()).contains("iris-usdt");
        assertThat(request.serviceFee()).isEqualTo("100upoint");
        assertThat(request.requestHeight()).isEqualTo(1200L);
        assertThat(request.expirationHeight()).isEqualTo(1300L);
        assertThat(request.requestContextId()).isEqualTo("ctx-1");
        assertThat(request.batchCounter()).isEqualTo(7L);
        assertThat(requests).singleElement()
                .satisfies(r -> assertThat(r.url().getPath()).isEqualTo("/irismod/service/requests/req-42"));
    }

    @Test
    @DisplayName("legacy result wrapper is accepted")
    void parse_resultWrapper() {
        WebClientRequestDetailLookup lookup = lookup(req -> json(HttpStatus.OK, "{}"));

        ServiceRequest request = lookup.parse("r1", "{\"height\":\"5\",\"result\":{\"id\":\"r1\",\"service_name\":\"svc\"}}");

        assertThat(request.id()).isEqualTo("r1");
        assertThat(request.serviceName()).isEqualTo("svc");
        assertThat(request.serviceFee()).isNull();
    }

    @Test
    @DisplayName("server errors are retried, then reported")
    void serverError_retriedThenThrows() {
        WebClientRequestDetailLookup lookup = lookup(req -> json(HttpStatus.SERVICE_UNAVAILABLE, "{}"));

        assertThatThrownBy(() -> lookup.queryServiceRequest("req-42"))
                .isInstanceOf(RequestLookupException.class)
                .hasMessageContaining("after 3 attempt(s)");
        assertThat(requests).hasSize(3);
    }

    @Test
    @DisplayName("a 404 fails at once")
    void notFound_noRetry() {
        WebClientRequestDetailLookup lookup = lookup(req -> json(HttpStatus.NOT_FOUND, "{\"code\":5,\"message\":\"request not found\"}"));

        assertThatThrownBy(() -> lookup.queryServiceRequest("missing"))
                .isInstanceOf(RequestLookupException.class)
                .hasMessageContaining("not available");
        assertThat(requests).hasSize(1);
    }

    @Test
    void transientFailure_thenSuccess() {
        WebClientRequestDetailLookup lookup = lookup(req -> requests.size() == 1
                ? json(HttpStatus.TOO_MANY_REQUESTS, "{}")
                : json(HttpStatus.OK, REQUEST_JSON));

        assertThat(lookup.queryServiceRequest("req-42").id()).isEqualTo("req-42");
        assertThat(requests).hasSize(2);
    }

    @Test
    void emptyBody_orBlankId_throws() {
        WebClientRequestDetailLookup lookup = lookup(req -> json(HttpStatus.OK, "{\"request\":{}}"));

        assertThatThrownBy(() -> lookup.queryServiceRequest("req-42")).isInstanceOf(RequestLookupException.class);
        assertThatThrownBy(() -> lookup.queryServiceRequest(" ")).isInstanceOf(RequestLookupException.class);
    }

    private WebClientRequestDetailLookup lookup(Function<ClientRequest, Mono<ClientResponse>> responder) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            requests.add(req);
            return responder.apply(req);
        });
        IritaLcdProperties properties = new IritaLcdProperties();
        properties.setUrl("http://lcd:1317");
        return new WebClientRequestDetailLookup(builder, properties, new RetryPolicy(1L, 0, 3), new ObjectMapper());
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }
}
