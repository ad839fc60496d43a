package com.servicetracker.irita.tendermint;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link TendermintRpcClient} backed by WebClient.
 */
public class WebClientTendermintRpcClient implements TendermintRpcClient {

    private final WebClient webClient;
    private final AtomicLong requestIds = new AtomicLong();

    public WebClientTendermintRpcClient(WebClient.Builder builder, int maxResponseBytes) {
        this.webClient = builder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxResponseBytes))
                .build();
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Map<String, Object> params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestIds.incrementAndGet(),
                "method", method,
                "params", params != null ? params : Map.of()
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class, e -> new RpcException(method + " failed: " + e.getMessage(), e))
                .onErrorMap(WebClientRequestException.class, e -> new RpcException(method + " unreachable: " + e.getMessage(), e));
    }
}
