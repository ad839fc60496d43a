package com.servicetracker.irita.config;

import com.servicetracker.common.RetryPolicy;
import com.servicetracker.irita.tendermint.RpcEndpointRotator;
import com.servicetracker.irita.tendermint.TendermintRpcClient;
import com.servicetracker.irita.tendermint.WebClientTendermintRpcClient;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Tendermint RPC client, endpoint rotation and the shared RPC rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ IritaRpcProperties.class, IritaLcdProperties.class, RetryProperties.class })
public class IritaAdapterConfig {

    public static final String IRITA_RPC_RATE_LIMITER = "iritaRpcRateLimiter";

    @Bean
    public RetryPolicy iritaRetryPolicy(RetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public RpcEndpointRotator iritaRpcEndpointRotator(IritaRpcProperties properties, RetryPolicy iritaRetryPolicy) {
        return new RpcEndpointRotator(properties.getUrls(), iritaRetryPolicy);
    }

    @Bean
    public TendermintRpcClient tendermintRpcClient(WebClient.Builder webClientBuilder, IritaRpcProperties properties) {
        return new WebClientTendermintRpcClient(webClientBuilder, properties.getMaxResponseBytes());
    }

    @Bean(name = IRITA_RPC_RATE_LIMITER)
    public RateLimiter iritaRpcRateLimiter(IritaRpcProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("irita-rpc", config);
    }
}
