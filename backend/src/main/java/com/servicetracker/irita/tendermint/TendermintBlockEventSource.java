package com.servicetracker.irita.tendermint;

import com.servicetracker.common.CancellationToken;
import com.servicetracker.config.AsyncConfig;
import com.servicetracker.config.CaffeineConfig;
import com.servicetracker.irita.config.IritaAdapterConfig;
import com.servicetracker.irita.config.IritaRpcProperties;
import com.servicetracker.irita.event.Block;
import com.servicetracker.irita.event.BlockListener;
import com.servicetracker.irita.event.EventQuery;
import com.servicetracker.irita.event.EventSource;
import com.servicetracker.irita.event.SubscriptionException;
import com.servicetracker.irita.event.SubscriptionHandle;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link EventSource} over Tendermint JSON-RPC polling. Each subscription runs its own poll loop
 * starting at the height current when it was opened; decoded blocks are shared through a cache so
 * concurrent subscriptions fetch each height once.
 */
@Slf4j
@Component
public class TendermintBlockEventSource implements EventSource {

    private final Map<String, PollingSubscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicReference<HeightSample> latestHeight = new AtomicReference<>();

    private final TendermintRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final IritaRpcProperties properties;
    private final TendermintBlockParser parser;
    private final Cache blockCache;
    private final Executor executor;

    public TendermintBlockEventSource(
            TendermintRpcClient rpcClient,
            @Qualifier("iritaRpcEndpointRotator") RpcEndpointRotator rotator,
            @Qualifier(IritaAdapterConfig.IRITA_RPC_RATE_LIMITER) RateLimiter rateLimiter,
            IritaRpcProperties properties,
            TendermintBlockParser parser,
            CacheManager cacheManager,
            @Qualifier(AsyncConfig.EVENT_SOURCE_EXECUTOR) Executor executor
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.properties = properties;
        this.parser = parser;
        this.blockCache = Objects.requireNonNull(cacheManager.getCache(CaffeineConfig.BLOCK_RESULTS_CACHE),
                "cache " + CaffeineConfig.BLOCK_RESULTS_CACHE + " not configured");
        this.executor = executor;
    }

    @Override
    public SubscriptionHandle subscribe(EventQuery query, BlockListener listener) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(listener, "listener");
        long startHeight;
        try {
            startHeight = fetchLatestHeight(0L);
        } catch (RpcException e) {
            throw new SubscriptionException("Cannot subscribe to [" + query + "]: " + e.getMessage(), e);
        }
        SubscriptionHandle handle = new SubscriptionHandle(UUID.randomUUID().toString());
        PollingSubscription subscription = new PollingSubscription(handle, query, listener, startHeight);
        subscriptions.put(handle.id(), subscription);
        try {
            executor.execute(subscription::pollLoop);
        } catch (RejectedExecutionException e) {
            subscriptions.remove(handle.id());
            throw new SubscriptionException("No thread available for subscription [" + query + "]", e);
        }
        log.info("Subscribed {} to [{}] from height {}", handle.id(), query, startHeight);
        return handle;
    }

    @Override
    public void unsubscribe(SubscriptionHandle handle) {
        if (handle == null) {
            return;
        }
        PollingSubscription subscription = subscriptions.remove(handle.id());
        if (subscription == null) {
            log.debug("Unsubscribe for unknown subscription {}", handle.id());
            return;
        }
        subscription.token.cancel();
        log.info("Unsubscribed {} from [{}]", handle.id(), subscription.query);
    }

    int activeSubscriptions() {
        return subscriptions.size();
    }

    /**
     * Latest height, reusing a sample younger than {@code maxAgeMs} so N subscriptions share one status call.
     */
    long fetchLatestHeight(long maxAgeMs) {
        HeightSample sample = latestHeight.get();
        long now = System.currentTimeMillis();
        if (sample != null && maxAgeMs > 0 && now - sample.sampledAtMs() < maxAgeMs) {
            return sample.height();
        }
        long height = parser.parseLatestHeight(callWithRetry("status", Map.of()));
        latestHeight.set(new HeightSample(height, now));
        return height;
    }

    Block fetchBlock(long height) {
        try {
            return blockCache.get(height, () -> parser.parseBlockResults(
                    callWithRetry("block_results", Map.of("height", Long.toString(height))),
                    properties.isBase64Attributes()));
        } catch (Cache.ValueRetrievalException e) {
            if (e.getCause() instanceof RpcException rpc) {
                throw rpc;
            }
            throw new RpcException("block_results " + height + " failed", e.getCause());
        }
    }

    private String callWithRetry(String method, Map<String, Object> params) {
        RpcException last = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                try {
                    Thread.sleep(rotator.retryDelayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RpcException("Interrupted during retry of " + method, e);
                }
            }
            String endpoint = rotator.nextEndpoint();
            try {
                if (!rateLimiter.acquirePermission()) {
                    throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
                }
                String body = rpcClient.call(endpoint, method, params)
                        .block(Duration.ofMillis(properties.getRequestTimeoutMs()));
                if (body == null) {
                    throw new RpcException(method + ": empty response from " + endpoint);
                }
                return body;
            } catch (RpcException e) {
                last = e;
            } catch (IllegalStateException e) {
                // Mono.block timeout
                last = new RpcException(method + " timed out on " + endpoint, e);
            }
            log.debug("{} attempt {} failed on {}: {}", method, attempt + 1, endpoint, last.getMessage());
        }
        throw last != null ? last : new RpcException(method + ": no attempts made");
    }

    private record HeightSample(long height, long sampledAtMs) {}

    private final class PollingSubscription {

        private final SubscriptionHandle handle;
        private final EventQuery query;
        private final BlockListener listener;
        private final CancellationToken token = CancellationToken.create();
        private long nextHeight;

        private PollingSubscription(SubscriptionHandle handle, EventQuery query, BlockListener listener, long startHeight) {
            this.handle = handle;
            this.query = query;
            this.listener = listener;
            this.nextHeight = startHeight + 1;
        }

        private void pollLoop() {
            long interval = Math.max(1L, properties.getPollIntervalMs());
            while (!token.isCancelled()) {
                try {
                    long latest = fetchLatestHeight(interval / 2);
                    while (nextHeight <= latest && !token.isCancelled()) {
                        Block block = fetchBlock(nextHeight);
                        deliver(block);
                        nextHeight++;
                    }
                } catch (RpcException e) {
                    log.warn("Polling for {} stalled at height {}: {}", handle.id(), nextHeight, e.getMessage());
                }
                try {
                    token.await(interval, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
            log.debug("Poll loop for {} exited at height {}", handle.id(), nextHeight);
        }

        private void deliver(Block block) {
            if (!query.matches(block.endBlockEvents())) {
                return;
            }
            try {
                listener.onBlock(block);
            } catch (RuntimeException e) {
                log.error("Listener for {} failed on block {}", handle.id(), block.height(), e);
            }
        }
    }
}
