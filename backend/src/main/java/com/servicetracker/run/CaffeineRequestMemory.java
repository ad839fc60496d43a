package com.servicetracker.run;

import com.servicetracker.config.CaffeineConfig;
import com.servicetracker.domain.ResolvedRequest;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Optional;

/**
 * {@link RequestMemory} on the bounded, expiring Caffeine cache {@link CaffeineConfig#REQUEST_MEMORY_CACHE}.
 * Entries a run never picks up are evicted by size or age.
 */
@Component
public class CaffeineRequestMemory implements RequestMemory {

    private final Cache cache;

    public CaffeineRequestMemory(CacheManager cacheManager) {
        this.cache = Objects.requireNonNull(cacheManager.getCache(CaffeineConfig.REQUEST_MEMORY_CACHE),
                "cache " + CaffeineConfig.REQUEST_MEMORY_CACHE + " not configured");
    }

    @Override
    public void put(String runId, ResolvedRequest request) {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(request, "request");
        cache.put(runId, request);
    }

    @Override
    public Optional<ResolvedRequest> get(String runId) {
        if (runId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.get(runId, ResolvedRequest.class));
    }

    @Override
    public Optional<ResolvedRequest> take(String runId) {
        Optional<ResolvedRequest> found = get(runId);
        found.ifPresent(r -> cache.evict(runId));
        return found;
    }
}
