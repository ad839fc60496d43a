package com.servicetracker.run;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.servicetracker.config.CaffeineConfig;
import com.servicetracker.domain.ResolvedRequest;
import com.servicetracker.domain.ServiceRequest;
import org.junit.jupiter.api.Test;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineRequestMemoryTest {

    private static final ResolvedRequest REQUEST = new ResolvedRequest(
            new ServiceRequest("req-1", "oracle", "iaa1p", "iaa1c", "{}", "1upoint", 10, 20, "ctx", 1), "iaa1p");

    @Test
    void put_thenGet_thenTake() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(CaffeineConfig.REQUEST_MEMORY_CACHE, Caffeine.newBuilder().maximumSize(10).build());
        RequestMemory memory = new CaffeineRequestMemory(manager);

        memory.put("run-1", REQUEST);

        assertThat(memory.get("run-1")).contains(REQUEST);
        assertThat(memory.take("run-1")).contains(REQUEST);
        assertThat(memory.get("run-1")).isEmpty();
        assertThat(memory.get(null)).isEmpty();
    }

    @Test
    void put_nullRunId_throws() {
        RequestMemory memory = new CaffeineRequestMemory(new ConcurrentMapCacheManager(CaffeineConfig.REQUEST_MEMORY_CACHE));
        assertThatThrownBy(() -> memory.put(null, REQUEST)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void missingCache_failsFast() {
        assertThatThrownBy(() -> new CaffeineRequestMemory(new ConcurrentMapCacheManager("other")))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining(CaffeineConfig.REQUEST_MEMORY_CACHE);
    }
}
