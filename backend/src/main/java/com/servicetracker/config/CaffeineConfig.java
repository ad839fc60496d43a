package com.servicetracker.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches: decoded block results shared by all subscriptions,
 * and the request memory read by the run pipeline.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String BLOCK_RESULTS_CACHE = "blockResultsCache";
    public static final String REQUEST_MEMORY_CACHE = "requestMemoryCache";

    @Bean
    public CacheManager caffeineCacheManager(
            @Value("${servicetracker.irita.rpc.block-cache-size:512}") long blockCacheSize,
            @Value("${servicetracker.request-memory.maximum-size:10000}") long requestMemorySize,
            @Value("${servicetracker.request-memory.expire-after-minutes:60}") long requestMemoryTtlMinutes) {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(BLOCK_RESULTS_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(blockCacheSize)
                .build());
        manager.registerCustomCache(REQUEST_MEMORY_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(requestMemoryTtlMinutes, TimeUnit.MINUTES)
                .maximumSize(requestMemorySize)
                .build());
        return manager;
    }
}
