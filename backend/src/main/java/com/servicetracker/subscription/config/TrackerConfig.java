package com.servicetracker.subscription.config;

import com.servicetracker.irita.event.EventSource;
import com.servicetracker.run.RequestMemory;
import com.servicetracker.run.RunTrigger;
import com.servicetracker.subscription.EventMatcher;
import com.servicetracker.subscription.RequestResolver;
import com.servicetracker.subscription.SubscriptionContext;
import com.servicetracker.subscription.SubscriptionRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TrackerProperties.class)
public class TrackerConfig {

    @Bean
    public SubscriptionContext subscriptionContext(EventSource eventSource,
                                                   EventMatcher eventMatcher,
                                                   RequestResolver requestResolver,
                                                   RunTrigger runTrigger,
                                                   RequestMemory requestMemory,
                                                   SubscriptionRegistry registry,
                                                   TrackerProperties properties) {
        return SubscriptionContext.builder()
                .eventSource(eventSource)
                .eventMatcher(eventMatcher)
                .requestResolver(requestResolver)
                .runTrigger(runTrigger)
                .requestMemory(requestMemory)
                .registry(registry)
                .inboxCapacity(Math.max(1, properties.getInboxCapacity()))
                .pollIntervalMs(Math.max(1L, properties.getShutdownPollIntervalMs()))
                .build();
    }
}
