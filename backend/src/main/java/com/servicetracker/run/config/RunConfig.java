package com.servicetracker.run.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RunnerProperties.class)
public class RunConfig {
}
