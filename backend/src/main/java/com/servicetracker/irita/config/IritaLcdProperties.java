package com.servicetracker.irita.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * IRITA LCD (REST gateway) used to look up service request details.
 */
@ConfigurationProperties(prefix = "servicetracker.irita.lcd")
@NoArgsConstructor
@Getter
@Setter
public class IritaLcdProperties {

    private String url = "http://localhost:1317";

    /** Path template; {requestId} is expanded. */
    private String requestPath = "/irismod/service/requests/{requestId}";

    /** Upper bound for one lookup, including retries. Lookups run on the block delivery thread. */
    private long requestTimeoutMs = 3_000;
}
