package com.servicetracker.run.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Job runner endpoint that creates runs.
 */
@ConfigurationProperties(prefix = "servicetracker.runner")
@NoArgsConstructor
@Getter
@Setter
public class RunnerProperties {

    private String url = "http://localhost:6688";

    /** Path template; {jobId} is expanded. */
    private String runsPath = "/v2/specs/{jobId}/runs";

    /** Sent as X-Chainlink-EA-AccessKey when set. */
    private String accessKey;

    /** Sent as X-Chainlink-EA-Secret when set. */
    private String secret;

    private long requestTimeoutMs = 10_000;
}
