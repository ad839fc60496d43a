package com.servicetracker.domain;

import java.util.Map;

/**
 * Payload handed to the run trigger.
 */
public record RunRequest(Map<String, Object> data) {

    private static final RunRequest EMPTY = new RunRequest(Map.of());

    public RunRequest {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static RunRequest empty() {
        return EMPTY;
    }
}
