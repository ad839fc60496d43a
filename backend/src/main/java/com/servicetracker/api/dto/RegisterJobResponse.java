package com.servicetracker.api.dto;

public record RegisterJobResponse(String jobId, int workers, String message) {
}
