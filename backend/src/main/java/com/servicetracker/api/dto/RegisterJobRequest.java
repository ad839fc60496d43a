package com.servicetracker.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.time.Instant;
import java.util.List;

/**
 * POST /api/v1/jobs request body. Id is generated when absent; null startAt/endAt leave the window open.
 */
public record RegisterJobRequest(
        String id,
        String name,
        Instant startAt,
        Instant endAt,

        @NotEmpty(message = "INVALID_INITIATOR")
        List<@Valid InitiatorRequest> initiators
) {
}
