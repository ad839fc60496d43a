package com.servicetracker.api.dto;

import com.servicetracker.api.validation.ProviderAddress;
import com.servicetracker.domain.InitiatorType;
import jakarta.validation.constraints.NotNull;

/**
 * One initiator of a job. Provider and service name are required for IRITA_LOG only.
 */
public record InitiatorRequest(
        @NotNull(message = "INVALID_INITIATOR")
        InitiatorType type,

        @ProviderAddress
        String serviceProvider,

        String serviceName
) {
}
