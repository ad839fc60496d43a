package com.servicetracker.domain;

import java.util.Objects;

/**
 * A (provider, service name) pair a job wants service requests for.
 */
public record Interest(String provider, String serviceName) {

    public Interest {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(serviceName, "serviceName");
    }

    public static Interest of(Initiator initiator) {
        return new Interest(initiator.getServiceProvider(), initiator.getServiceName());
    }

    @Override
    public String toString() {
        return serviceName + "@" + provider;
    }
}
