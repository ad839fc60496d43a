package com.servicetracker.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Embedded in {@link JobSpec}. Provider and service name are only meaningful for {@link InitiatorType#IRITA_LOG}.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
@EqualsAndHashCode
public class Initiator {

    private InitiatorType type;
    /** Bech32 account address of the service provider, e.g. iaa1... */
    private String serviceProvider;
    private String serviceName;

    public static Initiator iritaLog(String serviceProvider, String serviceName) {
        return new Initiator(InitiatorType.IRITA_LOG, serviceProvider, serviceName);
    }
}
