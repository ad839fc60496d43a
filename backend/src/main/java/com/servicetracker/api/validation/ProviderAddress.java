package com.servicetracker.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.RECORD_COMPONENT;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Bech32 service provider address. Null passes; presence is checked per initiator type.
 * Error code for API: INVALID_PROVIDER.
 */
@Target({FIELD, PARAMETER, RECORD_COMPONENT})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = ProviderAddressValidator.class)
public @interface ProviderAddress {

    String message() default "INVALID_PROVIDER";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
