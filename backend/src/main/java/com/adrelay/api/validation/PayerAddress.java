package com.adrelay.api.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.*;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Optional TON account address: user-friendly (48 chars, base64 or base64url) or raw (workchain:64 hex).
 * Null or blank is valid. Error code for API: INVALID_PAYER_ADDRESS.
 */
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
@Documented
@Constraint(validatedBy = PayerAddressValidator.class)
public @interface PayerAddress {

    String message() default "INVALID_PAYER_ADDRESS";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
