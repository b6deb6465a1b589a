package com.adrelay.api.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

import java.util.regex.Pattern;

/**
 * Format check only; the address is advisory and never blocks a match.
 */
public class PayerAddressValidator implements ConstraintValidator<PayerAddress, String> {

    private static final Pattern FRIENDLY = Pattern.compile("^[A-Za-z0-9+/_-]{48}$");
    private static final Pattern RAW = Pattern.compile("^-?[0-9]{1,3}:[0-9a-fA-F]{64}$");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null || value.isBlank()) {
            return true;
        }
        String v = value.strip();
        return FRIENDLY.matcher(v).matches() || RAW.matcher(v).matches();
    }
}
