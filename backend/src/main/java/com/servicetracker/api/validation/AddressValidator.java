package com.servicetracker.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Validates IRITA account addresses (bech32, lowercase, e.g. iaa1...).
 */
@Component
public class AddressValidator {

    /** hrp, separator '1', then 38 data characters for a 20-byte account. */
    private static final Pattern BECH32_ACCOUNT = Pattern.compile("^[a-z]{1,20}1[qpzry9x8gf2tvdw0s3jn54khce6mua7l]{38}$");

    public boolean isValidAddress(String address) {
        if (address == null || address.isBlank()) return false;
        return BECH32_ACCOUNT.matcher(address.trim()).matches();
    }
}
