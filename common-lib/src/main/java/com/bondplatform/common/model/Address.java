package com.bondplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 20-byte account identifier in {@code 0x}-prefixed hex, normalised to lower case
 * so that two spellings of the same account compare equal.
 */
public record Address(String value) {

    private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{40}$");

    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        if (value == null) {
            throw new IllegalArgumentException("address must not be null");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("malformed address: " + value);
        }
    }

    @JsonCreator
    public static Address of(String value) {
        return new Address(value);
    }

    public boolean isZero() {
        return ZERO.value.equals(value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
