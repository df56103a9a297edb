package com.bondplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.HexFormat;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 32-byte opaque identifier: relay domain ids and relay message ids.
 */
public record Bytes32(String value) {

    private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{64}$");

    public static final Bytes32 ZERO = new Bytes32("0x" + "0".repeat(64));

    public Bytes32 {
        if (value == null) {
            throw new IllegalArgumentException("bytes32 must not be null");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("malformed bytes32: " + value);
        }
    }

    @JsonCreator
    public static Bytes32 of(String value) {
        return new Bytes32(value);
    }

    public static Bytes32 wrap(byte[] bytes) {
        if (bytes == null || bytes.length != 32) {
            throw new IllegalArgumentException("bytes32 requires exactly 32 bytes");
        }
        return new Bytes32("0x" + HexFormat.of().formatHex(bytes));
    }

    public byte[] toBytes() {
        return HexFormat.of().parseHex(value.substring(2));
    }

    @JsonValue
    @Override
    public String toString() {
        return value;
    }
}
