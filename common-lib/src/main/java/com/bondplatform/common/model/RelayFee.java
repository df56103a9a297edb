package com.bondplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Fee offered to the relayer for carrying a cross-domain message.
 */
public record RelayFee(
    @JsonProperty("feeToken") Address feeToken,
    @JsonProperty("amount")   BigInteger amount
) {

    public static final RelayFee NONE = new RelayFee(Address.ZERO, BigInteger.ZERO);

    public RelayFee {
        feeToken = feeToken != null ? feeToken : Address.ZERO;
        amount   = amount != null ? amount : BigInteger.ZERO;
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("fee amount must not be negative");
        }
    }
}
