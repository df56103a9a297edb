package com.bondplatform.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * @param principal {@code true} for principal funding or repayment, {@code false} for interest
 */
public record DepositRequest(
    @JsonProperty("maxAssets")   BigInteger maxAssets,
    @JsonProperty("targetValue") BigInteger targetValue,
    @JsonProperty("principal")   boolean principal
) {}
