package com.bondplatform.settlement.dto;

import com.bondplatform.common.model.Address;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Body of withdraw and redeem. {@code amount} is assets for withdraw, shares for redeem;
 * missing {@code receiver} and {@code owner} default to the caller.
 */
public record PayoutRequest(
    @JsonProperty("amount")   BigInteger amount,
    @JsonProperty("receiver") Address receiver,
    @JsonProperty("owner")    Address owner
) {}
