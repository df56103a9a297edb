package com.bondplatform.common.vault;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record DepositReceipt(
    @JsonProperty("shares")      BigInteger shares,
    @JsonProperty("assetsUsed")  BigInteger assetsUsed
) {}
