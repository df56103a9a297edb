package com.bondplatform.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record PayoutResponse(
    @JsonProperty("assets") BigInteger assets,
    @JsonProperty("shares") BigInteger shares
) {}
