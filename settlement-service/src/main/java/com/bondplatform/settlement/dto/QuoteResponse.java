package com.bondplatform.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record QuoteResponse(
    @JsonProperty("targetValue") BigInteger targetValue,
    @JsonProperty("assets")      BigInteger assets
) {}
