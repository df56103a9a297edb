package com.bondplatform.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record ValueRequest(
    @JsonProperty("targetValue") BigInteger targetValue
) {}
