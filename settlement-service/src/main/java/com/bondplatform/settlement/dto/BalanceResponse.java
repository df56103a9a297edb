package com.bondplatform.settlement.dto;

import com.bondplatform.common.model.Address;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record BalanceResponse(
    @JsonProperty("account") Address account,
    @JsonProperty("balance") BigInteger balance
) {}
