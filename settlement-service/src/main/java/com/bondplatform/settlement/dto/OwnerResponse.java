package com.bondplatform.settlement.dto;

import com.bondplatform.common.model.Address;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record OwnerResponse(
    @JsonProperty("bondId") BigInteger bondId,
    @JsonProperty("owner")  Address owner
) {}
