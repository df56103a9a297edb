package com.bondplatform.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FeesRequest(
    @JsonProperty("bips") int bips
) {}
