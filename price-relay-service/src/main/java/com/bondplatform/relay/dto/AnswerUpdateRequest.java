package com.bondplatform.relay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

public record AnswerUpdateRequest(
    @JsonProperty("answer") BigInteger answer
) {}
