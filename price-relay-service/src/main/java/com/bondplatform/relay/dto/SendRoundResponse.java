package com.bondplatform.relay.dto;

import com.bondplatform.common.model.Bytes32;
import com.fasterxml.jackson.annotation.JsonProperty;

public record SendRoundResponse(
    @JsonProperty("messageId") Bytes32 messageId
) {}
