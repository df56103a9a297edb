package com.bondplatform.relay.dto;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Body of {@code POST /api/v1/relay/send}. Destination fields left out fall back to
 * the configured destination.
 */
public record SendRoundRequest(
    @JsonProperty("destinationDomain")  Bytes32 destinationDomain,
    @JsonProperty("destinationAddress") Address destinationAddress,
    @JsonProperty("feeToken")           Address feeToken,
    @JsonProperty("feeAmount")          BigInteger feeAmount,
    @JsonProperty("gasLimit")           Long gasLimit
) {}
