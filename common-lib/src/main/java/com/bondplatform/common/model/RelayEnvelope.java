package com.bondplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Cross-domain message as it travels between domains. The payload is opaque hex;
 * only the receiving application knows how to decode it.
 */
public record RelayEnvelope(
    @JsonProperty("messageId")           Bytes32 messageId,
    @JsonProperty("sourceDomain")        Bytes32 sourceDomain,
    @JsonProperty("sourceSender")        Address sourceSender,
    @JsonProperty("destinationDomain")   Bytes32 destinationDomain,
    @JsonProperty("destinationAddress")  Address destinationAddress,
    @JsonProperty("fee")                 RelayFee fee,
    @JsonProperty("gasLimit")            long gasLimit,
    @JsonProperty("payload")             String payload
) {}
