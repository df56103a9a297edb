package com.bondplatform.settlement.dto;

import com.bondplatform.common.model.Address;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Single-address body: new fee recipient, new admin, bond transfer target.
 */
public record AddressRequest(
    @JsonProperty("address") Address address
) {}
