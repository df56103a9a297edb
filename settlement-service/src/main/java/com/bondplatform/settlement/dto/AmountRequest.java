package com.bondplatform.settlement.dto;

import com.bondplatform.common.model.Address;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Counterparty plus amount: asset approvals and mints, share transfers and approvals.
 */
public record AmountRequest(
    @JsonProperty("counterparty") Address counterparty,
    @JsonProperty("amount")       BigInteger amount
) {}
