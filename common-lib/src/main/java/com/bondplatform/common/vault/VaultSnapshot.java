package com.bondplatform.common.vault;

import com.bondplatform.common.model.Address;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;

/**
 * Point-in-time view of a vault's bond state, read in one serialized step.
 */
public record VaultSnapshot(
    @JsonProperty("bondId")           BigInteger bondId,
    @JsonProperty("creditor")         Address creditor,
    @JsonProperty("debtor")           Address debtor,
    @JsonProperty("debtAmount")       BigInteger debtAmount,
    @JsonProperty("bondMaturity")     long bondMaturity,
    @JsonProperty("principalPaid")    boolean principalPaid,
    @JsonProperty("principalRepaid")  BigInteger principalRepaid,
    @JsonProperty("feesBips")         int feesBips,
    @JsonProperty("feesRecipient")    Address feesRecipient,
    @JsonProperty("admin")            Address admin,
    @JsonProperty("asset")            Address asset,
    @JsonProperty("totalAssets")      BigInteger totalAssets,
    @JsonProperty("totalSupply")      BigInteger totalSupply,
    @JsonProperty("priceFeed")        String priceFeed
) {}
