package com.bondplatform.common.vault;

import com.bondplatform.common.model.Address;

import java.math.BigInteger;

/**
 * Construction parameters of a {@link RepaymentVault}.
 *
 * @param bondMaturity           epoch seconds; informational only
 * @param initialPrincipalRepaid principal already repaid when the vault is created, in value units
 * @param feesBips               interest fee in basis points, at most 1000
 */
public record BondTerms(
    Address admin,
    BigInteger bondId,
    Address debtor,
    BigInteger debtAmount,
    long bondMaturity,
    boolean initialPrincipalPaid,
    BigInteger initialPrincipalRepaid,
    int feesBips,
    Address feesRecipient
) {}
