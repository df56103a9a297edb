package com.bondplatform.common.registry;

import com.bondplatform.common.model.Address;

import java.math.BigInteger;

/**
 * Live lookup of the current bond holder. Callers must not cache the result:
 * ownership may change between any two calls.
 */
@FunctionalInterface
public interface OwnershipResolver {

    /**
     * @throws com.bondplatform.common.exception.BondException with
     *         {@code BOND_NOT_FOUND} if the bond was never issued
     */
    Address ownerOf(BigInteger bondId);
}
