package com.bondplatform.common.ledger;

import com.bondplatform.common.model.Address;

import java.math.BigInteger;

/**
 * Custodial balance ledger of one fungible asset. Every mutating call names the
 * account acting on it; failures throw and leave balances untouched.
 */
public interface AssetLedger {

    Address address();

    String symbol();

    int decimals();

    BigInteger balanceOf(Address account);

    BigInteger allowance(Address owner, Address spender);

    void approve(Address owner, Address spender, BigInteger amount);

    void transfer(Address from, Address to, BigInteger amount);

    /**
     * Moves {@code amount} from {@code from} to {@code to}, spending the allowance
     * {@code from} granted to {@code spender}.
     */
    void transferFrom(Address spender, Address from, Address to, BigInteger amount);
}
