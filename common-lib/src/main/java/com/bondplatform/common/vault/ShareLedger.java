package com.bondplatform.common.vault;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.Address;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Share balances and allowances of one vault. Not thread-safe: the owning vault
 * serialises access.
 */
final class ShareLedger {

    private static final String COMPONENT = "RepaymentVault";

    private record AllowanceKey(Address owner, Address spender) {}

    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<AllowanceKey, BigInteger> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    BigInteger allowance(Address owner, Address spender) {
        return allowances.getOrDefault(new AllowanceKey(owner, spender), BigInteger.ZERO);
    }

    BigInteger totalSupply() {
        return totalSupply;
    }

    void mint(Address to, BigInteger shares) {
        if (shares.signum() == 0) {
            return;
        }
        balances.merge(to, shares, BigInteger::add);
        totalSupply = totalSupply.add(shares);
    }

    void burn(Address from, BigInteger shares) {
        requireBalance(from, shares);
        balances.put(from, balanceOf(from).subtract(shares));
        totalSupply = totalSupply.subtract(shares);
    }

    void transfer(Address from, Address to, BigInteger shares) {
        requireBalance(from, shares);
        balances.put(from, balanceOf(from).subtract(shares));
        balances.merge(to, shares, BigInteger::add);
    }

    void approve(Address owner, Address spender, BigInteger shares) {
        allowances.put(new AllowanceKey(owner, spender), shares);
    }

    void requireBalance(Address account, BigInteger shares) {
        BigInteger balance = balanceOf(account);
        if (balance.compareTo(shares) < 0) {
            throw new BondException(COMPONENT, ErrorCode.INSUFFICIENT_BALANCE,
                account + " holds " + balance + " shares, needs " + shares);
        }
    }

    void requireAllowance(Address owner, Address spender, BigInteger shares) {
        BigInteger allowed = allowance(owner, spender);
        if (allowed.compareTo(shares) < 0) {
            throw new BondException(COMPONENT, ErrorCode.INSUFFICIENT_ALLOWANCE,
                spender + " may move " + allowed + " shares of " + owner + ", needs " + shares);
        }
    }
}
