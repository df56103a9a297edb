package com.bondplatform.common.ledger;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

public class InMemoryAssetLedger implements AssetLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAssetLedger.class);
    private static final String COMPONENT = "AssetLedger";

    private record AllowanceKey(Address owner, Address spender) {}

    private final Address address;
    private final String symbol;
    private final int decimals;
    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<AllowanceKey, BigInteger> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryAssetLedger(Address address, String symbol, int decimals) {
        if (address == null || address.isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "asset address must not be zero");
        }
        this.address  = address;
        this.symbol   = symbol;
        this.decimals = decimals;
    }

    /**
     * Issues new units to {@code to}. Issuance policy belongs to whoever owns the ledger.
     */
    public synchronized void mint(Address to, BigInteger amount) {
        requireRecipient(to);
        requireNonNegative(amount);
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
        log.info("Asset minted. asset={} to={} amount={}", symbol, to, amount);
    }

    @Override
    public synchronized void approve(Address owner, Address spender, BigInteger amount) {
        requireRecipient(spender);
        requireNonNegative(amount);
        allowances.put(new AllowanceKey(owner, spender), amount);
    }

    @Override
    public synchronized void transfer(Address from, Address to, BigInteger amount) {
        move(from, to, amount);
    }

    @Override
    public synchronized void transferFrom(Address spender, Address from, Address to, BigInteger amount) {
        AllowanceKey key = new AllowanceKey(from, spender);
        BigInteger allowed = allowances.getOrDefault(key, BigInteger.ZERO);
        if (allowed.compareTo(amount) < 0) {
            throw new BondException(COMPONENT, ErrorCode.INSUFFICIENT_ALLOWANCE,
                spender + " may spend " + allowed + " of " + from + ", needs " + amount);
        }
        move(from, to, amount);
        allowances.put(key, allowed.subtract(amount));
    }

    private void move(Address from, Address to, BigInteger amount) {
        requireRecipient(to);
        requireNonNegative(amount);
        BigInteger balance = balances.getOrDefault(from, BigInteger.ZERO);
        if (balance.compareTo(amount) < 0) {
            throw new BondException(COMPONENT, ErrorCode.INSUFFICIENT_BALANCE,
                from + " holds " + balance + ", needs " + amount);
        }
        balances.put(from, balance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
    }

    @Override
    public synchronized BigInteger balanceOf(Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger allowance(Address owner, Address spender) {
        return allowances.getOrDefault(new AllowanceKey(owner, spender), BigInteger.ZERO);
    }

    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public int decimals() {
        return decimals;
    }

    private static void requireRecipient(Address to) {
        if (to == null || to.isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "recipient must not be zero");
        }
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative");
        }
    }
}
