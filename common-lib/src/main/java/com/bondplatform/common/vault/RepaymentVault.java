package com.bondplatform.common.vault;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.feed.RoundDataFeed;
import com.bondplatform.common.ledger.AssetLedger;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.PriceRound;
import com.bondplatform.common.registry.OwnershipResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Custodial vault servicing one bond.
 *
 * <p>Holds a single asset and issues one share per credited asset unit. All inflows
 * go through {@link #deposit(Address, BigInteger, BigInteger, boolean)}, which prices
 * the payment against the configured feed and enforces the payment protocol:
 * <ul>
 *   <li><b>principal funding</b>: the creditor pays exactly {@code debtAmount} once;
 *       shares go to the debtor;</li>
 *   <li><b>principal repayment</b>: the debtor repays up to the outstanding principal;
 *       shares go to the creditor;</li>
 *   <li><b>interest</b>: the debtor pays any value; {@code feesBips} of the assets are
 *       credited to the fee recipient, the rest to the creditor.</li>
 * </ul>
 * The creditor is whoever holds the bond at call time. Withdrawals are governed by
 * share balances alone.
 *
 * <p>Every public operation is one serialized, all-or-nothing state transition.
 */
public final class RepaymentVault implements PricedDepositVault {

    private static final Logger log = LoggerFactory.getLogger(RepaymentVault.class);
    private static final String COMPONENT = "RepaymentVault";

    public static final Duration MAX_PRICE_AGE = Duration.ofHours(25);
    public static final int MAX_FEES_BIPS = 1000;
    public static final BigInteger BIPS_DENOMINATOR = BigInteger.valueOf(10_000);

    private final Address self;
    private final BigInteger bondId;
    private final Address debtor;
    private final BigInteger debtAmount;
    private final long bondMaturity;
    private final OwnershipResolver ownership;
    private final AssetLedger asset;
    private final RoundDataFeed priceFeed;
    private final BigInteger assetScale;
    private final Clock clock;
    private final ShareLedger shares = new ShareLedger();
    private final List<VaultEventListener> listeners = new CopyOnWriteArrayList<>();

    private Address admin;
    private boolean principalPaid;
    private BigInteger principalRepaid;
    private int feesBips;
    private Address feesRecipient;

    public RepaymentVault(Address self, BondTerms terms, OwnershipResolver ownership,
                          AssetLedger asset, RoundDataFeed priceFeed, Clock clock) {
        requireNonZero(self, "vault address");
        requireNonZero(terms.admin(), "admin");
        requireNonZero(terms.debtor(), "debtor");
        requireNonZero(terms.feesRecipient(), "fees recipient");
        if (asset == null) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "asset ledger is required");
        }
        requireNonZero(asset.address(), "asset");
        if (priceFeed == null) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "price feed is required");
        }
        if (terms.debtAmount() == null || terms.debtAmount().signum() <= 0) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_AMOUNT, "debt amount must be positive");
        }
        if (terms.bondMaturity() <= 0) {
            throw new BondException(COMPONENT, ErrorCode.INVALID_BOND_MATURITY,
                "bond maturity must be a positive timestamp");
        }
        requireFeesInRange(terms.feesBips());

        BigInteger repaid = terms.initialPrincipalRepaid() != null ? terms.initialPrincipalRepaid() : BigInteger.ZERO;
        if (repaid.signum() < 0 || repaid.compareTo(terms.debtAmount()) > 0) {
            throw new BondException(COMPONENT, ErrorCode.INVALID_PRINCIPAL_AMOUNT,
                "initial repaid principal " + repaid + " outside [0, " + terms.debtAmount() + "]");
        }
        if (repaid.signum() > 0 && !terms.initialPrincipalPaid()) {
            throw new BondException(COMPONENT, ErrorCode.PRINCIPAL_NOT_PAID,
                "principal cannot be repaid before it was paid");
        }

        // the bond must exist; the owner itself is never cached
        ownership.ownerOf(terms.bondId());

        this.self            = self;
        this.bondId          = terms.bondId();
        this.debtor          = terms.debtor();
        this.debtAmount      = terms.debtAmount();
        this.bondMaturity    = terms.bondMaturity();
        this.ownership       = ownership;
        this.asset           = asset;
        this.priceFeed       = priceFeed;
        this.assetScale      = BigInteger.TEN.pow(asset.decimals());
        this.clock           = clock;
        this.admin           = terms.admin();
        this.principalPaid   = terms.initialPrincipalPaid();
        this.principalRepaid = repaid;
        this.feesBips        = terms.feesBips();
        this.feesRecipient   = terms.feesRecipient();

        log.info("Vault opened. vault={} bondId={} debtor={} debtAmount={} feesBips={} priceFeed={}",
                 self, bondId, debtor, debtAmount, feesBips, priceFeed.description());
    }

    public void addListener(VaultEventListener listener) {
        listeners.add(listener);
    }

    // ── priced deposit ───────────────────────────────────────────────────────

    @Override
    public DepositReceipt deposit(Address caller, BigInteger maxAssets, BigInteger targetValue, boolean principal) {
        requireNonNegative(maxAssets, "maxAssets");
        requireNonNegative(targetValue, "targetValue");

        List<VaultEvent> emitted = new ArrayList<>(1);
        DepositReceipt receipt;
        synchronized (this) {
            Address creditor = ownership.ownerOf(bondId);
            BigInteger requiredAssets = quoteAssets(targetValue);
            if (requiredAssets.compareTo(maxAssets) > 0) {
                throw new BondException(COMPONENT, ErrorCode.INSUFFICIENT_ASSETS,
                    "deposit needs " + requiredAssets + " assets, caller allows " + maxAssets);
            }

            boolean paidBefore = principalPaid;
            BigInteger repaidBefore = principalRepaid;
            List<Credit> credits = new ArrayList<>(2);

            if (principal) {
                if (caller.equals(creditor)) {
                    if (targetValue.compareTo(debtAmount) != 0) {
                        throw new BondException(COMPONENT, ErrorCode.INVALID_PRINCIPAL_AMOUNT,
                            "principal funding must equal " + debtAmount + ", got " + targetValue);
                    }
                    if (principalPaid) {
                        throw new BondException(COMPONENT, ErrorCode.PRINCIPAL_ALREADY_PAID,
                            "bond " + bondId + " is already funded");
                    }
                    principalPaid = true;
                    emitted.add(new VaultEvent.PrincipalPaid(requiredAssets, targetValue, creditor, debtor));
                    credits.add(new Credit(debtor, requiredAssets));
                } else if (caller.equals(debtor)) {
                    if (!principalPaid) {
                        throw new BondException(COMPONENT, ErrorCode.PRINCIPAL_NOT_PAID,
                            "bond " + bondId + " has not been funded");
                    }
                    BigInteger outstanding = debtAmount.subtract(principalRepaid);
                    if (targetValue.compareTo(outstanding) > 0) {
                        throw new BondException(COMPONENT, ErrorCode.INVALID_PRINCIPAL_AMOUNT,
                            "repayment " + targetValue + " exceeds outstanding " + outstanding);
                    }
                    principalRepaid = principalRepaid.add(targetValue);
                    emitted.add(new VaultEvent.PrincipalRepaid(requiredAssets, targetValue, debtor, creditor));
                    credits.add(new Credit(creditor, requiredAssets));
                } else {
                    throw new BondException(COMPONENT, ErrorCode.ONLY_DEBTOR_OR_CREDITOR,
                        caller + " may not move principal");
                }
            } else {
                if (!caller.equals(debtor)) {
                    throw new BondException(COMPONENT, ErrorCode.ONLY_DEBTOR, caller + " may not pay interest");
                }
                BigInteger fees = requiredAssets.multiply(BigInteger.valueOf(feesBips)).divide(BIPS_DENOMINATOR);
                BigInteger net = requiredAssets.subtract(fees);
                emitted.add(new VaultEvent.InterestPaid(requiredAssets, targetValue, debtor, creditor));
                credits.add(new Credit(feesRecipient, fees));
                credits.add(new Credit(creditor, net));
            }

            try {
                asset.transferFrom(self, caller, self, requiredAssets);
            } catch (RuntimeException e) {
                principalPaid   = paidBefore;
                principalRepaid = repaidBefore;
                throw e;
            }
            for (Credit credit : credits) {
                shares.mint(credit.receiver(), credit.shares());
            }
            receipt = new DepositReceipt(requiredAssets, requiredAssets);
            log.info("Deposit settled. vault={} caller={} principal={} targetValue={} assets={} credits={}",
                     self, caller, principal, targetValue, requiredAssets, credits);
        }
        publish(emitted);
        return receipt;
    }

    @Override
    public synchronized BigInteger quoteAssets(BigInteger targetValue) {
        return targetValue.multiply(assetScale).divide(currentPrice());
    }

    /**
     * Latest feed answer, rejected when older than {@link #MAX_PRICE_AGE} or not positive.
     */
    private BigInteger currentPrice() {
        PriceRound round = priceFeed.latestRoundData();
        long age = clock.instant().getEpochSecond() - round.updatedAt();
        if (age > MAX_PRICE_AGE.toSeconds()) {
            throw new BondException(COMPONENT, ErrorCode.STALE_PRICE,
                "round " + round.roundId() + " is " + age + "s old");
        }
        if (round.answer().signum() <= 0) {
            throw new BondException(COMPONENT, ErrorCode.INVALID_PRICE_VALUE,
                "price " + round.answer() + " is not positive");
        }
        return round.answer();
    }

    // ── redemption ───────────────────────────────────────────────────────────

    @Override
    public BigInteger withdraw(Address caller, BigInteger assets, Address receiver, Address owner) {
        requireNonNegative(assets, "assets");
        BigInteger burned;
        synchronized (this) {
            burned = previewWithdraw(assets);
            payOut(caller, receiver, owner, assets, burned);
        }
        publish(List.of(new VaultEvent.Withdrawn(caller, receiver, owner, assets, burned)));
        return burned;
    }

    @Override
    public BigInteger redeem(Address caller, BigInteger shareAmount, Address receiver, Address owner) {
        requireNonNegative(shareAmount, "shares");
        BigInteger assets;
        synchronized (this) {
            assets = previewRedeem(shareAmount);
            payOut(caller, receiver, owner, assets, shareAmount);
        }
        publish(List.of(new VaultEvent.Withdrawn(caller, receiver, owner, assets, shareAmount)));
        return assets;
    }

    private void payOut(Address caller, Address receiver, Address owner, BigInteger assets, BigInteger burned) {
        requireNonZero(receiver, "receiver");
        // assets paid to the vault stay in custody while the shares are gone
        if (receiver.equals(self)) {
            throw new BondException(COMPONENT, ErrorCode.INVALID_RECEIVER, "receiver must not be the vault itself");
        }
        boolean delegated = !caller.equals(owner);
        BigInteger allowanceBefore = shares.allowance(owner, caller);
        if (delegated) {
            shares.requireAllowance(owner, caller, burned);
        }
        shares.burn(owner, burned);
        if (delegated) {
            shares.approve(owner, caller, allowanceBefore.subtract(burned));
        }
        try {
            asset.transfer(self, receiver, assets);
        } catch (RuntimeException e) {
            shares.mint(owner, burned);
            if (delegated) {
                shares.approve(owner, caller, allowanceBefore);
            }
            throw e;
        }
        log.info("Withdrawal settled. vault={} caller={} owner={} receiver={} assets={}",
                 self, caller, owner, receiver, assets);
    }

    // ── share token ──────────────────────────────────────────────────────────

    @Override
    public synchronized void transfer(Address caller, Address to, BigInteger shareAmount) {
        requireNonZero(to, "share recipient");
        requireNonNegative(shareAmount, "shares");
        shares.transfer(caller, to, shareAmount);
    }

    @Override
    public synchronized void approve(Address caller, Address spender, BigInteger shareAmount) {
        requireNonZero(spender, "spender");
        requireNonNegative(shareAmount, "shares");
        shares.approve(caller, spender, shareAmount);
    }

    @Override
    public synchronized BigInteger balanceOf(Address account) {
        return shares.balanceOf(account);
    }

    @Override
    public synchronized BigInteger allowance(Address owner, Address spender) {
        return shares.allowance(owner, spender);
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return shares.totalSupply();
    }

    @Override
    public BigInteger totalAssets() {
        return asset.balanceOf(self);
    }

    // 1:1, no accrual
    @Override
    public BigInteger convertToShares(BigInteger assets) {
        return assets;
    }

    @Override
    public BigInteger convertToAssets(BigInteger shareAmount) {
        return shareAmount;
    }

    @Override
    public BigInteger previewWithdraw(BigInteger assets) {
        return convertToShares(assets);
    }

    @Override
    public BigInteger previewRedeem(BigInteger shareAmount) {
        return convertToAssets(shareAmount);
    }

    @Override
    public synchronized BigInteger maxWithdraw(Address owner) {
        return convertToAssets(shares.balanceOf(owner));
    }

    @Override
    public synchronized BigInteger maxRedeem(Address owner) {
        return shares.balanceOf(owner);
    }

    // ── admin ────────────────────────────────────────────────────────────────

    public void setFeesBips(Address caller, int newBips) {
        synchronized (this) {
            requireAdmin(caller);
            requireFeesInRange(newBips);
            feesBips = newBips;
        }
        log.info("FEES_SET vault={} bips={}", self, newBips);
        publish(List.of(new VaultEvent.FeesSet(newBips)));
    }

    public void setFeesRecipient(Address caller, Address newRecipient) {
        synchronized (this) {
            requireAdmin(caller);
            requireNonZero(newRecipient, "fees recipient");
            feesRecipient = newRecipient;
        }
        log.info("FEES_RECIPIENT_SET vault={} recipient={}", self, newRecipient);
        publish(List.of(new VaultEvent.FeesRecipientSet(newRecipient)));
    }

    public void transferAdmin(Address caller, Address newAdmin) {
        Address previous;
        synchronized (this) {
            requireAdmin(caller);
            requireNonZero(newAdmin, "admin");
            previous = admin;
            admin = newAdmin;
        }
        log.info("ADMIN_TRANSFERRED vault={} from={} to={}", self, previous, newAdmin);
        publish(List.of(new VaultEvent.AdminTransferred(previous, newAdmin)));
    }

    // ── reads ────────────────────────────────────────────────────────────────

    /**
     * Current bond holder, looked up live.
     */
    public Address creditor() {
        return ownership.ownerOf(bondId);
    }

    public synchronized VaultSnapshot snapshot() {
        return new VaultSnapshot(bondId, creditor(), debtor, debtAmount, bondMaturity, principalPaid,
            principalRepaid, feesBips, feesRecipient, admin, asset.address(), totalAssets(),
            shares.totalSupply(), priceFeed.description());
    }

    public Address address() {
        return self;
    }

    @Override
    public Address asset() {
        return asset.address();
    }

    public RoundDataFeed priceFeed() {
        return priceFeed;
    }

    public BigInteger bondId() {
        return bondId;
    }

    public Address debtor() {
        return debtor;
    }

    public BigInteger debtAmount() {
        return debtAmount;
    }

    public long bondMaturity() {
        return bondMaturity;
    }

    public synchronized boolean principalPaid() {
        return principalPaid;
    }

    public synchronized BigInteger principalRepaid() {
        return principalRepaid;
    }

    public synchronized int feesBips() {
        return feesBips;
    }

    public synchronized Address feesRecipient() {
        return feesRecipient;
    }

    public synchronized Address admin() {
        return admin;
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private record Credit(Address receiver, BigInteger shares) {}

    private void publish(List<VaultEvent> events) {
        for (VaultEvent event : events) {
            for (VaultEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.warn("Vault event listener failed (non-fatal). vault={} event={}", self, event.type(), e);
                }
            }
        }
    }

    private void requireAdmin(Address caller) {
        if (!admin.equals(caller)) {
            throw new BondException(COMPONENT, ErrorCode.ONLY_ADMIN, caller + " is not the admin");
        }
    }

    private static void requireFeesInRange(int bips) {
        if (bips < 0 || bips > MAX_FEES_BIPS) {
            throw new BondException(COMPONENT, ErrorCode.EXCESSIVE_VAULT_FEES,
                "fees of " + bips + " bips outside [0, " + MAX_FEES_BIPS + "]");
        }
    }

    private static void requireNonZero(Address address, String role) {
        if (address == null || address.isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, role + " must not be zero");
        }
    }

    private static void requireNonNegative(BigInteger amount, String name) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }
}
