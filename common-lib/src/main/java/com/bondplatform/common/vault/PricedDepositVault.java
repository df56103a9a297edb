package com.bondplatform.common.vault;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.Address;

import java.math.BigInteger;

/**
 * A vault whose only inflow is the priced, access-controlled deposit.
 *
 * <p>The generic receiver-chosen entry points of {@link TokenizedVault} are fixed
 * here to always fail. The interface is sealed so that no implementation can
 * re-enable them.
 */
public sealed interface PricedDepositVault extends TokenizedVault permits RepaymentVault {

    /**
     * @param maxAssets   most assets the caller accepts to have pulled
     * @param targetValue value, in price units, the payment must be worth
     * @param principal   {@code true} for principal funding or repayment, {@code false} for interest
     */
    DepositReceipt deposit(Address caller, BigInteger maxAssets, BigInteger targetValue, boolean principal);

    /**
     * @return assets a deposit of {@code targetValue} would pull at the current price
     */
    BigInteger quoteAssets(BigInteger targetValue);

    @Override
    default BigInteger deposit(Address caller, BigInteger assets, Address receiver) {
        throw new BondException("RepaymentVault", ErrorCode.UNSUPPORTED_OPERATION,
            "deposit to an arbitrary receiver is disabled");
    }

    @Override
    default BigInteger mint(Address caller, BigInteger shares, Address receiver) {
        throw new BondException("RepaymentVault", ErrorCode.UNSUPPORTED_OPERATION,
            "mint to an arbitrary receiver is disabled");
    }
}
