package com.bondplatform.common.vault;

import com.bondplatform.common.model.Address;

import java.math.BigInteger;

/**
 * General share-issuing vault over a single asset. Shares are themselves a
 * transferable balance, so the share-token operations live here as well.
 *
 * <p>Every mutating call names the acting account as {@code caller}.
 */
public interface TokenizedVault {

    Address asset();

    BigInteger totalAssets();

    BigInteger totalSupply();

    BigInteger balanceOf(Address account);

    BigInteger allowance(Address owner, Address spender);

    BigInteger convertToShares(BigInteger assets);

    BigInteger convertToAssets(BigInteger shares);

    BigInteger maxWithdraw(Address owner);

    BigInteger maxRedeem(Address owner);

    BigInteger previewWithdraw(BigInteger assets);

    BigInteger previewRedeem(BigInteger shares);

    /**
     * Deposits {@code assets} from the caller and mints shares to an arbitrary receiver.
     *
     * @return shares minted
     */
    BigInteger deposit(Address caller, BigInteger assets, Address receiver);

    /**
     * Mints exactly {@code shares} to an arbitrary receiver, pulling whatever assets that costs.
     *
     * @return assets pulled
     */
    BigInteger mint(Address caller, BigInteger shares, Address receiver);

    /**
     * @return shares burned
     */
    BigInteger withdraw(Address caller, BigInteger assets, Address receiver, Address owner);

    /**
     * @return assets paid out
     */
    BigInteger redeem(Address caller, BigInteger shares, Address receiver, Address owner);

    void transfer(Address caller, Address to, BigInteger shares);

    void approve(Address caller, Address spender, BigInteger shares);
}
