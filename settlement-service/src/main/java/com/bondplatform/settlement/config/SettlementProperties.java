package com.bondplatform.settlement.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.List;

/**
 * Destination-domain deployment: the oracles fed by the relay, the optional ratio
 * aggregator, the bond and its repayment vault.
 *
 * <p>{@code vault.priceFeed} names one of {@code oracles}, or {@value #AGGREGATOR_FEED}
 * for the aggregator.
 */
@ConfigurationProperties(prefix = "settlement")
public record SettlementProperties(
    String relayToken,
    List<Oracle> oracles,
    Aggregator aggregator,
    Asset asset,
    Bond bond,
    Vault vault
) {

    public static final String AGGREGATOR_FEED = "aggregator";

    public record Oracle(String name, String address, String sourceDomain, String sourceSender,
                         int decimals, String description) {}

    public record Aggregator(boolean enabled, String numerator, String denominator, int decimals) {}

    public record Asset(String address, String symbol, int decimals, String admin) {}

    public record Bond(BigInteger id, String holder) {}

    public record Vault(String address, String admin, String debtor, BigInteger debtAmount, long maturity,
                        boolean principalPaid, BigInteger principalRepaid, int feesBips,
                        String feesRecipient, String priceFeed) {}
}
