package com.bondplatform.common.aggregator;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.feed.RoundDataFeed;
import com.bondplatform.common.model.PriceRound;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Ratio feed over two independent round feeds.
 *
 * <pre>
 *   answer = price1 * 10^decimals / price2      (floor)
 * </pre>
 * Both source rounds must have been updated within one hour of each other.
 * Round metadata (id, timestamps, answeredInRound) comes from {@code feed1} only.
 */
public class PriceAggregator implements RoundDataFeed {

    public static final Duration MAX_TIME_DIFFERENCE = Duration.ofHours(1);

    private static final String COMPONENT = "PriceAggregator";
    private static final long VERSION = 1L;

    private final RoundDataFeed feed1;
    private final RoundDataFeed feed2;
    private final int decimals;
    private final BigInteger scale;

    public PriceAggregator(RoundDataFeed feed1, RoundDataFeed feed2, int decimals) {
        if (feed1 == null || feed2 == null) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "both underlying feeds are required");
        }
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative");
        }
        this.feed1    = feed1;
        this.feed2    = feed2;
        this.decimals = decimals;
        this.scale    = BigInteger.TEN.pow(decimals);
    }

    @Override
    public PriceRound latestRoundData() {
        return combine(feed1.latestRoundData(), feed2.latestRoundData());
    }

    @Override
    public PriceRound getRoundData(BigInteger roundId) {
        return combine(feed1.getRoundData(roundId), feed2.getRoundData(roundId));
    }

    private PriceRound combine(PriceRound round1, PriceRound round2) {
        long gap = Math.abs(round1.updatedAt() - round2.updatedAt());
        if (gap > MAX_TIME_DIFFERENCE.toSeconds()) {
            throw new BondException(COMPONENT, ErrorCode.PRICE_FEEDS_TIME_MISMATCH,
                "feeds updated " + gap + "s apart");
        }
        if (round2.answer().signum() <= 0) {
            throw new BondException(COMPONENT, ErrorCode.INVALID_PRICE_VALUE,
                "denominator price " + round2.answer() + " is not positive");
        }
        BigInteger answer = round1.answer().multiply(scale).divide(round2.answer());
        return round1.withAnswer(answer);
    }

    @Override
    public int decimals() {
        return decimals;
    }

    @Override
    public String description() {
        return feed1.description() + " / " + feed2.description();
    }

    @Override
    public long version() {
        return VERSION;
    }
}
