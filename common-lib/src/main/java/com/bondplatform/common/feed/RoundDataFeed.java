package com.bondplatform.common.feed;

import com.bondplatform.common.model.PriceRound;

import java.math.BigInteger;

/**
 * Read contract shared by every round-based price source: the relayed oracle,
 * the two-feed aggregator and the local source feed on the sending domain.
 */
public interface RoundDataFeed {

    int decimals();

    String description();

    long version();

    /**
     * @return the stored round; implementations decide how absent rounds surface
     */
    PriceRound getRoundData(BigInteger roundId);

    /**
     * @return the most recent round, or {@link PriceRound#EMPTY} if none exists yet
     */
    PriceRound latestRoundData();
}
