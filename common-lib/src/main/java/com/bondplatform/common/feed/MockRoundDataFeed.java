package com.bondplatform.common.feed;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.PriceRound;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Locally driven round feed. Each {@link #updateAnswer} opens a new round stamped
 * with the current time; {@link #updateRoundData} writes an arbitrary round.
 *
 * <p>Serves as the price source on the sending domain when no upstream aggregator
 * is wired in, and as a fixture for aggregator and vault tests.
 */
public class MockRoundDataFeed implements RoundDataFeed {

    private static final Logger log = LoggerFactory.getLogger(MockRoundDataFeed.class);

    private final int decimals;
    private final String description;
    private final Clock clock;
    private final Map<BigInteger, PriceRound> rounds = new HashMap<>();
    private BigInteger latestRoundId = BigInteger.ZERO;

    public MockRoundDataFeed(int decimals, String description, Clock clock) {
        this.decimals    = decimals;
        this.description = description;
        this.clock       = clock;
    }

    public MockRoundDataFeed(int decimals, String description, Clock clock, BigInteger initialAnswer) {
        this(decimals, description, clock);
        updateAnswer(initialAnswer);
    }

    public synchronized PriceRound updateAnswer(BigInteger answer) {
        long now = clock.instant().getEpochSecond();
        BigInteger next = latestRoundId.add(BigInteger.ONE);
        return store(new PriceRound(next, answer, now, now, next));
    }

    public synchronized PriceRound updateRoundData(BigInteger roundId, BigInteger answer,
                                                   long updatedAt, long startedAt) {
        return store(new PriceRound(roundId, answer, startedAt, updatedAt, roundId));
    }

    private PriceRound store(PriceRound round) {
        rounds.put(round.roundId(), round);
        latestRoundId = round.roundId();
        log.info("Local round updated. feed={} roundId={} answer={} updatedAt={}",
                 description, round.roundId(), round.answer(), round.updatedAt());
        return round;
    }

    @Override
    public int decimals() {
        return decimals;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public long version() {
        return 0L;
    }

    @Override
    public synchronized PriceRound getRoundData(BigInteger roundId) {
        PriceRound round = rounds.get(roundId);
        if (round == null) {
            throw new BondException("MockRoundDataFeed", ErrorCode.ROUND_NOT_FOUND,
                "no round " + roundId + " in " + description);
        }
        return round;
    }

    @Override
    public synchronized PriceRound latestRoundData() {
        return rounds.getOrDefault(latestRoundId, PriceRound.EMPTY);
    }
}
