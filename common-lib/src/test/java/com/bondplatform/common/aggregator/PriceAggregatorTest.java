package com.bondplatform.common.aggregator;

import com.bondplatform.common.MutableClock;
import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.feed.MockRoundDataFeed;
import com.bondplatform.common.model.PriceRound;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PriceAggregatorTest {

    private static final long T0 = Instant.parse("2026-02-01T12:00:00Z").getEpochSecond();

    private MockRoundDataFeed assetUsd;
    private MockRoundDataFeed eurUsd;
    private PriceAggregator aggregator;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.ofEpochSecond(T0));
        assetUsd = new MockRoundDataFeed(8, "ASSET / USD", clock);
        eurUsd = new MockRoundDataFeed(8, "EUR / USD", clock);
        aggregator = new PriceAggregator(assetUsd, eurUsd, 8);
    }

    @Nested
    @DisplayName("latestRoundData()")
    class LatestTests {

        @Test
        @DisplayName("answer = price1 * 10^decimals / price2, floored")
        void ratio() {
            assetUsd.updateRoundData(BigInteger.ONE, BigInteger.valueOf(100_000_000), T0, T0);
            eurUsd.updateRoundData(BigInteger.ONE, BigInteger.valueOf(108_000_000), T0, T0);

            // 1e8 * 1e8 / 1.08e8 = 92592592.59…
            assertEquals(BigInteger.valueOf(92_592_592), aggregator.latestRoundData().answer());
        }

        @Test
        @DisplayName("metadata comes from feed1 only")
        void metadataFromFeed1() {
            assetUsd.updateRoundData(BigInteger.valueOf(7), BigInteger.valueOf(200), T0, T0 - 30);
            eurUsd.updateRoundData(BigInteger.valueOf(99), BigInteger.valueOf(100), T0 + 60, T0 + 50);

            PriceRound round = aggregator.latestRoundData();
            assertEquals(BigInteger.valueOf(7), round.roundId());
            assertEquals(T0 - 30, round.startedAt());
            assertEquals(T0, round.updatedAt());
            assertEquals(BigInteger.valueOf(7), round.answeredInRound());
            assertEquals(BigInteger.valueOf(200_000_000), round.answer());
        }

        @Test
        @DisplayName("exactly one hour apart is still fresh")
        void boundaryAccepted() {
            assetUsd.updateRoundData(BigInteger.ONE, BigInteger.TEN, T0, T0);
            eurUsd.updateRoundData(BigInteger.ONE, BigInteger.TEN, T0 + 3600, T0);
            assertEquals(BigInteger.valueOf(100_000_000), aggregator.latestRoundData().answer());
        }

        @Test
        @DisplayName("more than one hour apart → PRICE_FEEDS_TIME_MISMATCH")
        void mismatch() {
            assetUsd.updateRoundData(BigInteger.ONE, BigInteger.TEN, T0 + 3601, T0);
            eurUsd.updateRoundData(BigInteger.ONE, BigInteger.TEN, T0, T0);
            BondException e = assertThrows(BondException.class, aggregator::latestRoundData);
            assertEquals(ErrorCode.PRICE_FEEDS_TIME_MISMATCH, e.getCode());
        }

        @Test
        @DisplayName("zero denominator → INVALID_PRICE_VALUE")
        void zeroDenominator() {
            assetUsd.updateRoundData(BigInteger.ONE, BigInteger.TEN, T0, T0);
            eurUsd.updateRoundData(BigInteger.ONE, BigInteger.ZERO, T0, T0);
            BondException e = assertThrows(BondException.class, aggregator::latestRoundData);
            assertEquals(ErrorCode.INVALID_PRICE_VALUE, e.getCode());
        }
    }

    @Nested
    @DisplayName("getRoundData()")
    class HistoricalTests {

        @Test
        @DisplayName("combines the matching round of each feed")
        void matchingRounds() {
            assetUsd.updateRoundData(BigInteger.ONE, BigInteger.valueOf(300), T0, T0);
            eurUsd.updateRoundData(BigInteger.ONE, BigInteger.valueOf(100), T0, T0);
            assetUsd.updateRoundData(BigInteger.TWO, BigInteger.valueOf(500), T0 + 10, T0 + 10);
            eurUsd.updateRoundData(BigInteger.TWO, BigInteger.valueOf(100), T0 + 10, T0 + 10);

            assertEquals(BigInteger.valueOf(300_000_000), aggregator.getRoundData(BigInteger.ONE).answer());
            assertEquals(BigInteger.valueOf(500_000_000), aggregator.latestRoundData().answer());
        }

        @Test
        @DisplayName("round missing from one feed → that feed's error surfaces")
        void missingRound() {
            assetUsd.updateRoundData(BigInteger.ONE, BigInteger.TEN, T0, T0);
            BondException e = assertThrows(BondException.class, () -> aggregator.getRoundData(BigInteger.ONE));
            assertEquals(ErrorCode.ROUND_NOT_FOUND, e.getCode());
        }
    }

    @Test
    @DisplayName("missing feed at construction → ZERO_ADDRESS")
    void missingFeed() {
        BondException e = assertThrows(BondException.class, () -> new PriceAggregator(assetUsd, null, 8));
        assertEquals(ErrorCode.ZERO_ADDRESS, e.getCode());
    }

    @Test
    @DisplayName("description and version")
    void metadata() {
        assertEquals("ASSET / USD / EUR / USD", aggregator.description());
        assertEquals(1L, aggregator.version());
        assertEquals(8, aggregator.decimals());
    }
}
