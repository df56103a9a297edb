package com.bondplatform.common.oracle;

import com.bondplatform.common.codec.PriceRoundCodec;
import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.feed.RoundDataFeed;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.model.PriceRound;
import com.bondplatform.common.relay.CrossDomainReceiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Destination-side mirror of a remote price feed.
 *
 * <p>Rounds arrive only through {@link #receiveRelayedMessage}, authenticated against
 * exactly one (source domain, source sender) pair. A round is stored under its own
 * id, overwriting any earlier delivery of the same id, and always becomes the latest
 * round, even when it is older than what was already stored. Such regressions are
 * logged as {@code ROUND_REGRESSION} but still accepted.
 *
 * <p>A decoded round with id 0 is rejected. Listener failures are logged and never
 * undo a stored round.
 *
 * <p>History is never pruned.
 */
public class ValuationOracle implements RoundDataFeed, CrossDomainReceiver {

    private static final Logger log = LoggerFactory.getLogger(ValuationOracle.class);
    private static final String COMPONENT = "ValuationOracle";
    private static final long VERSION = 1L;

    private final Bytes32 allowedSourceDomain;
    private final Address allowedSourceSender;
    private final int decimals;
    private final String description;
    private final Map<BigInteger, PriceRound> rounds = new HashMap<>();
    private final List<PriceUpdateListener> listeners = new CopyOnWriteArrayList<>();
    private BigInteger latestRoundId = BigInteger.ZERO;

    public ValuationOracle(Bytes32 allowedSourceDomain, Address allowedSourceSender,
                           int decimals, String description) {
        if (allowedSourceDomain == null || allowedSourceSender == null || allowedSourceSender.isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "allowed relay source must be set");
        }
        this.allowedSourceDomain = allowedSourceDomain;
        this.allowedSourceSender = allowedSourceSender;
        this.decimals            = decimals;
        this.description         = description;
    }

    public void addListener(PriceUpdateListener listener) {
        listeners.add(listener);
    }

    @Override
    public void receiveRelayedMessage(Bytes32 sourceDomain, Address sourceSender, byte[] payload) {
        if (!allowedSourceDomain.equals(sourceDomain) || !allowedSourceSender.equals(sourceSender)) {
            log.warn("Relay delivery rejected. feed={} sourceDomain={} sourceSender={}",
                     description, sourceDomain, sourceSender);
            throw new BondException(COMPONENT, ErrorCode.INVALID_SOURCE,
                "source " + sourceDomain + "/" + sourceSender + " is not allowed");
        }
        PriceRound round = PriceRoundCodec.decode(payload);
        // roundId 0 marks an absent round
        if (round.roundId().signum() == 0) {
            throw new BondException(COMPONENT, ErrorCode.INVALID_PAYLOAD, "roundId 0 cannot be stored");
        }

        synchronized (this) {
            PriceRound previous = rounds.get(latestRoundId);
            if (previous != null && (round.roundId().compareTo(previous.roundId()) < 0
                    || round.updatedAt() < previous.updatedAt())) {
                log.warn("ROUND_REGRESSION feed={} latestRoundId={} latestUpdatedAt={} incomingRoundId={} incomingUpdatedAt={}",
                         description, previous.roundId(), previous.updatedAt(), round.roundId(), round.updatedAt());
            }
            rounds.put(round.roundId(), round);
            latestRoundId = round.roundId();
        }

        log.info("PRICE_FEED_UPDATED feed={} roundId={} answer={} updatedAt={}",
                 description, round.roundId(), round.answer(), round.updatedAt());
        for (PriceUpdateListener listener : listeners) {
            try {
                listener.onPriceFeedUpdated(description, round);
            } catch (RuntimeException e) {
                log.warn("Price update listener failed (non-fatal). feed={} roundId={}",
                         description, round.roundId(), e);
            }
        }
    }

    @Override
    public synchronized PriceRound latestRoundData() {
        return rounds.getOrDefault(latestRoundId, PriceRound.EMPTY);
    }

    @Override
    public synchronized PriceRound getRoundData(BigInteger roundId) {
        PriceRound round = rounds.get(roundId);
        if (round == null) {
            throw new BondException(COMPONENT, ErrorCode.ROUND_NOT_FOUND, "round " + roundId + " was never received");
        }
        return round;
    }

    public synchronized BigInteger latestRoundId() {
        return latestRoundId;
    }

    public synchronized int roundCount() {
        return rounds.size();
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
        return VERSION;
    }
}
