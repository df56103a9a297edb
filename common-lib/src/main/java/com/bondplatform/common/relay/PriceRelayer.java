package com.bondplatform.common.relay;

import com.bondplatform.common.codec.PriceRoundCodec;
import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.feed.RoundDataFeed;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.model.PriceRound;
import com.bondplatform.common.model.RelayFee;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Send-only forwarder on the source domain.
 *
 * <p>Reads the wrapped local feed and ships its latest round to a destination
 * domain through the outbound relay. Holds no state of its own. Any inbound
 * message is refused with {@link ErrorCode#UNEXPECTED_MESSAGE}.
 */
public class PriceRelayer implements CrossDomainReceiver {

    private static final Logger log = LoggerFactory.getLogger(PriceRelayer.class);
    private static final String COMPONENT = "PriceRelayer";

    private final Address self;
    private final RoundDataFeed localFeed;
    private final CrossDomainMessenger messenger;

    public PriceRelayer(Address self, RoundDataFeed localFeed, CrossDomainMessenger messenger) {
        if (self == null || self.isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "relayer address must be set");
        }
        if (localFeed == null || messenger == null) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "local feed and messenger are required");
        }
        this.self      = self;
        this.localFeed = localFeed;
        this.messenger = messenger;
    }

    /**
     * Packages the local feed's latest round and submits it for delivery.
     *
     * @return the relay-assigned message id; delivery has not happened yet when this returns
     */
    public Bytes32 sendLatestRoundData(Bytes32 destinationDomain, Address destinationAddress,
                                       Address feeToken, BigInteger feeAmount, long gasLimit) {
        if (destinationDomain == null) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "destination domain must be set");
        }
        if (destinationAddress == null || destinationAddress.isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "destination address must not be zero");
        }
        RelayFee fee = new RelayFee(feeToken, feeAmount);
        if (fee.amount().signum() > 0 && fee.feeToken().isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "fee token required for a non-zero fee");
        }

        PriceRound round = localFeed.latestRoundData();
        if (round.isEmpty()) {
            throw new BondException(COMPONENT, ErrorCode.ROUND_NOT_FOUND, "local feed has no round to send");
        }

        OutboundMessage message = new OutboundMessage(
            destinationDomain, destinationAddress, fee, gasLimit, PriceRoundCodec.encodeHex(round));
        try {
            Bytes32 messageId = messenger.sendCrossDomainMessage(self, message);
            log.info("Round submitted for relay. messageId={} roundId={} answer={} destination={}/{}",
                     messageId, round.roundId(), round.answer(), destinationDomain, destinationAddress);
            return messageId;
        } catch (RuntimeException e) {
            log.error("Relay submission failed. roundId={} destination={}/{}",
                      round.roundId(), destinationDomain, destinationAddress, e);
            throw e;
        }
    }

    public PriceRound getLatestRoundData() {
        return localFeed.latestRoundData();
    }

    public Address address() {
        return self;
    }

    public Bytes32 sourceDomain() {
        return messenger.sourceDomain();
    }

    @Override
    public void receiveRelayedMessage(Bytes32 sourceDomain, Address sourceSender, byte[] payload) {
        log.warn("Inbound message refused. sourceDomain={} sourceSender={}", sourceDomain, sourceSender);
        throw new BondException(COMPONENT, ErrorCode.UNEXPECTED_MESSAGE, "relayer never receives messages");
    }
}
