package com.bondplatform.settlement.service;

import com.bondplatform.common.codec.PriceRoundCodec;
import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.RelayEnvelope;
import com.bondplatform.common.oracle.ValuationOracle;
import com.bondplatform.common.trace.TraceContextUtil;
import com.bondplatform.settlement.oracle.OracleDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Entry point of the relay on this domain.
 *
 * <p>Only a relayer presenting the configured token may deliver. The envelope is then
 * handed to the oracle at its destination address, which does its own source check.
 */
public class RelayInboxService {

    private static final Logger log = LoggerFactory.getLogger(RelayInboxService.class);
    private static final String COMPONENT = "RelayInbox";

    private final OracleDirectory oracles;
    private final byte[] relayToken;

    public RelayInboxService(OracleDirectory oracles, String relayToken) {
        if (relayToken == null || relayToken.isBlank()) {
            throw new IllegalStateException("relay token must be configured");
        }
        this.oracles    = oracles;
        this.relayToken = relayToken.getBytes(StandardCharsets.UTF_8);
    }

    public void receive(String presentedToken, RelayEnvelope envelope) {
        String messageId = envelope.messageId() != null ? envelope.messageId().toString() : "unknown";
        if (presentedToken == null
                || !MessageDigest.isEqual(relayToken, presentedToken.getBytes(StandardCharsets.UTF_8))) {
            TraceContextUtil.withMdc(messageId, () ->
                log.warn("RELAY_REJECTED messageId={} reason=token", messageId));
            throw new BondException(COMPONENT, ErrorCode.UNAUTHORIZED_RELAYER, "relay token missing or wrong");
        }

        ValuationOracle oracle = oracles.atAddress(envelope.destinationAddress())
            .orElseThrow(() -> new BondException(COMPONENT, ErrorCode.UNEXPECTED_MESSAGE,
                "no receiver at " + envelope.destinationAddress()));

        oracle.receiveRelayedMessage(envelope.sourceDomain(), envelope.sourceSender(),
            PriceRoundCodec.fromHex(envelope.payload()));
        TraceContextUtil.withMdc(messageId, () ->
            log.info("RELAY_ACCEPTED messageId={} destination={} oracle={}",
                     messageId, envelope.destinationAddress(), oracle.description()));
    }
}
