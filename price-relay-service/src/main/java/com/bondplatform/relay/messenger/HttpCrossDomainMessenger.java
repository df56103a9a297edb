package com.bondplatform.relay.messenger;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.model.RelayEnvelope;
import com.bondplatform.common.relay.CrossDomainMessenger;
import com.bondplatform.common.relay.MessageIds;
import com.bondplatform.common.relay.OutboundMessage;
import com.bondplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP implementation of {@link CrossDomainMessenger}.
 *
 * <p>Assigns the message id and returns at once; the envelope is POSTed to the
 * destination domain's relay inbox afterwards (fire-and-forget). A failed delivery
 * is logged and the message is lost. Nothing is retried.
 */
public class HttpCrossDomainMessenger implements CrossDomainMessenger {

    private static final Logger log = LoggerFactory.getLogger(HttpCrossDomainMessenger.class);

    public static final String RELAY_TOKEN_HEADER = "X-Relay-Token";
    public static final String MESSAGE_ID_HEADER = "X-Message-Id";

    private final Bytes32 sourceDomain;
    private final Map<Bytes32, WebClient> destinations;
    private final String relayToken;
    private final AtomicLong nonce = new AtomicLong();

    public HttpCrossDomainMessenger(Bytes32 sourceDomain, Map<Bytes32, WebClient> destinations, String relayToken) {
        this.sourceDomain = sourceDomain;
        this.destinations = Map.copyOf(destinations);
        this.relayToken   = relayToken;
    }

    @Override
    public Bytes32 sourceDomain() {
        return sourceDomain;
    }

    @Override
    public Bytes32 sendCrossDomainMessage(Address sender, OutboundMessage message) {
        if (message.destinationAddress() == null || message.destinationAddress().isZero()) {
            throw new BondException("HttpCrossDomainMessenger", ErrorCode.ZERO_ADDRESS,
                "destination address must not be zero");
        }
        WebClient client = destinations.get(message.destinationDomain());
        if (client == null) {
            throw new IllegalArgumentException("no route to domain " + message.destinationDomain());
        }

        Bytes32 messageId = MessageIds.derive(sourceDomain, message.destinationDomain(), nonce.incrementAndGet());
        RelayEnvelope envelope = new RelayEnvelope(messageId, sourceDomain, sender,
            message.destinationDomain(), message.destinationAddress(), message.fee(),
            message.requiredGasLimit(), message.payload());
        String id = messageId.toString();

        client.post()
            .uri("/api/v1/relay/receive")
            .header(RELAY_TOKEN_HEADER, relayToken)
            .header(MESSAGE_ID_HEADER, id)
            .bodyValue(envelope)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> TraceContextUtil.withMdc(id, () ->
                         log.info("RELAY_DELIVERED messageId={} destination={} status={}",
                                  id, message.destinationAddress(), r.getStatusCode())),
                err -> TraceContextUtil.withMdc(id, () ->
                         log.warn("RELAY_DELIVERY_FAILED messageId={} destination={} (message lost, no retry)",
                                  id, message.destinationAddress(), err))
            );
        return messageId;
    }
}
