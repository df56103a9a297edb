package com.bondplatform.common.relay;

import com.bondplatform.common.codec.PriceRoundCodec;
import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.model.RelayEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-process relay between two domains.
 *
 * <p>Submitted envelopes wait in a queue until the caller delivers them, in any
 * order, or drops them. This is how an asynchronous channel that may reorder or
 * lose messages is driven deterministically. A delivery that the receiver rejects
 * is consumed and not retried.
 */
public class QueuedRelayChannel implements CrossDomainMessenger {

    private static final Logger log = LoggerFactory.getLogger(QueuedRelayChannel.class);
    private static final String COMPONENT = "QueuedRelayChannel";

    private record Route(Bytes32 domain, Address address) {}

    private final Bytes32 sourceDomain;
    private final Map<Route, CrossDomainReceiver> receivers = new LinkedHashMap<>();
    private final Map<Bytes32, RelayEnvelope> queue = new LinkedHashMap<>();
    private long nonce;

    public QueuedRelayChannel(Bytes32 sourceDomain) {
        this.sourceDomain = sourceDomain;
    }

    public synchronized void connect(Bytes32 destinationDomain, Address destinationAddress,
                                     CrossDomainReceiver receiver) {
        receivers.put(new Route(destinationDomain, destinationAddress), receiver);
    }

    @Override
    public Bytes32 sourceDomain() {
        return sourceDomain;
    }

    @Override
    public synchronized Bytes32 sendCrossDomainMessage(Address sender, OutboundMessage message) {
        if (message.destinationAddress() == null || message.destinationAddress().isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "destination address must not be zero");
        }
        Bytes32 messageId = MessageIds.derive(sourceDomain, message.destinationDomain(), ++nonce);
        RelayEnvelope envelope = new RelayEnvelope(messageId, sourceDomain, sender,
            message.destinationDomain(), message.destinationAddress(), message.fee(),
            message.requiredGasLimit(), message.payload());
        queue.put(messageId, envelope);
        log.debug("Envelope queued. messageId={} pending={}", messageId, queue.size());
        return messageId;
    }

    public synchronized List<RelayEnvelope> pending() {
        return List.copyOf(queue.values());
    }

    /**
     * Delivers the oldest pending envelope.
     *
     * @return the delivered envelope, empty if nothing was pending
     */
    public Optional<RelayEnvelope> deliverNext() {
        RelayEnvelope next;
        synchronized (this) {
            Iterator<RelayEnvelope> it = queue.values().iterator();
            if (!it.hasNext()) {
                return Optional.empty();
            }
            next = it.next();
        }
        deliver(next.messageId());
        return Optional.of(next);
    }

    /**
     * Delivers one specific envelope, regardless of its position in the queue.
     */
    public void deliver(Bytes32 messageId) {
        RelayEnvelope envelope;
        CrossDomainReceiver receiver;
        synchronized (this) {
            envelope = queue.remove(messageId);
            if (envelope == null) {
                throw new IllegalArgumentException("no pending message " + messageId);
            }
            receiver = receivers.get(new Route(envelope.destinationDomain(), envelope.destinationAddress()));
        }
        if (receiver == null) {
            log.warn("No receiver at destination, message lost. messageId={} destination={}/{}",
                     messageId, envelope.destinationDomain(), envelope.destinationAddress());
            return;
        }
        receiver.receiveRelayedMessage(envelope.sourceDomain(), envelope.sourceSender(),
            PriceRoundCodec.fromHex(envelope.payload()));
        log.debug("Envelope delivered. messageId={}", messageId);
    }

    public void deliverAll() {
        while (deliverNext().isPresent()) {
            // drain
        }
    }

    /**
     * Discards a pending envelope, as a lossy channel would.
     */
    public synchronized boolean drop(Bytes32 messageId) {
        boolean dropped = queue.remove(messageId) != null;
        if (dropped) {
            log.info("Envelope dropped. messageId={}", messageId);
        }
        return dropped;
    }
}
