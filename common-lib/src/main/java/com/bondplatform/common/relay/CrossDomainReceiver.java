package com.bondplatform.common.relay;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;

/**
 * Inbound entry point called by the relay when a message reaches this domain.
 * Implementations authenticate the (domain, sender) pair themselves.
 */
public interface CrossDomainReceiver {

    void receiveRelayedMessage(Bytes32 sourceDomain, Address sourceSender, byte[] payload);
}
