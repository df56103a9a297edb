package com.bondplatform.common.relay;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;

/**
 * Outbound relay API on the sending domain.
 *
 * <p>{@link #sendCrossDomainMessage} returns as soon as the message is accepted for
 * transport. Delivery happens later, possibly never, and is never retried by the caller.
 * Implementations throw when the submission itself is refused.
 */
public interface CrossDomainMessenger {

    Bytes32 sourceDomain();

    /**
     * @param sender  address of the sending application, reported to the receiver as source sender
     * @param message destination, fee, gas limit and payload
     * @return the relay-assigned message id
     */
    Bytes32 sendCrossDomainMessage(Address sender, OutboundMessage message);
}
