package com.bondplatform.common.relay;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.model.Bytes32;
import com.bondplatform.common.model.RelayFee;

/**
 * A message handed to the outbound relay API. The relay stamps the source domain
 * and sender and assigns the message id.
 */
public record OutboundMessage(
    Bytes32 destinationDomain,
    Address destinationAddress,
    RelayFee fee,
    long requiredGasLimit,
    String payload
) {}
