package com.bondplatform.common.registry;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.Address;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Transferable bond ownership tokens: minted once, then moved by their holder.
 */
public class InMemoryBondRegistry implements OwnershipResolver {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBondRegistry.class);
    private static final String COMPONENT = "BondRegistry";

    private final Map<BigInteger, Address> owners = new HashMap<>();

    public synchronized void mint(BigInteger bondId, Address owner) {
        if (owner == null || owner.isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "bond owner must not be zero");
        }
        if (owners.containsKey(bondId)) {
            throw new IllegalStateException("bond " + bondId + " already issued");
        }
        owners.put(bondId, owner);
        log.info("Bond issued. bondId={} owner={}", bondId, owner);
    }

    public synchronized void transfer(Address caller, BigInteger bondId, Address to) {
        Address owner = ownerOf(bondId);
        if (!owner.equals(caller)) {
            throw new BondException(COMPONENT, ErrorCode.NOT_BOND_OWNER, caller + " does not hold bond " + bondId);
        }
        if (to == null || to.isZero()) {
            throw new BondException(COMPONENT, ErrorCode.ZERO_ADDRESS, "bond recipient must not be zero");
        }
        owners.put(bondId, to);
        log.info("Bond transferred. bondId={} from={} to={}", bondId, owner, to);
    }

    @Override
    public synchronized Address ownerOf(BigInteger bondId) {
        Address owner = owners.get(bondId);
        if (owner == null) {
            throw new BondException(COMPONENT, ErrorCode.BOND_NOT_FOUND, "bond " + bondId + " does not exist");
        }
        return owner;
    }
}
