package com.bondplatform.settlement.oracle;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.oracle.ValuationOracle;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;

/**
 * Oracles deployed on this domain, addressable by name for reads and by address
 * for relay delivery.
 */
public class OracleDirectory {

    private final Map<String, ValuationOracle> byName = new LinkedHashMap<>();
    private final Map<Address, ValuationOracle> byAddress = new LinkedHashMap<>();

    public void register(String name, Address address, ValuationOracle oracle) {
        if (byName.containsKey(name) || byAddress.containsKey(address)) {
            throw new IllegalStateException("oracle " + name + " at " + address + " registered twice");
        }
        byName.put(name, oracle);
        byAddress.put(address, oracle);
    }

    public ValuationOracle byName(String name) {
        ValuationOracle oracle = byName.get(name);
        if (oracle == null) {
            throw new NoSuchElementException("no oracle named " + name);
        }
        return oracle;
    }

    public Optional<ValuationOracle> atAddress(Address address) {
        return Optional.ofNullable(byAddress.get(address));
    }

    public Set<String> names() {
        return byName.keySet();
    }
}
