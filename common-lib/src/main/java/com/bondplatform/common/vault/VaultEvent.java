package com.bondplatform.common.vault;

import com.bondplatform.common.model.Address;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigInteger;

/**
 * Facts emitted by {@link RepaymentVault} once an operation has committed.
 */
public sealed interface VaultEvent {

    @JsonIgnore
    String type();

    record PrincipalPaid(BigInteger assets, BigInteger value, Address creditor, Address debtor)
        implements VaultEvent {
        @Override
        public String type() {
            return "PrincipalPaid";
        }
    }

    record PrincipalRepaid(BigInteger assets, BigInteger value, Address debtor, Address creditor)
        implements VaultEvent {
        @Override
        public String type() {
            return "PrincipalRepaid";
        }
    }

    record InterestPaid(BigInteger assets, BigInteger value, Address debtor, Address creditor)
        implements VaultEvent {
        @Override
        public String type() {
            return "InterestPaid";
        }
    }

    record FeesSet(int bips) implements VaultEvent {
        @Override
        public String type() {
            return "FeesSet";
        }
    }

    record FeesRecipientSet(Address recipient) implements VaultEvent {
        @Override
        public String type() {
            return "FeesRecipientSet";
        }
    }

    record AdminTransferred(Address previousAdmin, Address newAdmin) implements VaultEvent {
        @Override
        public String type() {
            return "AdminTransferred";
        }
    }

    record Withdrawn(Address caller, Address receiver, Address owner, BigInteger assets, BigInteger shares)
        implements VaultEvent {
        @Override
        public String type() {
            return "Withdrawn";
        }
    }
}
