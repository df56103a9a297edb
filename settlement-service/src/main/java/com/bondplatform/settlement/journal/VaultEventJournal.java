package com.bondplatform.settlement.journal;

import com.bondplatform.common.model.Address;
import com.bondplatform.common.vault.VaultEvent;
import com.bondplatform.common.vault.VaultEventListener;
import com.bondplatform.settlement.model.VaultEventRecord;
import com.bondplatform.settlement.repository.VaultEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Persists every committed vault event to {@code vault_events}.
 *
 * <p>Writes are fire-and-forget: the vault never waits on the database, and a failed
 * write is logged without affecting the already-committed operation.
 */
public class VaultEventJournal implements VaultEventListener {

    private static final Logger log = LoggerFactory.getLogger(VaultEventJournal.class);

    private final Address vaultAddress;
    private final VaultEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public VaultEventJournal(Address vaultAddress, VaultEventRepository repository,
                             ObjectMapper objectMapper, Clock clock) {
        this.vaultAddress = vaultAddress;
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public void onEvent(VaultEvent event) {
        VaultEventRecord record = new VaultEventRecord();
        record.setVaultAddress(vaultAddress.toString());
        record.setEventType(event.type());
        record.setPayload(toJson(event));
        record.setRecordedAt(clock.instant());

        log.info("VAULT_EVENT vault={} type={} payload={}", vaultAddress, event.type(), record.getPayload());
        repository.save(record)
            .subscribe(
                saved -> log.debug("Vault event journaled. id={} type={}", saved.getId(), saved.getEventType()),
                err   -> log.warn("Vault event journal write failed (non-critical). vault={} type={}",
                                  vaultAddress, event.type(), err)
            );
    }

    private String toJson(VaultEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize vault event " + event.type(), e);
        }
    }
}
