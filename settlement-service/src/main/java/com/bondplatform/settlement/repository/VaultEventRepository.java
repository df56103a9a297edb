package com.bondplatform.settlement.repository;

import com.bondplatform.settlement.model.VaultEventRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface VaultEventRepository extends ReactiveCrudRepository<VaultEventRecord, Long> {

    /**
     * Most recent events of one vault first.
     */
    @Query("""
        SELECT * FROM vault_events
        WHERE vault_address = :vaultAddress
        ORDER BY id DESC
        LIMIT :limit
        """)
    Flux<VaultEventRecord> findRecent(String vaultAddress, int limit);
}
