package com.bondplatform.settlement.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * One committed vault event. {@code payload} is the event serialized as JSON.
 */
@Data
@NoArgsConstructor
@Table("vault_events")
public class VaultEventRecord {

    @Id
    private Long id;

    private String vaultAddress;
    private String eventType;
    private String payload;

    private Instant recordedAt;
}
