package com.copytrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the config_audit table.
 * Append-only record of operational state changes: RPC mode switches, circuit breaker
 * trips and resets, and recovery-driven position reverts.
 */
@Entity
@Table(name = "config_audit")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ConfigAuditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "config_key", length = 100, nullable = false)
    private String key;

    @Column(name = "old_value", length = 500)
    private String oldValue;

    @Column(name = "new_value", length = 500)
    private String newValue;

    @Column(name = "changed_by", length = 100, nullable = false)
    private String changedBy;

    @Column(name = "change_reason", length = 1000)
    private String changeReason;

    @Column(name = "changed_at")
    private LocalDateTime changedAt;
}
