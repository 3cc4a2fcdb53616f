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
 * JPA entity for the reconciliation_log table.
 * One row per stuck trade the recovery pass resolved against on-chain state.
 */
@Entity
@Table(name = "reconciliation_log")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconciliationLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_uuid", length = 64, nullable = false)
    private String tradeUuid;

    @Column(name = "expected_state", length = 16)
    private String expectedState;

    @Column(name = "actual_on_chain", length = 16)
    private String actualOnChain;

    @Column(length = 32)
    private String discrepancy;

    @Column(name = "on_chain_tx_signature", length = 100)
    private String onChainTxSignature;

    @Column(name = "resolved_by", length = 50)
    private String resolvedBy;

    @Column(length = 1000)
    private String notes;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
