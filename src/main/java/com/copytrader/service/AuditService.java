package com.copytrader.service;

import com.copytrader.entity.ConfigAuditEntity;
import com.copytrader.entity.ReconciliationLogEntity;
import com.copytrader.repository.jpa.ConfigAuditJpaRepository;
import com.copytrader.repository.jpa.ReconciliationLogJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes the operator's audit trail: configuration/state changes to {@code config_audit}
 * and recovery outcomes to {@code reconciliation_log}.
 *
 * <p>Audit writes never propagate failures. Losing an audit row is logged at ERROR, but
 * a database hiccup must not block a failover or a circuit breaker trip.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String KEY_RPC_MODE = "rpc_mode";
    public static final String KEY_CIRCUIT_BREAKER = "circuit_breaker";

    private final ConfigAuditJpaRepository configAuditJpaRepository;
    private final ReconciliationLogJpaRepository reconciliationLogJpaRepository;
    private final Clock clock;

    public AuditService(
            ConfigAuditJpaRepository configAuditJpaRepository,
            ReconciliationLogJpaRepository reconciliationLogJpaRepository,
            Clock clock) {
        this.configAuditJpaRepository = configAuditJpaRepository;
        this.reconciliationLogJpaRepository = reconciliationLogJpaRepository;
        this.clock = clock;
    }

    /**
     * Records a change of an operational setting or state.
     *
     * @param key       what changed, e.g. {@code rpc_mode} or {@code position:<uuid>}
     * @param changedBy actor, e.g. {@code SYSTEM_FAILOVER} or an admin name
     */
    public void logConfigChange(String key, String oldValue, String newValue, String changedBy, String reason) {
        ConfigAuditEntity entity = ConfigAuditEntity.builder()
                .key(key)
                .oldValue(oldValue)
                .newValue(newValue)
                .changedBy(changedBy)
                .changeReason(reason)
                .changedAt(LocalDateTime.now(clock))
                .build();
        try {
            configAuditJpaRepository.save(entity);
            log.info("Audit [{}] {} -> {} by {}: {}", key, oldValue, newValue, changedBy, reason);
        } catch (Exception e) {
            log.error("Failed to write config audit [{}] {} -> {} by {}: {}", key, oldValue, newValue, changedBy,
                    e.getMessage(), e);
        }
    }

    /**
     * Records how a stuck trade was reconciled against on-chain state.
     */
    public void logReconciliation(
            String tradeUuid,
            String expectedState,
            String actualOnChain,
            String discrepancy,
            String onChainTxSignature,
            String resolvedBy,
            String notes) {
        ReconciliationLogEntity entity = ReconciliationLogEntity.builder()
                .tradeUuid(tradeUuid)
                .expectedState(expectedState)
                .actualOnChain(actualOnChain)
                .discrepancy(discrepancy)
                .onChainTxSignature(onChainTxSignature)
                .resolvedBy(resolvedBy)
                .notes(notes)
                .createdAt(LocalDateTime.now(clock))
                .build();
        try {
            reconciliationLogJpaRepository.save(entity);
        } catch (Exception e) {
            log.error("Failed to write reconciliation log for trade {}: {}", tradeUuid, e.getMessage(), e);
        }
    }
}
