package com.copytrader.recovery;

import com.copytrader.config.RecoveryProperties;
import com.copytrader.domain.enums.OnChainStatus;
import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.Trade;
import com.copytrader.event.EventPublisherHelper;
import com.copytrader.exception.ExecutionException;
import com.copytrader.execution.NetworkCallGuard;
import com.copytrader.execution.TransactionNetwork;
import com.copytrader.lifecycle.TradeLifecycleService;
import com.copytrader.lifecycle.TransitionContext;
import com.copytrader.observability.CustomMetricsService;
import com.copytrader.service.AuditService;
import com.copytrader.solana.Base58;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Reconciles trades wedged in EXITING against the chain.
 *
 * <p>Each pass selects EXITING trades not updated for {@code stuckThreshold} and looks up
 * their exit signature, or the entry signature when no exit signature was recorded:
 * <ul>
 *   <li>CONFIRMED: EXITING -> CLOSED</li>
 *   <li>NOT_FOUND: EXITING -> ACTIVE with the exit signature cleared, the position is still open</li>
 *   <li>INDETERMINATE, lookup timeout, or an unparseable signature: left as is for the next pass</li>
 * </ul>
 * A confirmed close is priced by the {@link RealizedPnlSource}. Resolutions are written to
 * the reconciliation log and broadcast. A trade that moved
 * on between selection and resolution fails its transition and is skipped.
 */
@Service
public class StuckTradeRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StuckTradeRecoveryService.class);

    static final int SIGNATURE_LENGTH = 64;
    static final String RESOLVED_BY = "SYSTEM_RECOVERY";

    private final TradeLifecycleService tradeLifecycleService;
    private final TransactionNetwork primaryNetwork;
    private final NetworkCallGuard networkCallGuard;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final CustomMetricsService customMetricsService;
    private final RecoveryProperties recoveryProperties;
    private final RealizedPnlSource realizedPnlSource;

    public StuckTradeRecoveryService(
            TradeLifecycleService tradeLifecycleService,
            @Qualifier("primaryNetwork") TransactionNetwork primaryNetwork,
            NetworkCallGuard networkCallGuard,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            CustomMetricsService customMetricsService,
            RecoveryProperties recoveryProperties,
            RealizedPnlSource realizedPnlSource) {
        this.tradeLifecycleService = tradeLifecycleService;
        this.primaryNetwork = primaryNetwork;
        this.networkCallGuard = networkCallGuard;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.customMetricsService = customMetricsService;
        this.recoveryProperties = recoveryProperties;
        this.realizedPnlSource = realizedPnlSource;
    }

    @Scheduled(
            fixedDelayString = "${copytrader.recovery.interval:PT30S}",
            initialDelayString = "${copytrader.recovery.interval:PT30S}")
    public void scheduledRecovery() {
        try {
            RecoveryResult result = recoverStuckTrades();
            if (result.getExamined() > 0) {
                log.info("Recovery pass: {}", result);
            }
        } catch (RuntimeException e) {
            log.error("Recovery pass failed: {}", e.getMessage(), e);
        }
    }

    public RecoveryResult recoverStuckTrades() {
        List<Trade> stuck = tradeLifecycleService.findStuck(TradeStatus.EXITING, recoveryProperties.getStuckThreshold());
        RecoveryResult result = new RecoveryResult(stuck.size());
        for (Trade trade : stuck) {
            RecoveryOutcome outcome;
            try {
                outcome = recover(trade);
            } catch (RuntimeException e) {
                log.error("Recovery of trade {} failed: {}", trade.getTradeUuid(), e.getMessage());
                outcome = RecoveryOutcome.ERROR;
            }
            result.add(outcome);
            customMetricsService.recordRecovery(outcome.name());
        }
        return result;
    }

    RecoveryOutcome recover(Trade trade) {
        String signature = trade.getExitTxSignature() != null ? trade.getExitTxSignature() : trade.getTxSignature();
        if (signature == null || !Base58.isValid(signature, SIGNATURE_LENGTH)) {
            log.warn("Trade {} stuck EXITING with unusable signature '{}', skipping", trade.getTradeUuid(), signature);
            return RecoveryOutcome.SKIPPED;
        }

        OnChainStatus status = lookup(signature);
        switch (status) {
            case CONFIRMED:
                return close(trade, signature);
            case NOT_FOUND:
                return revert(trade, signature);
            default:
                log.info("Trade {} on-chain status indeterminate for {}, retrying next pass",
                        trade.getTradeUuid(), signature);
                return RecoveryOutcome.UNRESOLVED;
        }
    }

    private OnChainStatus lookup(String signature) {
        try {
            return networkCallGuard.call(
                    primaryNetwork.name() + ".getTransaction",
                    recoveryProperties.getLookupTimeout(),
                    () -> primaryNetwork.getTransactionStatus(signature));
        } catch (ExecutionException e) {
            log.warn("Lookup of {} failed: {}", signature, e.getMessage());
            return OnChainStatus.INDETERMINATE;
        }
    }

    private RecoveryOutcome close(Trade trade, String signature) {
        RealizedPnl pnl = realizedPnlSource.realizedPnl(trade, signature).orElse(new RealizedPnl(null, null));
        Trade closed = tradeLifecycleService.transition(
                trade.getTradeUuid(), TradeStatus.CLOSED, TransitionContext.closed(pnl.sol(), pnl.usd()));
        auditService.logReconciliation(
                trade.getTradeUuid(), TradeStatus.EXITING.name(), "FOUND", "NONE", signature, RESOLVED_BY,
                "Exit transaction confirmed on chain");
        eventPublisherHelper.publishTradeUpdate(
                this, closed, TradeStatus.EXITING, "Exit confirmed on chain, position closed");
        return RecoveryOutcome.CLOSED;
    }

    private RecoveryOutcome revert(Trade trade, String signature) {
        Trade reverted = tradeLifecycleService.transition(
                trade.getTradeUuid(), TradeStatus.ACTIVE, TransitionContext.reverted());
        auditService.logReconciliation(
                trade.getTradeUuid(), TradeStatus.EXITING.name(), "MISSING", "MISSING_TX", signature, RESOLVED_BY,
                "Exit transaction not found on chain, position still open");
        auditService.logConfigChange(
                "position:" + trade.getTradeUuid(),
                TradeStatus.EXITING.name(),
                TradeStatus.ACTIVE.name(),
                RESOLVED_BY,
                "Exit transaction " + signature + " never landed");
        eventPublisherHelper.publishTradeUpdate(
                this, reverted, TradeStatus.EXITING, "Exit never landed, position reverted to ACTIVE");
        return RecoveryOutcome.REVERTED;
    }
}
