package com.copytrader.execution;

import com.copytrader.config.ExecutorProperties;
import com.copytrader.domain.enums.AlertSeverity;
import com.copytrader.domain.enums.RpcMode;
import com.copytrader.domain.enums.SignalStrategy;
import com.copytrader.domain.enums.SubmissionPath;
import com.copytrader.domain.model.RpcHealth;
import com.copytrader.domain.model.Signal;
import com.copytrader.event.EventPublisherHelper;
import com.copytrader.event.SafetyEventType;
import com.copytrader.exception.ExecutionException;
import com.copytrader.service.AuditService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes one admitted signal against the transaction network.
 *
 * <p>Per signal:
 * <ol>
 *   <li>In fallback mode, probe the primary endpoint once the recovery interval has passed
 *       since both entering fallback and the last probe. A healthy probe restores primary mode.</li>
 *   <li>Reject AGGRESSIVE signals while in fallback.</li>
 *   <li>Reject amounts outside [minPositionSol, maxPositionSol].</li>
 *   <li>Primary mode: build a tipped transaction and try each bundle relay in order, then
 *       direct submission to the primary endpoint. Fallback mode: untipped, direct to the
 *       fallback endpoint.</li>
 * </ol>
 * Success clears the failure count; every failure increments it, and reaching
 * {@code maxConsecutiveFailures} in primary mode switches to fallback. Returning to primary
 * only happens through the probe, never on a lucky send.
 *
 * <p>Not thread-safe by intent: one consumer thread calls {@link #execute(Signal)} so the
 * failover bookkeeping never races.
 */
public class TransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionExecutor.class);

    public static final String ACTOR_FAILOVER = "SYSTEM_FAILOVER";
    public static final String ACTOR_RECOVERY = "SYSTEM_RECOVERY";

    private final TransactionNetwork primaryNetwork;
    private final TransactionNetwork fallbackNetwork;
    private final List<BundleRelay> relays;
    private final TransactionBuilder transactionBuilder;
    private final TipStrategy tipStrategy;
    private final RpcHealthTracker rpcHealthTracker;
    private final NetworkCallGuard networkCallGuard;
    private final ExecutorProperties properties;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public TransactionExecutor(
            TransactionNetwork primaryNetwork,
            TransactionNetwork fallbackNetwork,
            List<BundleRelay> relays,
            TransactionBuilder transactionBuilder,
            TipStrategy tipStrategy,
            RpcHealthTracker rpcHealthTracker,
            NetworkCallGuard networkCallGuard,
            ExecutorProperties properties,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.primaryNetwork = primaryNetwork;
        this.fallbackNetwork = fallbackNetwork;
        this.relays = List.copyOf(relays);
        this.transactionBuilder = transactionBuilder;
        this.tipStrategy = tipStrategy;
        this.rpcHealthTracker = rpcHealthTracker;
        this.networkCallGuard = networkCallGuard;
        this.properties = properties;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Builds, signs and submits the transaction for {@code signal}.
     *
     * @throws ExecutionException on rejection or when every submission path failed
     */
    public ExecutionResult execute(Signal signal) {
        probePrimaryIfDue();

        RpcMode mode = rpcHealthTracker.getMode();
        long start = System.nanoTime();
        try {
            if (mode == RpcMode.FALLBACK_DIRECT && signal.getStrategy() == SignalStrategy.AGGRESSIVE) {
                throw ExecutionException.strategyDisabled(signal.getStrategy().name());
            }
            checkAmountBounds(signal.getAmount());

            ExecutionResult result = mode == RpcMode.PRIMARY_BUNDLE
                    ? submitViaBundle(signal)
                    : submitDirect(signal, fallbackNetwork, SubmissionPath.DIRECT_FALLBACK);
            result.setLatencyMs((System.nanoTime() - start) / 1_000_000);

            rpcHealthTracker.recordSuccess();
            log.info(
                    "Executed {} {} {} SOL of {}: sig={}, path={}, tip={}, {} ms",
                    signal.getStrategy(),
                    signal.getAction(),
                    signal.getAmount().toPlainString(),
                    signal.getToken(),
                    result.getSignature(),
                    result.getPath(),
                    result.getTipSol(),
                    result.getLatencyMs());
            return result;
        } catch (ExecutionException e) {
            onFailure(signal, e);
            throw e;
        }
    }

    public RpcHealth getRpcHealth() {
        return rpcHealthTracker.snapshot();
    }

    // ==============================
    // SUBMISSION PATHS
    // ==============================

    private ExecutionResult submitViaBundle(Signal signal) {
        BigDecimal proposed = tipStrategy.proposeTip(signal.getStrategy(), signal.getAmount());
        BigDecimal tip = TipClamp.clamp(proposed, signal.getAmount(), properties.getTip());

        String blockhash = networkCallGuard.call(
                primaryNetwork.name() + ".getLatestBlockhash", properties.getRpcTimeout(),
                primaryNetwork::getLatestBlockhash);
        SignedTransaction transaction = networkCallGuard.call(
                "buildTransaction", properties.getBuildTimeout(),
                () -> transactionBuilder.build(signal, tip, blockhash));

        for (BundleRelay relay : relays) {
            try {
                String ack = networkCallGuard.call(
                        relay.name() + ".submit", properties.getRpcTimeout(), () -> relay.submit(transaction));
                log.debug("Relay {} accepted {} ({})", relay.name(), transaction.signature(), ack);
                tipStrategy.recordLanded(signal.getStrategy(), tip);
                return result(signal, transaction.signature(), relay.path(), tip);
            } catch (ExecutionException e) {
                log.warn("Relay {} failed for {}: {}, trying next path", relay.name(), signal.getTradeUuid(),
                        e.getMessage());
            }
        }

        try {
            String signature = networkCallGuard.call(
                    primaryNetwork.name() + ".sendTransaction", properties.getRpcTimeout(),
                    () -> primaryNetwork.sendTransaction(transaction));
            return result(signal, signature, SubmissionPath.DIRECT_PRIMARY, tip);
        } catch (ExecutionException e) {
            throw ExecutionException.submissionFailed(
                    "All submission paths failed, last: " + e.getMessage(), e);
        }
    }

    private ExecutionResult submitDirect(Signal signal, TransactionNetwork network, SubmissionPath path) {
        String blockhash = networkCallGuard.call(
                network.name() + ".getLatestBlockhash", properties.getRpcTimeout(), network::getLatestBlockhash);
        SignedTransaction transaction = networkCallGuard.call(
                "buildTransaction", properties.getBuildTimeout(),
                () -> transactionBuilder.build(signal, BigDecimal.ZERO, blockhash));
        String signature = networkCallGuard.call(
                network.name() + ".sendTransaction", properties.getRpcTimeout(),
                () -> network.sendTransaction(transaction));
        return result(signal, signature, path, BigDecimal.ZERO);
    }

    private ExecutionResult result(Signal signal, String signature, SubmissionPath path, BigDecimal tip) {
        return ExecutionResult.builder()
                .tradeUuid(signal.getTradeUuid())
                .signature(signature)
                .path(path)
                .mode(rpcHealthTracker.getMode())
                .tipSol(tip)
                .build();
    }

    private void checkAmountBounds(BigDecimal amount) {
        if (amount.compareTo(properties.getMinPositionSol()) < 0) {
            throw ExecutionException.amountOutOfBounds(String.format(
                    "Amount %s SOL below minimum %s", amount.toPlainString(), properties.getMinPositionSol()));
        }
        if (amount.compareTo(properties.getMaxPositionSol()) > 0) {
            throw ExecutionException.amountOutOfBounds(String.format(
                    "Amount %s SOL above maximum %s", amount.toPlainString(), properties.getMaxPositionSol()));
        }
    }

    // ==============================
    // FAILOVER
    // ==============================

    private void onFailure(Signal signal, ExecutionException e) {
        log.error("Execution failed for {} [{}]: {}", signal.getTradeUuid(), e.getReasonCode(), e.getMessage());
        Instant now = clock.instant();
        boolean switched = rpcHealthTracker.recordFailure(properties.getMaxConsecutiveFailures(), now);
        if (!switched) {
            return;
        }
        String reason = String.format(
                "%d consecutive RPC failures reached threshold", properties.getMaxConsecutiveFailures());
        log.error("Switching to fallback RPC mode: {}", reason);
        auditService.logConfigChange(
                AuditService.KEY_RPC_MODE,
                RpcMode.PRIMARY_BUNDLE.name(),
                RpcMode.FALLBACK_DIRECT.name(),
                ACTOR_FAILOVER,
                reason);
        eventPublisherHelper.publishSafety(
                this,
                SafetyEventType.RPC_FALLBACK_ENGAGED,
                AlertSeverity.WARNING,
                "RPC failover: switched to direct submission via " + fallbackNetwork.name()
                        + ". Aggressive signals disabled.",
                Map.of("lastError", e.getReasonCode()));
    }

    private void probePrimaryIfDue() {
        Instant now = clock.instant();
        if (!rpcHealthTracker.isProbeDue(now, properties.getRecoveryInterval())) {
            return;
        }
        long start = System.nanoTime();
        boolean healthy;
        try {
            healthy = networkCallGuard.call(
                    primaryNetwork.name() + ".getHealth", properties.getRpcTimeout(), primaryNetwork::isHealthy);
        } catch (ExecutionException e) {
            // a probe that times out or errors counts as unhealthy
            healthy = false;
        }
        long latencyMs = (System.nanoTime() - start) / 1_000_000;

        boolean restored = rpcHealthTracker.recordProbe(now, healthy, latencyMs);
        if (!restored) {
            log.warn("Primary RPC {} still unhealthy ({} ms), staying in fallback", primaryNetwork.name(), latencyMs);
            return;
        }
        log.info("Primary RPC {} healthy ({} ms), restoring bundle submission", primaryNetwork.name(), latencyMs);
        auditService.logConfigChange(
                AuditService.KEY_RPC_MODE,
                RpcMode.FALLBACK_DIRECT.name(),
                RpcMode.PRIMARY_BUNDLE.name(),
                ACTOR_RECOVERY,
                "Primary RPC health probe succeeded");
        eventPublisherHelper.publishSafety(
                this,
                SafetyEventType.RPC_PRIMARY_RESTORED,
                AlertSeverity.INFO,
                "Primary RPC restored, bundle submission resumed",
                Map.of("latencyMs", latencyMs));
    }
}
