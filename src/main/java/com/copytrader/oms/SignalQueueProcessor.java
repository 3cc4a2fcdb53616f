package com.copytrader.oms;

import com.copytrader.config.RecoveryProperties;
import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.Signal;
import com.copytrader.domain.model.Trade;
import com.copytrader.exception.ErrorCode;
import com.copytrader.exception.ExecutionException;
import com.copytrader.execution.ExecutionResult;
import com.copytrader.execution.TransactionExecutor;
import com.copytrader.lifecycle.TradeLifecycleService;
import com.copytrader.lifecycle.TransitionContext;
import com.copytrader.mapper.TradeMapper;
import com.copytrader.observability.CustomMetricsService;
import com.copytrader.risk.CircuitBreakerService;
import com.copytrader.risk.CircuitBreakerStatus;
import com.copytrader.service.DeadLetterService;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Single consumer of the {@link SignalQueue}.
 *
 * <p>One daemon thread blocks on {@code take()} and runs each signal to completion before
 * taking the next, so the executor's failover bookkeeping is only touched from here.
 * On stop the thread is interrupted and whatever is still queued stays QUEUED in storage;
 * the next start puts QUEUED and RETRY trades back into their lanes.
 */
@Component
public class SignalQueueProcessor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SignalQueueProcessor.class);

    private final SignalQueue signalQueue;
    private final TransactionExecutor transactionExecutor;
    private final TradeLifecycleService tradeLifecycleService;
    private final CircuitBreakerService circuitBreakerService;
    private final DeadLetterService deadLetterService;
    private final CustomMetricsService customMetricsService;
    private final RecoveryProperties recoveryProperties;
    private final TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private Thread consumerThread;

    public SignalQueueProcessor(
            SignalQueue signalQueue,
            TransactionExecutor transactionExecutor,
            TradeLifecycleService tradeLifecycleService,
            CircuitBreakerService circuitBreakerService,
            DeadLetterService deadLetterService,
            CustomMetricsService customMetricsService,
            RecoveryProperties recoveryProperties) {
        this.signalQueue = signalQueue;
        this.transactionExecutor = transactionExecutor;
        this.tradeLifecycleService = tradeLifecycleService;
        this.circuitBreakerService = circuitBreakerService;
        this.deadLetterService = deadLetterService;
        this.customMetricsService = customMetricsService;
        this.recoveryProperties = recoveryProperties;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            requeuePersisted();
            consumerThread = new Thread(this::processLoop, "signal-queue-processor");
            consumerThread.setDaemon(true);
            consumerThread.start();
            log.info("SignalQueueProcessor started");
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            if (consumerThread != null) {
                consumerThread.interrupt();
            }
            log.info("SignalQueueProcessor stopping, {} signal(s) left queued", signalQueue.size());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        return 0;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void processLoop() {
        while (running.get()) {
            try {
                Signal signal = signalQueue.take();
                processSignal(signal);
            } catch (InterruptedException e) {
                if (!running.get()) {
                    log.info("SignalQueueProcessor interrupted during shutdown");
                    Thread.currentThread().interrupt();
                    break;
                }
                log.warn("SignalQueueProcessor interrupted unexpectedly, resuming");
            } catch (RuntimeException e) {
                log.error("Unhandled error in signal consumer, continuing", e);
            }
        }
    }

    /**
     * Runs one dequeued signal through the breaker check, the executor and the
     * resulting status changes.
     */
    public void processSignal(Signal signal) {
        String tradeUuid = signal.getTradeUuid();
        Optional<Trade> stored = tradeLifecycleService.find(tradeUuid);
        if (stored.isEmpty()) {
            log.error("Dequeued signal {} has no trade record, dropping", tradeUuid);
            return;
        }
        Trade trade = stored.get();

        if (!circuitBreakerService.isTradingAllowed()) {
            rejectHalted(signal, trade);
            return;
        }

        tradeLifecycleService.transition(tradeUuid, TradeStatus.EXECUTING, TransitionContext.none());
        ExecutionResult result;
        try {
            result = transactionExecutor.execute(signal);
        } catch (ExecutionException e) {
            customMetricsService.recordExecution(false);
            onExecutionFailure(signal, trade, e);
            return;
        }

        customMetricsService.recordExecution(true);
        String signature = result.getSignature();
        tradeLifecycleService.transition(tradeUuid, TradeStatus.ACTIVE, TransitionContext.submitted(signature));
        if (signal.isSell()) {
            tradeLifecycleService.transition(tradeUuid, TradeStatus.EXITING, TransitionContext.exiting(signature));
            markPositionsExiting(signal, signature);
        }
    }

    private void rejectHalted(Signal signal, Trade trade) {
        CircuitBreakerStatus status = circuitBreakerService.getStatus();
        String message = "Trading halted: "
                + (status.getTripReason() != null ? status.getTripReason() : status.getState().name());
        log.warn("Dropping {} while circuit breaker is {}", signal.getTradeUuid(), status.getState());
        deadLetterService.record(
                signal, ErrorCode.TRADING_HALTED.getCode(), message, trade.getRetryCount(), true);
        tradeLifecycleService.transition(
                signal.getTradeUuid(), TradeStatus.DEAD_LETTER, TransitionContext.error(message));
    }

    private void onExecutionFailure(Signal signal, Trade trade, ExecutionException e) {
        String tradeUuid = signal.getTradeUuid();
        if (!e.isRetryable()) {
            deadLetterService.record(signal, e.getReasonCode(), e.getMessage(), trade.getRetryCount(), false);
            tradeLifecycleService.transition(tradeUuid, TradeStatus.DEAD_LETTER, TransitionContext.error(e.getMessage()));
            return;
        }
        if (trade.getRetryCount() >= recoveryProperties.getMaxRetryAttempts()) {
            String message = "Retries exhausted after " + trade.getRetryCount() + " attempts: " + e.getMessage();
            deadLetterService.record(
                    signal, DeadLetterService.RETRIES_EXHAUSTED, message, trade.getRetryCount(), false);
            tradeLifecycleService.transition(tradeUuid, TradeStatus.DEAD_LETTER, TransitionContext.error(message));
            return;
        }
        tradeLifecycleService.transition(tradeUuid, TradeStatus.FAILED, TransitionContext.error(e.getMessage()));
    }

    /** A copied sell closes out the operator's open buys of the same wallet and token. */
    private void markPositionsExiting(Signal sell, String exitSignature) {
        List<Trade> openBuys = tradeLifecycleService.findOpenBuys(sell.getWalletAddress(), sell.getToken());
        for (Trade buy : openBuys) {
            try {
                tradeLifecycleService.transition(
                        buy.getTradeUuid(), TradeStatus.EXITING, TransitionContext.exiting(exitSignature));
            } catch (RuntimeException e) {
                log.error("Failed to mark position {} exiting: {}", buy.getTradeUuid(), e.getMessage());
            }
        }
        if (!openBuys.isEmpty()) {
            log.info("Sell {} moved {} open position(s) to EXITING", sell.getTradeUuid(), openBuys.size());
        }
    }

    private void requeuePersisted() {
        int requeued = 0;
        for (TradeStatus status : List.of(TradeStatus.QUEUED, TradeStatus.RETRY)) {
            for (Trade trade : tradeLifecycleService.findByStatus(status)) {
                try {
                    signalQueue.push(tradeMapper.toSignal(trade));
                    requeued++;
                } catch (RuntimeException e) {
                    log.warn("Could not requeue {} trade {}: {}", status, trade.getTradeUuid(), e.getMessage());
                }
            }
        }
        if (requeued > 0) {
            log.info("Requeued {} persisted signal(s) on startup", requeued);
        }
    }
}
