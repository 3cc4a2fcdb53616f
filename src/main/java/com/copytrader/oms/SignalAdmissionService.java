package com.copytrader.oms;

import com.copytrader.api.dto.request.SignalRequest;
import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.Signal;
import com.copytrader.exception.AdmissionException;
import com.copytrader.exception.BaseException;
import com.copytrader.exception.DuplicateSignalException;
import com.copytrader.lifecycle.TradeLifecycleService;
import com.copytrader.lifecycle.TransitionContext;
import com.copytrader.observability.CustomMetricsService;
import com.copytrader.risk.CircuitBreakerService;
import com.copytrader.service.DeadLetterService;
import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for inbound signals.
 *
 * <p>Admission order: circuit breaker, validation, trade UUID, duplicate check against
 * trades and dead letters, PENDING record, PENDING -> QUEUED, push. A queue rejection
 * dead-letters the already-recorded trade and is rethrown to the caller unchanged.
 * Every rejection is synchronous; nothing here is retried.
 */
@Service
public class SignalAdmissionService {

    private static final Logger log = LoggerFactory.getLogger(SignalAdmissionService.class);

    private final CircuitBreakerService circuitBreakerService;
    private final TradeLifecycleService tradeLifecycleService;
    private final DeadLetterService deadLetterService;
    private final SignalQueue signalQueue;
    private final CustomMetricsService customMetricsService;
    private final Clock clock;

    public SignalAdmissionService(
            CircuitBreakerService circuitBreakerService,
            TradeLifecycleService tradeLifecycleService,
            DeadLetterService deadLetterService,
            SignalQueue signalQueue,
            CustomMetricsService customMetricsService,
            Clock clock) {
        this.circuitBreakerService = circuitBreakerService;
        this.tradeLifecycleService = tradeLifecycleService;
        this.deadLetterService = deadLetterService;
        this.signalQueue = signalQueue;
        this.customMetricsService = customMetricsService;
        this.clock = clock;
    }

    /**
     * Admits one signal.
     *
     * @throws com.copytrader.exception.TradingHaltedException    if the breaker is not ACTIVE
     * @throws com.copytrader.exception.SignalValidationException if a field is invalid
     * @throws DuplicateSignalException                           if the trade UUID was seen before
     * @throws com.copytrader.exception.QueueFullException        at capacity
     * @throws com.copytrader.exception.LoadSheddingException     for AGGRESSIVE signals above the shed threshold
     */
    public AdmissionResult admit(SignalRequest request) {
        try {
            circuitBreakerService.ensureTradingAllowed();
            SignalValidator.validate(request);

            Signal signal = toSignal(request);
            String tradeUuid = signal.getTradeUuid();
            if (tradeLifecycleService.exists(tradeUuid) || deadLetterService.exists(tradeUuid)) {
                throw new DuplicateSignalException(tradeUuid);
            }

            tradeLifecycleService.create(signal);
            tradeLifecycleService.transition(tradeUuid, TradeStatus.QUEUED, TransitionContext.none());
            enqueue(signal);

            customMetricsService.recordAdmitted(signal.getStrategy().name());
            log.info("Signal admitted: tradeUuid={}, {} {} {} SOL of {}", tradeUuid, signal.getStrategy(),
                    signal.getAction(), signal.getAmount().toPlainString(), signal.getToken());
            return AdmissionResult.builder()
                    .tradeUuid(tradeUuid)
                    .status(TradeStatus.QUEUED)
                    .queueDepths(signalQueue.depths())
                    .build();
        } catch (BaseException e) {
            customMetricsService.recordRejected(e.getReasonCode());
            log.warn("Signal rejected [{}]: {}", e.getReasonCode(), e.getMessage());
            throw e;
        }
    }

    private void enqueue(Signal signal) {
        try {
            signalQueue.push(signal);
        } catch (AdmissionException e) {
            deadLetterService.record(signal, e.getReasonCode(), e.getMessage(), 0, true);
            try {
                tradeLifecycleService.transition(
                        signal.getTradeUuid(), TradeStatus.DEAD_LETTER, TransitionContext.error(e.getMessage()));
            } catch (RuntimeException transitionError) {
                log.error("Failed to dead-letter rejected trade {}: {}", signal.getTradeUuid(),
                        transitionError.getMessage(), transitionError);
            }
            throw e;
        }
    }

    private Signal toSignal(SignalRequest request) {
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();
        String tradeUuid = TradeUuidGenerator.generate(
                request.getTradeUuid(),
                timestamp,
                request.getToken(),
                request.getAction(),
                request.getAmount(),
                request.getWalletAddress());
        return Signal.builder()
                .tradeUuid(tradeUuid)
                .strategy(request.getStrategy())
                .action(request.getAction())
                .token(request.getToken())
                .tokenAddress(request.getTokenAddress())
                .amount(request.getAmount())
                .walletAddress(request.getWalletAddress())
                .timestamp(timestamp)
                .build();
    }
}
