package com.copytrader.oms;

import com.copytrader.config.RecoveryProperties;
import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.Signal;
import com.copytrader.domain.model.Trade;
import com.copytrader.exception.AdmissionException;
import com.copytrader.lifecycle.TradeLifecycleService;
import com.copytrader.lifecycle.TransitionContext;
import com.copytrader.mapper.TradeMapper;
import com.copytrader.risk.CircuitBreakerService;
import com.copytrader.service.DeadLetterService;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically re-queues FAILED trades.
 *
 * <p>A trade under the attempt limit goes FAILED -> RETRY with its count bumped and is
 * pushed back into its lane. Retries go to the DEAD_LETTER state when the queue rejects them or
 * when the limit is already reached. While the breaker is halted the pass does nothing, so
 * failed trades wait for trading to resume instead of being dead-lettered by the consumer.
 */
@Service
public class FailedTradeRetryService {

    private static final Logger log = LoggerFactory.getLogger(FailedTradeRetryService.class);

    private final TradeLifecycleService tradeLifecycleService;
    private final SignalQueue signalQueue;
    private final DeadLetterService deadLetterService;
    private final CircuitBreakerService circuitBreakerService;
    private final RecoveryProperties recoveryProperties;
    private final TradeMapper tradeMapper = Mappers.getMapper(TradeMapper.class);

    public FailedTradeRetryService(
            TradeLifecycleService tradeLifecycleService,
            SignalQueue signalQueue,
            DeadLetterService deadLetterService,
            CircuitBreakerService circuitBreakerService,
            RecoveryProperties recoveryProperties) {
        this.tradeLifecycleService = tradeLifecycleService;
        this.signalQueue = signalQueue;
        this.deadLetterService = deadLetterService;
        this.circuitBreakerService = circuitBreakerService;
        this.recoveryProperties = recoveryProperties;
    }

    @Scheduled(
            fixedDelayString = "${copytrader.recovery.retry-interval:PT30S}",
            initialDelayString = "${copytrader.recovery.retry-interval:PT30S}")
    public void retryFailedTrades() {
        if (!circuitBreakerService.isTradingAllowed()) {
            log.debug("Retry pass skipped, trading halted");
            return;
        }
        List<Trade> failed = tradeLifecycleService.findByStatus(TradeStatus.FAILED);
        int requeued = 0;
        for (Trade trade : failed) {
            try {
                if (retry(trade)) {
                    requeued++;
                }
            } catch (RuntimeException e) {
                log.error("Retry of trade {} failed: {}", trade.getTradeUuid(), e.getMessage(), e);
            }
        }
        if (!failed.isEmpty()) {
            log.info("Retry pass: {} failed trade(s), {} requeued", failed.size(), requeued);
        }
    }

    /**
     * @return true if the trade went back into the queue
     */
    boolean retry(Trade trade) {
        String tradeUuid = trade.getTradeUuid();
        Signal signal = tradeMapper.toSignal(trade);
        int maxAttempts = recoveryProperties.getMaxRetryAttempts();

        Trade retrying = tradeLifecycleService.transition(tradeUuid, TradeStatus.RETRY, TransitionContext.retry());

        if (trade.getRetryCount() >= maxAttempts) {
            String message = "Retries exhausted after " + trade.getRetryCount() + " attempts: " + trade.getErrorMessage();
            deadLetterService.record(
                    signal, DeadLetterService.RETRIES_EXHAUSTED, message, retrying.getRetryCount(), false);
            tradeLifecycleService.transition(tradeUuid, TradeStatus.DEAD_LETTER, TransitionContext.error(message));
            return false;
        }

        try {
            signalQueue.push(signal);
            log.info("Trade {} requeued, attempt {}/{}", tradeUuid, retrying.getRetryCount(), maxAttempts);
            return true;
        } catch (AdmissionException e) {
            deadLetterService.record(signal, e.getReasonCode(), e.getMessage(), retrying.getRetryCount(), true);
            tradeLifecycleService.transition(tradeUuid, TradeStatus.DEAD_LETTER, TransitionContext.error(e.getMessage()));
            return false;
        }
    }
}
