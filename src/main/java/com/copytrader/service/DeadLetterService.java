package com.copytrader.service;

import com.copytrader.domain.model.Signal;
import com.copytrader.entity.DeadLetterEntity;
import com.copytrader.lifecycle.TradeLifecycleService;
import com.copytrader.mapper.JsonHelper;
import com.copytrader.repository.jpa.DeadLetterJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Persists signals that were admitted but will never execute, keyed by trade UUID.
 *
 * <p>Reason codes match the rejection's {@code ErrorCode} (QUEUE_FULL, LOAD_SHED,
 * TRADING_HALTED, STRATEGY_DISABLED, AMOUNT_OUT_OF_BOUNDS) or RETRIES_EXHAUSTED.
 */
@Service
public class DeadLetterService {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterService.class);

    public static final String RETRIES_EXHAUSTED = "RETRIES_EXHAUSTED";

    /** Length of the {@code error_details} column. */
    static final int MAX_ERROR_DETAILS_LENGTH = 2000;

    private final DeadLetterJpaRepository deadLetterJpaRepository;
    private final Clock clock;

    public DeadLetterService(DeadLetterJpaRepository deadLetterJpaRepository, Clock clock) {
        this.deadLetterJpaRepository = deadLetterJpaRepository;
        this.clock = clock;
    }

    public boolean exists(String tradeUuid) {
        return deadLetterJpaRepository.existsByTradeUuid(tradeUuid);
    }

    /**
     * Stores the signal payload with its rejection reason. A second record for the same
     * trade is skipped. Storage failures are logged, not thrown.
     */
    public void record(Signal signal, String reason, String errorDetails, int retryCount, boolean canRetry) {
        if (deadLetterJpaRepository.existsByTradeUuid(signal.getTradeUuid())) {
            log.debug("Dead letter for {} already recorded", signal.getTradeUuid());
            return;
        }
        DeadLetterEntity entity = DeadLetterEntity.builder()
                .tradeUuid(signal.getTradeUuid())
                .payload(JsonHelper.toJson(signal))
                .reason(reason)
                .errorDetails(TradeLifecycleService.clip(errorDetails, MAX_ERROR_DETAILS_LENGTH))
                .retryCount(retryCount)
                .canRetry(canRetry)
                .createdAt(LocalDateTime.now(clock))
                .build();
        try {
            deadLetterJpaRepository.save(entity);
            log.warn("Signal {} dead-lettered: {} ({})", signal.getTradeUuid(), reason, errorDetails);
        } catch (Exception e) {
            log.error("Failed to store dead letter for {}: {}", signal.getTradeUuid(), e.getMessage(), e);
        }
    }
}
