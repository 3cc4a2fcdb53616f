package com.copytrader.domain.model;

import com.copytrader.domain.enums.SignalStrategy;
import com.copytrader.domain.enums.TradeAction;
import com.copytrader.domain.enums.TradeStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Durable lifecycle record of one copied trade, keyed by {@code tradeUuid}.
 *
 * <p>{@code tradeUuid} is the idempotency boundary: one record per inbound signal,
 * however many times the signal is delivered.
 */
@Data
@Builder
public class Trade {

    private String tradeUuid;
    private String walletAddress;
    private String token;
    private String tokenAddress;
    private SignalStrategy strategy;
    private TradeAction action;
    private BigDecimal amount;
    private TradeStatus status;
    private int retryCount;
    private String txSignature;
    private String exitTxSignature;
    private String errorMessage;

    /** Realized P&L, set only when the trade reaches CLOSED. */
    private BigDecimal pnlSol;

    private BigDecimal pnlUsd;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime closedAt;
}
