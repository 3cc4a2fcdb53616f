package com.copytrader.risk;

import java.math.BigDecimal;

/**
 * Read-only aggregates the circuit breaker evaluates. Implementations do all the
 * aggregation; the breaker only compares.
 */
public interface TradingMetricsProvider {

    /** Realized USD P&L of trades closed in the trailing 24 hours. Negative means loss. */
    BigDecimal realizedPnl24hUsd();

    /** Length of the losing streak counted from the most recent closed trade. */
    int consecutiveLosses();

    /** Decline of cumulative realized P&L from its highest peak, in percent. Never negative. */
    BigDecimal maxDrawdownPercent();
}
