package com.copytrader.risk;

import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/**
 * Computes breaker metrics from closed trades in the trades table.
 */
@Component
public class JpaTradingMetricsProvider implements TradingMetricsProvider {

    static final int STREAK_WINDOW = 20;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TradeJpaRepository tradeJpaRepository;
    private final Clock clock;

    public JpaTradingMetricsProvider(TradeJpaRepository tradeJpaRepository, Clock clock) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.clock = clock;
    }

    @Override
    public BigDecimal realizedPnl24hUsd() {
        LocalDateTime since = LocalDateTime.now(clock).minus(Duration.ofHours(24));
        BigDecimal sum = tradeJpaRepository.sumPnlUsdByStatusSince(TradeStatus.CLOSED, since);
        return sum != null ? sum : BigDecimal.ZERO;
    }

    @Override
    public int consecutiveLosses() {
        List<BigDecimal> recent = tradeJpaRepository.findPnlUsdByStatusMostRecentFirst(
                TradeStatus.CLOSED, PageRequest.of(0, STREAK_WINDOW));
        return countLosingStreak(recent);
    }

    @Override
    public BigDecimal maxDrawdownPercent() {
        return drawdownFromPeak(tradeJpaRepository.findPnlUsdByStatusInCloseOrder(TradeStatus.CLOSED));
    }

    /** Losses counted from the head of the list until the first non-loss. A null P&L ends the streak. */
    public static int countLosingStreak(List<BigDecimal> pnlMostRecentFirst) {
        int streak = 0;
        for (BigDecimal pnl : pnlMostRecentFirst) {
            if (pnl == null || pnl.signum() >= 0) {
                break;
            }
            streak++;
        }
        return streak;
    }

    /**
     * Drawdown of the final cumulative P&L from the running peak:
     * {@code (peak - current) / peak * 100}, or 0 when the peak is not positive.
     */
    public static BigDecimal drawdownFromPeak(List<BigDecimal> pnlInCloseOrder) {
        BigDecimal cumulative = BigDecimal.ZERO;
        BigDecimal peak = BigDecimal.ZERO;
        for (BigDecimal pnl : pnlInCloseOrder) {
            cumulative = cumulative.add(pnl);
            if (cumulative.compareTo(peak) > 0) {
                peak = cumulative;
            }
        }
        if (peak.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal drawdown = peak.subtract(cumulative).divide(peak, MathContext.DECIMAL64).multiply(HUNDRED);
        return drawdown.max(BigDecimal.ZERO);
    }
}
