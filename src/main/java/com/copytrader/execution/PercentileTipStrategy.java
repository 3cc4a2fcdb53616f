package com.copytrader.execution;

import com.copytrader.config.ExecutorProperties;
import com.copytrader.domain.enums.SignalStrategy;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Default tip strategy: percentile of recently landed tips.
 *
 * <p>Until {@link #MIN_SAMPLES} tips have landed it uses a cold-start schedule
 * (floor x2, aggressive x1.5, exits pay the ceiling). After that, conservative entries
 * pay the 25th percentile, aggressive entries the configured percentile, exits the 75th.
 * Entries never go below the floor; exits never go below the midpoint of floor and ceiling.
 */
@Component
public class PercentileTipStrategy implements TipStrategy {

    public static final int MIN_SAMPLES = 10;
    private static final BigDecimal COLD_START_MULTIPLIER = BigDecimal.valueOf(2);
    private static final BigDecimal AGGRESSIVE_MULTIPLIER = new BigDecimal("1.5");

    private final ExecutorProperties.Tip limits;
    private final Deque<BigDecimal> history = new ArrayDeque<>();

    public PercentileTipStrategy(ExecutorProperties executorProperties) {
        this.limits = executorProperties.getTip();
    }

    @Override
    public synchronized BigDecimal proposeTip(SignalStrategy strategy, BigDecimal amountSol) {
        if (history.size() < MIN_SAMPLES) {
            return coldStart(strategy);
        }
        int percentile = switch (strategy) {
            case CONSERVATIVE -> 25;
            case AGGRESSIVE -> limits.getAggressivePercentile();
            case EXIT -> 75;
        };
        List<BigDecimal> sorted = new ArrayList<>(history);
        Collections.sort(sorted);
        BigDecimal tip = percentile(sorted, percentile);
        BigDecimal minimum = strategy == SignalStrategy.EXIT
                ? limits.getFloorSol().add(limits.getCeilingSol()).divide(BigDecimal.valueOf(2))
                : limits.getFloorSol();
        return tip.max(minimum);
    }

    @Override
    public synchronized void recordLanded(SignalStrategy strategy, BigDecimal tipSol) {
        history.addLast(tipSol);
        while (history.size() > limits.getHistorySize()) {
            history.removeFirst();
        }
    }

    public synchronized int sampleCount() {
        return history.size();
    }

    private BigDecimal coldStart(SignalStrategy strategy) {
        BigDecimal base = limits.getFloorSol().multiply(COLD_START_MULTIPLIER);
        return switch (strategy) {
            case CONSERVATIVE -> base;
            case AGGRESSIVE -> base.multiply(AGGRESSIVE_MULTIPLIER);
            case EXIT -> limits.getCeilingSol();
        };
    }

    /** Nearest-rank below: index {@code n * p / 100}, capped at the last element. */
    private static BigDecimal percentile(List<BigDecimal> sorted, int percentile) {
        int index = Math.min(sorted.size() * percentile / 100, sorted.size() - 1);
        return sorted.get(index);
    }
}
