package com.copytrader.execution;

import com.copytrader.config.ExecutorProperties;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Bounds a proposed tip: {@code max(floor, min(proposed, amount * percentMax, ceiling))}.
 * The floor wins over the percent cap for very small trades.
 */
public final class TipClamp {

    /** Lamport precision. */
    static final int SOL_SCALE = 9;

    private TipClamp() {}

    public static BigDecimal clamp(BigDecimal proposed, BigDecimal amountSol, ExecutorProperties.Tip limits) {
        BigDecimal tip = proposed != null && proposed.signum() > 0 ? proposed : limits.getFloorSol();
        BigDecimal percentCap = amountSol.multiply(limits.getPercentMax());
        tip = tip.min(percentCap).min(limits.getCeilingSol());
        tip = tip.max(limits.getFloorSol());
        return tip.setScale(SOL_SCALE, RoundingMode.DOWN);
    }
}
