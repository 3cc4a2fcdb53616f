package com.copytrader.execution;

import com.copytrader.domain.enums.SignalStrategy;
import java.math.BigDecimal;

/**
 * Proposes the relay tip for a bundle submission.
 *
 * <p>Output is treated as untrusted: the executor always re-clamps it with {@link TipClamp}.
 */
@FunctionalInterface
public interface TipStrategy {

    /**
     * @param strategy  priority class of the signal
     * @param amountSol trade size in SOL
     * @return proposed tip in SOL
     */
    BigDecimal proposeTip(SignalStrategy strategy, BigDecimal amountSol);

    /** Feedback after a tipped submission was accepted. Optional. */
    default void recordLanded(SignalStrategy strategy, BigDecimal tipSol) {}
}
