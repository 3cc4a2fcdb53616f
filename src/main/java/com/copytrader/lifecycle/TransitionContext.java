package com.copytrader.lifecycle;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Data written together with a status change. A transition and its context land
 * in the same update or not at all.
 */
@Getter
@Builder
public class TransitionContext {

    private static final TransitionContext NONE = TransitionContext.builder().build();

    private final String txSignature;
    private final String exitTxSignature;
    private final boolean clearExitSignature;
    private final String errorMessage;
    private final BigDecimal pnlSol;
    private final BigDecimal pnlUsd;
    private final boolean incrementRetry;

    public static TransitionContext none() {
        return NONE;
    }

    public static TransitionContext submitted(String txSignature) {
        return TransitionContext.builder().txSignature(txSignature).build();
    }

    public static TransitionContext exiting(String exitTxSignature) {
        return TransitionContext.builder().exitTxSignature(exitTxSignature).build();
    }

    public static TransitionContext error(String errorMessage) {
        return TransitionContext.builder().errorMessage(errorMessage).build();
    }

    public static TransitionContext retry() {
        return TransitionContext.builder().incrementRetry(true).build();
    }

    public static TransitionContext closed(BigDecimal pnlSol, BigDecimal pnlUsd) {
        return TransitionContext.builder().pnlSol(pnlSol).pnlUsd(pnlUsd).build();
    }

    public static TransitionContext reverted() {
        return TransitionContext.builder().clearExitSignature(true).build();
    }
}
