package com.copytrader.lifecycle;

import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.exception.InvalidStateTransitionException;

/**
 * Pure validator for trade status transitions. No I/O.
 */
public final class TradeStateMachine {

    private TradeStateMachine() {}

    public static boolean canTransition(TradeStatus from, TradeStatus to) {
        return from != null && from.canTransitionTo(to);
    }

    /**
     * Checks the edge and that the context carries what the target status needs.
     *
     * @throws InvalidStateTransitionException naming the pair when the edge does not exist
     *     or required context is missing
     */
    public static void validate(TradeStatus from, TradeStatus to, TransitionContext context) {
        if (!canTransition(from, to)) {
            throw new InvalidStateTransitionException(from, to);
        }
        if (from == TradeStatus.EXECUTING && to == TradeStatus.ACTIVE && isBlank(context.getTxSignature())) {
            throw new InvalidStateTransitionException(from, to, "txSignature");
        }
        if (to == TradeStatus.EXITING && isBlank(context.getExitTxSignature())) {
            throw new InvalidStateTransitionException(from, to, "exitTxSignature");
        }
        if ((to == TradeStatus.FAILED || to == TradeStatus.DEAD_LETTER) && isBlank(context.getErrorMessage())) {
            throw new InvalidStateTransitionException(from, to, "errorMessage");
        }
        if (to == TradeStatus.RETRY && !context.isIncrementRetry()) {
            throw new InvalidStateTransitionException(from, to, "incrementRetry");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
