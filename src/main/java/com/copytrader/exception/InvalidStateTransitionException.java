package com.copytrader.exception;

import com.copytrader.domain.enums.TradeStatus;
import java.util.Map;
import lombok.Getter;

@Getter
public class InvalidStateTransitionException extends BaseException {

    private final TradeStatus from;
    private final TradeStatus to;

    public InvalidStateTransitionException(TradeStatus from, TradeStatus to) {
        super(
                ErrorCode.INVALID_STATE_TRANSITION,
                String.format("Invalid state transition: %s -> %s", from, to),
                Map.of("from", String.valueOf(from), "to", String.valueOf(to)));
        this.from = from;
        this.to = to;
    }

    public InvalidStateTransitionException(TradeStatus from, TradeStatus to, String missing) {
        super(
                ErrorCode.INVALID_STATE_TRANSITION,
                String.format("Transition %s -> %s requires %s", from, to, missing),
                Map.of("from", String.valueOf(from), "to", String.valueOf(to), "missing", missing));
        this.from = from;
        this.to = to;
    }
}
