package com.copytrader.exception;

import com.copytrader.domain.enums.CircuitBreakerState;
import java.util.Map;

/** Admin action not valid for the breaker's current state. */
public class CircuitBreakerStateException extends BaseException {

    public CircuitBreakerStateException(CircuitBreakerState current, CircuitBreakerState requested) {
        super(
                ErrorCode.INVALID_STATE_TRANSITION,
                String.format("Circuit breaker cannot move %s -> %s", current, requested),
                Map.of("from", current.name(), "to", requested.name()));
    }
}
