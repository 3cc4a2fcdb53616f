package com.copytrader.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Raised for every admission or execution attempt while the circuit breaker is not ACTIVE.
 */
public class TradingHaltedException extends BaseException {

    public TradingHaltedException(String state, String reason) {
        super(ErrorCode.TRADING_HALTED, "Trading halted: " + (reason != null ? reason : state), details(state, reason));
    }

    private static Map<String, Object> details(String state, String reason) {
        Map<String, Object> details = new HashMap<>();
        details.put("state", state);
        if (reason != null) {
            details.put("reason", reason);
        }
        return details;
    }
}
