package com.copytrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    DUPLICATE_SIGNAL("DUPLICATE_SIGNAL", 409),
    INVALID_STATE_TRANSITION("INVALID_STATE_TRANSITION", 409),
    STRATEGY_DISABLED("STRATEGY_DISABLED", 422),
    AMOUNT_OUT_OF_BOUNDS("AMOUNT_OUT_OF_BOUNDS", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    RPC_UNAVAILABLE("RPC_UNAVAILABLE", 502),
    SUBMISSION_FAILED("SUBMISSION_FAILED", 502),
    QUEUE_FULL("QUEUE_FULL", 503),
    LOAD_SHED("LOAD_SHED", 503),
    TRADING_HALTED("TRADING_HALTED", 503),
    EXECUTION_TIMEOUT("EXECUTION_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
