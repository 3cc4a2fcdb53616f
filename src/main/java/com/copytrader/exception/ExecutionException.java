package com.copytrader.exception;

import lombok.Getter;

/**
 * Per-signal execution failure. Retryable failures leave the trade FAILED for the
 * retry pass; the rest dead-letter it.
 */
@Getter
public class ExecutionException extends BaseException {

    private final boolean retryable;

    public ExecutionException(ErrorCode errorCode, String message, boolean retryable) {
        super(errorCode, message);
        this.retryable = retryable;
    }

    public ExecutionException(ErrorCode errorCode, String message, boolean retryable, Throwable cause) {
        super(errorCode, message, cause);
        this.retryable = retryable;
    }

    public static ExecutionException strategyDisabled(String strategy) {
        return new ExecutionException(
                ErrorCode.STRATEGY_DISABLED, strategy + " signals are disabled in fallback RPC mode", false);
    }

    public static ExecutionException amountOutOfBounds(String message) {
        return new ExecutionException(ErrorCode.AMOUNT_OUT_OF_BOUNDS, message, false);
    }

    public static ExecutionException rpcUnavailable(String message, Throwable cause) {
        return new ExecutionException(ErrorCode.RPC_UNAVAILABLE, message, true, cause);
    }

    public static ExecutionException submissionFailed(String message, Throwable cause) {
        return new ExecutionException(ErrorCode.SUBMISSION_FAILED, message, true, cause);
    }

    public static ExecutionException timeout(String operation) {
        return new ExecutionException(ErrorCode.EXECUTION_TIMEOUT, operation + " timed out", true);
    }
}
