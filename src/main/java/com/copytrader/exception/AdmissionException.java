package com.copytrader.exception;

import java.util.Map;

/**
 * Synchronous rejection at queue admission. Never retried internally.
 */
public abstract class AdmissionException extends BaseException {

    protected AdmissionException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
