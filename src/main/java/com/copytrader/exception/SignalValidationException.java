package com.copytrader.exception;

import java.util.Map;

public class SignalValidationException extends BaseException {

    public SignalValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
