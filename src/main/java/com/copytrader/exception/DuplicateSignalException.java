package com.copytrader.exception;

import java.util.Map;

public class DuplicateSignalException extends AdmissionException {

    public DuplicateSignalException(String tradeUuid) {
        super(ErrorCode.DUPLICATE_SIGNAL, "Duplicate signal: " + tradeUuid, Map.of("tradeUuid", tradeUuid));
    }
}
