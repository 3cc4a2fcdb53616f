package com.copytrader.api.dto.response;

import com.copytrader.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Envelope for rejections. {@code error.code} is the machine-readable reason; signal
 * senders key their handling on it. {@code error.retryable} tells a sender whether the
 * same request may succeed later (queue pressure, halted trading, network trouble).
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorBody error;

    private ApiErrorResponse(ErrorBody error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(ErrorBody.builder()
                .code(errorCode.getCode())
                .message(message)
                .retryable(errorCode.getHttpStatus() >= 502)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build());
    }

    @Getter
    @Builder
    public static class ErrorBody {
        private final String code;
        private final String message;
        private final boolean retryable;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
