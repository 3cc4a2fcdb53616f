package com.copytrader.risk;

import com.copytrader.domain.enums.CircuitBreakerState;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Read-only view of the circuit breaker for the admin API.
 */
@Data
@Builder
public class CircuitBreakerStatus {

    private CircuitBreakerState state;
    private boolean tradingAllowed;
    private String tripReasonCode;
    private String tripReason;
    private Map<String, Object> tripReasonDetails;
    private Instant trippedAt;
    private Instant lastCheck;

    /** Seconds until cooldown ends; null unless the breaker is in COOLDOWN. */
    private Long cooldownRemainingSeconds;
}
