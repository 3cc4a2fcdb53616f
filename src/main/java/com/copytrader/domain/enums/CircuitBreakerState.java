package com.copytrader.domain.enums;

/**
 * Lifecycle of the trading circuit breaker: ACTIVE -> TRIPPED -> COOLDOWN -> ACTIVE.
 */
public enum CircuitBreakerState {
    ACTIVE,
    TRIPPED,
    COOLDOWN
}
