package com.copytrader.event;

/**
 * Classifies changes of the operator's safety controls published as {@link SafetyEvent}.
 */
public enum SafetyEventType {

    /** Aggregate losses crossed a threshold, or an admin force-tripped the breaker. Trading halted. */
    CIRCUIT_BREAKER_TRIPPED,

    /** Tripped breaker moved into its cooldown window. Trading still halted. */
    CIRCUIT_BREAKER_COOLDOWN,

    /** Breaker back to ACTIVE after cooldown or admin reset. */
    CIRCUIT_BREAKER_RESUMED,

    /** Consecutive submission failures switched the executor to the fallback RPC. */
    RPC_FALLBACK_ENGAGED,

    /** Primary RPC probe succeeded and the executor returned to bundle submission. */
    RPC_PRIMARY_RESTORED
}
