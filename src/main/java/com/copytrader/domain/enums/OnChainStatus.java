package com.copytrader.domain.enums;

/**
 * Ground truth of a transaction signature as reported by the network.
 */
public enum OnChainStatus {
    /** Landed and succeeded. */
    CONFIRMED,
    /** Never landed, expired, or landed with an error. */
    NOT_FOUND,
    /** The network could not answer. Never coerced to either outcome. */
    INDETERMINATE
}
