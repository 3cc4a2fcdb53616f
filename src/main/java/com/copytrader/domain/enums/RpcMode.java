package com.copytrader.domain.enums;

/**
 * Submission mode of the transaction executor.
 *
 * <p>PRIMARY_BUNDLE routes through the bundle relays with a tip; FALLBACK_DIRECT
 * submits straight to the fallback RPC endpoint and disables aggressive signals.
 */
public enum RpcMode {
    PRIMARY_BUNDLE,
    FALLBACK_DIRECT
}
