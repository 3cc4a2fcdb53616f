package com.copytrader.domain.enums;

/**
 * Route a transaction actually took to the network.
 */
public enum SubmissionPath {
    BUNDLE_RELAY,
    SECONDARY_RELAY,
    DIRECT_PRIMARY,
    DIRECT_FALLBACK
}
