package com.copytrader.domain.enums;

/**
 * Severity of an operator alert.
 *
 * <p>Ordinal ordering is used by the Telegram notifier's backlog so CRITICAL
 * messages go out first when rate-limited.
 */
public enum AlertSeverity {

    /** Trading halted or degraded; someone should look now. */
    CRITICAL,

    /** Automatic mitigation applied. */
    WARNING,

    INFO
}
