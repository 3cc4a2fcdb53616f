package com.copytrader.recovery;

/** What one recovery pass did with a stuck trade. */
public enum RecoveryOutcome {
    CLOSED,
    REVERTED,
    UNRESOLVED,
    SKIPPED,
    ERROR
}
