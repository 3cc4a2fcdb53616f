package com.copytrader.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Priority class of an inbound signal.
 *
 * <p>Signals are dequeued by priority level (lower number = higher priority), FIFO
 * within a level. Exits always drain first so an open position is never stuck behind
 * new entries.
 */
@Getter
@RequiredArgsConstructor
public enum SignalStrategy {
    EXIT(0, "Exit of an open position"),
    CONSERVATIVE(1, "Conservative copy entry"),
    AGGRESSIVE(2, "Aggressive copy entry, bundle path only");

    private final int priority;
    private final String description;
}
