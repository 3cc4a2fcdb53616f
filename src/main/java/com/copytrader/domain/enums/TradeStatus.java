package com.copytrader.domain.enums;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle status of a copied trade.
 *
 * <p>The permitted edges are fixed:
 * <pre>
 *   PENDING   -> QUEUED | DEAD_LETTER
 *   QUEUED    -> EXECUTING | DEAD_LETTER
 *   EXECUTING -> ACTIVE | FAILED | DEAD_LETTER
 *   ACTIVE    -> EXITING
 *   EXITING   -> CLOSED | ACTIVE
 *   FAILED    -> RETRY
 *   RETRY     -> EXECUTING | DEAD_LETTER
 * </pre>
 * CLOSED and DEAD_LETTER are terminal. Self-transitions are never permitted.
 */
public enum TradeStatus {
    /** Record created, not yet in the priority queue. */
    PENDING,
    /** Waiting in a priority lane. */
    QUEUED,
    /** Handed to the executor, transaction being built or submitted. */
    EXECUTING,
    /** Transaction submitted, position open. */
    ACTIVE,
    /** Exit transaction in flight. */
    EXITING,
    /** Position closed, PnL realized. */
    CLOSED,
    /** Execution failed with a retryable error. */
    FAILED,
    /** Re-queued for another execution attempt. */
    RETRY,
    /** Permanently rejected, kept for inspection. */
    DEAD_LETTER;

    private static final Map<TradeStatus, Set<TradeStatus>> EDGES = new EnumMap<>(TradeStatus.class);

    static {
        EDGES.put(PENDING, EnumSet.of(QUEUED, DEAD_LETTER));
        EDGES.put(QUEUED, EnumSet.of(EXECUTING, DEAD_LETTER));
        EDGES.put(EXECUTING, EnumSet.of(ACTIVE, FAILED, DEAD_LETTER));
        EDGES.put(ACTIVE, EnumSet.of(EXITING));
        EDGES.put(EXITING, EnumSet.of(CLOSED, ACTIVE));
        EDGES.put(CLOSED, EnumSet.noneOf(TradeStatus.class));
        EDGES.put(FAILED, EnumSet.of(RETRY));
        EDGES.put(RETRY, EnumSet.of(EXECUTING, DEAD_LETTER));
        EDGES.put(DEAD_LETTER, EnumSet.noneOf(TradeStatus.class));
    }

    public boolean canTransitionTo(TradeStatus target) {
        return target != null && EDGES.get(this).contains(target);
    }

    public Set<TradeStatus> allowedTargets() {
        return Collections.unmodifiableSet(EDGES.get(this));
    }

    public boolean isTerminal() {
        return this == CLOSED || this == DEAD_LETTER;
    }

    /** Whether the trade currently holds an open on-chain position. */
    public boolean isOpenPosition() {
        return this == ACTIVE || this == EXITING;
    }
}
