package com.copytrader.recovery;

import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;

/**
 * Tally of one recovery pass.
 */
@Getter
public class RecoveryResult {

    private final int examined;
    private final Map<RecoveryOutcome, Integer> outcomes = new EnumMap<>(RecoveryOutcome.class);

    public RecoveryResult(int examined) {
        this.examined = examined;
    }

    void add(RecoveryOutcome outcome) {
        outcomes.merge(outcome, 1, Integer::sum);
    }

    public int count(RecoveryOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    @Override
    public String toString() {
        return "examined=" + examined + " " + outcomes;
    }
}
