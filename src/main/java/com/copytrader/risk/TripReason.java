package com.copytrader.risk;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Why the circuit breaker tripped. One record per cause, each carrying the observed
 * value and the threshold it crossed.
 */
public sealed interface TripReason
        permits TripReason.MaxLoss24h, TripReason.ConsecutiveLosses, TripReason.MaxDrawdown, TripReason.Manual {

    /** Stable machine-readable code. */
    String code();

    /** Operator-facing description. */
    String describe();

    /** Structured payload for API responses and alerts. */
    Map<String, Object> details();

    /** Realized loss over the trailing 24 hours, both as positive USD amounts. */
    record MaxLoss24h(BigDecimal loss, BigDecimal threshold) implements TripReason {

        @Override
        public String code() {
            return "MAX_LOSS_24H";
        }

        @Override
        public String describe() {
            return String.format("24h loss $%s exceeded threshold $%s", usd(loss), usd(threshold));
        }

        @Override
        public Map<String, Object> details() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("loss", loss);
            details.put("threshold", threshold);
            return details;
        }
    }

    record ConsecutiveLosses(int count, int threshold) implements TripReason {

        @Override
        public String code() {
            return "CONSECUTIVE_LOSSES";
        }

        @Override
        public String describe() {
            return String.format("%d consecutive losses exceeded threshold %d", count, threshold);
        }

        @Override
        public Map<String, Object> details() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("count", count);
            details.put("threshold", threshold);
            return details;
        }
    }

    /** Decline from the equity peak, in percent. */
    record MaxDrawdown(BigDecimal drawdown, BigDecimal threshold) implements TripReason {

        @Override
        public String code() {
            return "MAX_DRAWDOWN";
        }

        @Override
        public String describe() {
            return String.format(
                    "Drawdown %s%% exceeded threshold %s%%",
                    drawdown.setScale(1, RoundingMode.HALF_UP).toPlainString(),
                    threshold.setScale(1, RoundingMode.HALF_UP).toPlainString());
        }

        @Override
        public Map<String, Object> details() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("drawdown", drawdown);
            details.put("threshold", threshold);
            return details;
        }
    }

    record Manual(String reason) implements TripReason {

        @Override
        public String code() {
            return "MANUAL";
        }

        @Override
        public String describe() {
            return "Manual trip: " + reason;
        }

        @Override
        public Map<String, Object> details() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", reason);
            return details;
        }
    }

    private static String usd(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
