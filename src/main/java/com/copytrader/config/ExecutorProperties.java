package com.copytrader.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Position bounds, failover and tip limits for the transaction executor.
 * Amounts are in SOL.
 */
@Data
@Component
@ConfigurationProperties(prefix = "copytrader.executor")
public class ExecutorProperties {

    private BigDecimal minPositionSol = new BigDecimal("0.01");
    private BigDecimal maxPositionSol = new BigDecimal("1.0");

    private int maxConsecutiveFailures = 3;

    /** Minimum time in fallback, and between probes, before the primary endpoint is probed again. */
    private Duration recoveryInterval = Duration.ofSeconds(60);

    /** Upper bound for every single network call made by the executor. */
    private Duration rpcTimeout = Duration.ofMillis(2000);

    /** Quote, swap and signing round trip against the swap aggregator. */
    private Duration buildTimeout = Duration.ofMillis(5000);

    private Tip tip = new Tip();

    @Data
    public static class Tip {
        private BigDecimal floorSol = new BigDecimal("0.001");
        private BigDecimal ceilingSol = new BigDecimal("0.01");
        private BigDecimal percentMax = new BigDecimal("0.10");
        private int aggressivePercentile = 50;
        private int historySize = 100;
    }
}
