package com.copytrader.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thresholds for the trading circuit breaker.
 *
 * <p>Each threshold trips on {@code >=}: a 24h loss of exactly {@code maxLoss24hUsd} halts trading.
 */
@Data
@Component
@ConfigurationProperties(prefix = "copytrader.circuit-breaker")
public class CircuitBreakerProperties {

    private BigDecimal maxLoss24hUsd = new BigDecimal("500");
    private int maxConsecutiveLosses = 5;
    private BigDecimal maxDrawdownPercent = new BigDecimal("15");
    private Duration cooldown = Duration.ofMinutes(30);
    private Duration checkInterval = Duration.ofSeconds(30);

    /** Move an automatic trip into COOLDOWN on the following tick. Manual trips are never auto-cooled. */
    private boolean autoCooldown = true;
}
