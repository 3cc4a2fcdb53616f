package com.copytrader.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "copytrader.recovery")
public class RecoveryProperties {

    private Duration interval = Duration.ofSeconds(30);
    private Duration stuckThreshold = Duration.ofSeconds(60);
    private Duration lookupTimeout = Duration.ofMillis(5000);

    private int maxRetryAttempts = 3;
    private Duration retryInterval = Duration.ofSeconds(30);
}
