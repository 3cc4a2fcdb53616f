package com.copytrader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Priority queue sizing.
 *
 * <pre>
 * copytrader.queue.capacity=1000
 * copytrader.queue.load-shed-threshold-percent=80
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "copytrader.queue")
public class QueueProperties {

    private int capacity = 1000;
    private int loadShedThresholdPercent = 80;
}
