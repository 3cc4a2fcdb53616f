package com.copytrader.domain.model;

import com.copytrader.domain.enums.RpcMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Snapshot of the executor's RPC bookkeeping. Not persisted.
 */
@Data
@Builder
public class RpcHealth {

    private RpcMode mode;
    private int failureCount;
    private Instant fallbackSince;
    private Instant lastProbeAt;
    private Boolean lastCheckHealthy;
    private Long lastCheckLatencyMs;
}
