package com.copytrader.execution;

import com.copytrader.domain.enums.RpcMode;
import com.copytrader.domain.model.RpcHealth;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Component;

/**
 * RPC mode and failure bookkeeping owned by the transaction executor.
 *
 * <p>Only the single executor thread writes; the status API reads. The read-write lock
 * keeps snapshots consistent across fields.
 */
@Component
public class RpcHealthTracker {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private RpcMode mode = RpcMode.PRIMARY_BUNDLE;
    private int failureCount;
    private Instant fallbackSince;
    private Instant lastProbeAt;
    private Boolean lastCheckHealthy;
    private Long lastCheckLatencyMs;

    public RpcMode getMode() {
        lock.readLock().lock();
        try {
            return mode;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getFailureCount() {
        lock.readLock().lock();
        try {
            return failureCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public RpcHealth snapshot() {
        lock.readLock().lock();
        try {
            return RpcHealth.builder()
                    .mode(mode)
                    .failureCount(failureCount)
                    .fallbackSince(fallbackSince)
                    .lastProbeAt(lastProbeAt)
                    .lastCheckHealthy(lastCheckHealthy)
                    .lastCheckLatencyMs(lastCheckLatencyMs)
                    .build();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void recordSuccess() {
        lock.writeLock().lock();
        try {
            failureCount = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Counts a failed execution. In primary mode, reaching {@code maxConsecutiveFailures}
     * switches to fallback and restarts the count.
     *
     * @return true if this failure switched the mode to fallback
     */
    public boolean recordFailure(int maxConsecutiveFailures, Instant now) {
        lock.writeLock().lock();
        try {
            failureCount++;
            if (mode == RpcMode.PRIMARY_BUNDLE && failureCount >= maxConsecutiveFailures) {
                mode = RpcMode.FALLBACK_DIRECT;
                fallbackSince = now;
                failureCount = 0;
                return true;
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Whether the primary endpoint is due for a health probe: in fallback, and at least
     * {@code interval} since both entering fallback and the previous probe.
     */
    public boolean isProbeDue(Instant now, Duration interval) {
        lock.readLock().lock();
        try {
            if (mode != RpcMode.FALLBACK_DIRECT || fallbackSince == null) {
                return false;
            }
            if (Duration.between(fallbackSince, now).compareTo(interval) < 0) {
                return false;
            }
            return lastProbeAt == null || Duration.between(lastProbeAt, now).compareTo(interval) >= 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records a probe of the primary endpoint. A healthy probe while in fallback restores
     * primary mode and clears the failure bookkeeping.
     *
     * @return true if primary mode was restored
     */
    public boolean recordProbe(Instant now, boolean healthy, long latencyMs) {
        lock.writeLock().lock();
        try {
            lastProbeAt = now;
            lastCheckHealthy = healthy;
            lastCheckLatencyMs = latencyMs;
            if (healthy && mode == RpcMode.FALLBACK_DIRECT) {
                mode = RpcMode.PRIMARY_BUNDLE;
                failureCount = 0;
                fallbackSince = null;
                return true;
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
