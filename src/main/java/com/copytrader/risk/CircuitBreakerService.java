package com.copytrader.risk;

import com.copytrader.config.CircuitBreakerProperties;
import com.copytrader.domain.enums.AlertSeverity;
import com.copytrader.domain.enums.CircuitBreakerState;
import com.copytrader.event.EventPublisherHelper;
import com.copytrader.event.SafetyEventType;
import com.copytrader.exception.TradingHaltedException;
import com.copytrader.service.AuditService;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Process-wide trading interlock.
 *
 * <p>Evaluates aggregate trading metrics on a timer and halts all trading when a threshold
 * is crossed. Lifecycle: ACTIVE -> TRIPPED -> COOLDOWN -> ACTIVE, with admin trip/reset
 * available at any time. Every admission and execution decision reads
 * {@link #isTradingAllowed()}.
 *
 * <p>Evaluation order on each tick, first match wins:
 * <ol>
 *   <li>COOLDOWN and cooldown elapsed since the trip: resume ACTIVE, stop</li>
 *   <li>not ACTIVE: stop</li>
 *   <li>24h realized loss &gt;= max loss</li>
 *   <li>losing streak &gt;= max consecutive losses</li>
 *   <li>drawdown from peak &gt;= max drawdown percent</li>
 * </ol>
 *
 * <p>All state sits behind one read-write lock. Metrics are fetched outside the lock, so a
 * slow database query never blocks {@link #isTradingAllowed()}; the trip re-checks the
 * state under the write lock before applying.
 */
@Service
public class CircuitBreakerService {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerService.class);

    public static final String SYSTEM_ACTOR = "SYSTEM_CIRCUIT_BREAKER";

    private final TradingMetricsProvider tradingMetricsProvider;
    private final CircuitBreakerProperties properties;
    private final AuditService auditService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ReentrantReadWriteLock stateLock = new ReentrantReadWriteLock();

    // at most one evaluation in flight
    private final ReentrantLock evaluationLock = new ReentrantLock();

    // ---- guarded by stateLock ----
    private CircuitBreakerState state = CircuitBreakerState.ACTIVE;
    private Instant trippedAt;
    private TripReason tripReason;
    private Instant lastCheck;

    public CircuitBreakerService(
            TradingMetricsProvider tradingMetricsProvider,
            CircuitBreakerProperties properties,
            AuditService auditService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.tradingMetricsProvider = tradingMetricsProvider;
        this.properties = properties;
        this.auditService = auditService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ==============================
    // READ SIDE
    // ==============================

    public boolean isTradingAllowed() {
        stateLock.readLock().lock();
        try {
            return state == CircuitBreakerState.ACTIVE;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    /**
     * @throws TradingHaltedException unless the breaker is ACTIVE
     */
    public void ensureTradingAllowed() {
        stateLock.readLock().lock();
        try {
            if (state != CircuitBreakerState.ACTIVE) {
                throw new TradingHaltedException(state.name(), tripReason != null ? tripReason.describe() : null);
            }
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public CircuitBreakerState getState() {
        stateLock.readLock().lock();
        try {
            return state;
        } finally {
            stateLock.readLock().unlock();
        }
    }

    public CircuitBreakerStatus getStatus() {
        Instant now = clock.instant();
        stateLock.readLock().lock();
        try {
            Long remaining = null;
            if (state == CircuitBreakerState.COOLDOWN && trippedAt != null) {
                long elapsed = Duration.between(trippedAt, now).getSeconds();
                remaining = Math.max(0, properties.getCooldown().getSeconds() - elapsed);
            }
            return CircuitBreakerStatus.builder()
                    .state(state)
                    .tradingAllowed(state == CircuitBreakerState.ACTIVE)
                    .tripReasonCode(tripReason != null ? tripReason.code() : null)
                    .tripReason(tripReason != null ? tripReason.describe() : null)
                    .tripReasonDetails(tripReason != null ? tripReason.details() : null)
                    .trippedAt(trippedAt)
                    .lastCheck(lastCheck)
                    .cooldownRemainingSeconds(remaining)
                    .build();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    // ==============================
    // EVALUATION
    // ==============================

    /**
     * Scheduled tick. Moves an automatic trip from the previous tick into cooldown when
     * configured, then evaluates.
     */
    @Scheduled(
            fixedDelayString = "${copytrader.circuit-breaker.check-interval:PT30S}",
            initialDelayString = "${copytrader.circuit-breaker.check-interval:PT30S}")
    public void tick() {
        try {
            if (properties.isAutoCooldown() && isAutomaticTrip()) {
                enterCooldown();
            }
            evaluate();
        } catch (Exception e) {
            log.error("Circuit breaker tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one evaluation if at least one check interval has passed since the last one.
     *
     * @return true if an evaluation ran, false if rate-limited or one is already running
     */
    public boolean evaluate() {
        if (!evaluationLock.tryLock()) {
            return false;
        }
        try {
            Instant now = clock.instant();
            boolean resumed = false;
            stateLock.writeLock().lock();
            try {
                if (lastCheck != null && Duration.between(lastCheck, now).compareTo(properties.getCheckInterval()) < 0) {
                    return false;
                }
                lastCheck = now;

                if (state == CircuitBreakerState.COOLDOWN
                        && Duration.between(trippedAt, now).compareTo(properties.getCooldown()) >= 0) {
                    state = CircuitBreakerState.ACTIVE;
                    trippedAt = null;
                    tripReason = null;
                    resumed = true;
                } else if (state != CircuitBreakerState.ACTIVE) {
                    return true;
                }
            } finally {
                stateLock.writeLock().unlock();
            }
            if (resumed) {
                onCooldownComplete();
                return true;
            }

            TripReason reason = checkThresholds();
            if (reason != null) {
                trip(reason, SYSTEM_ACTOR);
            }
            return true;
        } finally {
            evaluationLock.unlock();
        }
    }

    TripReason checkThresholds() {
        BigDecimal pnl24h = tradingMetricsProvider.realizedPnl24hUsd();
        if (pnl24h.signum() < 0 && pnl24h.abs().compareTo(properties.getMaxLoss24hUsd()) >= 0) {
            return new TripReason.MaxLoss24h(pnl24h.abs(), properties.getMaxLoss24hUsd());
        }

        int streak = tradingMetricsProvider.consecutiveLosses();
        if (streak >= properties.getMaxConsecutiveLosses()) {
            return new TripReason.ConsecutiveLosses(streak, properties.getMaxConsecutiveLosses());
        }

        BigDecimal drawdown = tradingMetricsProvider.maxDrawdownPercent();
        if (drawdown.compareTo(properties.getMaxDrawdownPercent()) >= 0) {
            return new TripReason.MaxDrawdown(drawdown, properties.getMaxDrawdownPercent());
        }
        return null;
    }

    // ==============================
    // TRANSITIONS
    // ==============================

    /**
     * Admin force-trip. Applies regardless of the timer or current state and restarts the
     * cooldown clock.
     */
    public void manualTrip(String actor, String reason) {
        trip(new TripReason.Manual(reason), actor);
    }

    /**
     * Moves TRIPPED to COOLDOWN. No-op in any other state.
     *
     * @return true if the transition happened
     */
    public boolean enterCooldown() {
        stateLock.writeLock().lock();
        try {
            if (state != CircuitBreakerState.TRIPPED) {
                return false;
            }
            state = CircuitBreakerState.COOLDOWN;
        } finally {
            stateLock.writeLock().unlock();
        }
        log.info("Circuit breaker entering cooldown ({} min)", properties.getCooldown().toMinutes());
        auditService.logConfigChange(
                AuditService.KEY_CIRCUIT_BREAKER,
                CircuitBreakerState.TRIPPED.name(),
                CircuitBreakerState.COOLDOWN.name(),
                SYSTEM_ACTOR,
                "Cooldown started");
        eventPublisherHelper.publishSafety(
                this,
                SafetyEventType.CIRCUIT_BREAKER_COOLDOWN,
                AlertSeverity.WARNING,
                "Circuit breaker cooling down for " + properties.getCooldown().toMinutes() + " minutes",
                Map.of());
        return true;
    }

    /**
     * Admin reset to ACTIVE from any state. Audits the actor and the state it replaced.
     */
    public void reset(String actor) {
        CircuitBreakerState previous;
        stateLock.writeLock().lock();
        try {
            previous = state;
            state = CircuitBreakerState.ACTIVE;
            trippedAt = null;
            tripReason = null;
        } finally {
            stateLock.writeLock().unlock();
        }
        log.warn("Circuit breaker reset by {} (was {})", actor, previous);
        auditService.logConfigChange(
                AuditService.KEY_CIRCUIT_BREAKER,
                previous.name(),
                CircuitBreakerState.ACTIVE.name(),
                actor,
                "Admin reset");
        if (previous != CircuitBreakerState.ACTIVE) {
            eventPublisherHelper.publishSafety(
                    this,
                    SafetyEventType.CIRCUIT_BREAKER_RESUMED,
                    AlertSeverity.INFO,
                    "Circuit breaker reset by " + actor,
                    Map.of("previousState", previous.name()));
        }
    }

    private void trip(TripReason reason, String actor) {
        CircuitBreakerState previous;
        Instant now = clock.instant();
        stateLock.writeLock().lock();
        try {
            previous = state;
            // an automatic trip lost the race against an admin action
            if (!(reason instanceof TripReason.Manual) && previous != CircuitBreakerState.ACTIVE) {
                return;
            }
            state = CircuitBreakerState.TRIPPED;
            trippedAt = now;
            tripReason = reason;
        } finally {
            stateLock.writeLock().unlock();
        }

        log.error("CIRCUIT BREAKER TRIPPED by {}: {}", actor, reason.describe());
        auditService.logConfigChange(
                AuditService.KEY_CIRCUIT_BREAKER,
                previous.name(),
                CircuitBreakerState.TRIPPED.name(),
                actor,
                reason.describe());

        if (previous == CircuitBreakerState.ACTIVE) {
            Map<String, Object> details = new LinkedHashMap<>(reason.details());
            details.put("reasonCode", reason.code());
            details.put("actor", actor);
            eventPublisherHelper.publishSafety(
                    this,
                    SafetyEventType.CIRCUIT_BREAKER_TRIPPED,
                    AlertSeverity.CRITICAL,
                    "Trading halted: " + reason.describe(),
                    details);
        }
    }

    private void onCooldownComplete() {
        log.info("Circuit breaker cooldown complete, trading resumed");
        auditService.logConfigChange(
                AuditService.KEY_CIRCUIT_BREAKER,
                CircuitBreakerState.COOLDOWN.name(),
                CircuitBreakerState.ACTIVE.name(),
                SYSTEM_ACTOR,
                "Cooldown elapsed");
        eventPublisherHelper.publishSafety(
                this,
                SafetyEventType.CIRCUIT_BREAKER_RESUMED,
                AlertSeverity.INFO,
                "Circuit breaker cooldown complete, trading resumed",
                Map.of());
    }

    private boolean isAutomaticTrip() {
        stateLock.readLock().lock();
        try {
            return state == CircuitBreakerState.TRIPPED && !(tripReason instanceof TripReason.Manual);
        } finally {
            stateLock.readLock().unlock();
        }
    }
}
