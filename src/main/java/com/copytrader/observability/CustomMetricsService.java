package com.copytrader.observability;

import com.copytrader.domain.enums.RpcMode;
import com.copytrader.execution.RpcHealthTracker;
import com.copytrader.oms.SignalQueue;
import com.copytrader.risk.CircuitBreakerService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the signal pipeline.
 * <ul>
 *   <li><b>signals.admitted</b> (counter, tag strategy)</li>
 *   <li><b>signals.rejected</b> (counter, tag reason)</li>
 *   <li><b>executions.succeeded</b> / <b>executions.failed</b> (counters)</li>
 *   <li><b>recovery.resolutions</b> (counter, tag outcome)</li>
 *   <li><b>queue.depth</b>, <b>circuit_breaker.active</b>, <b>rpc.mode.primary</b> (gauges)</li>
 * </ul>
 * Gauges are read by Micrometer on scrape, nothing polls them here.
 */
@Service
public class CustomMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter executionsSucceeded;
    private final Counter executionsFailed;

    public CustomMetricsService(
            MeterRegistry meterRegistry,
            SignalQueue signalQueue,
            CircuitBreakerService circuitBreakerService,
            RpcHealthTracker rpcHealthTracker) {
        this.meterRegistry = meterRegistry;

        this.executionsSucceeded = Counter.builder("executions.succeeded")
                .description("Signals whose transaction was accepted by a submission path")
                .register(meterRegistry);
        this.executionsFailed = Counter.builder("executions.failed")
                .description("Signals whose execution raised an error")
                .register(meterRegistry);

        meterRegistry.gauge("queue.depth", signalQueue, SignalQueue::size);
        meterRegistry.gauge(
                "circuit_breaker.active", circuitBreakerService, breaker -> breaker.isTradingAllowed() ? 1.0 : 0.0);
        meterRegistry.gauge(
                "rpc.mode.primary", rpcHealthTracker, tracker -> tracker.getMode() == RpcMode.PRIMARY_BUNDLE ? 1.0 : 0.0);
    }

    public void recordAdmitted(String strategy) {
        meterRegistry.counter("signals.admitted", "strategy", strategy).increment();
    }

    public void recordRejected(String reasonCode) {
        meterRegistry.counter("signals.rejected", "reason", reasonCode).increment();
    }

    public void recordExecution(boolean succeeded) {
        (succeeded ? executionsSucceeded : executionsFailed).increment();
    }

    public void recordRecovery(String outcome) {
        meterRegistry.counter("recovery.resolutions", "outcome", outcome).increment();
    }
}
