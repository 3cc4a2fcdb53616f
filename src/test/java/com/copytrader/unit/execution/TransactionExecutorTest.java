package com.copytrader.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.copytrader.config.ExecutorProperties;
import com.copytrader.domain.enums.AlertSeverity;
import com.copytrader.domain.enums.OnChainStatus;
import com.copytrader.domain.enums.RpcMode;
import com.copytrader.domain.enums.SignalStrategy;
import com.copytrader.domain.enums.SubmissionPath;
import com.copytrader.domain.model.Signal;
import com.copytrader.event.EventPublisherHelper;
import com.copytrader.event.SafetyEventType;
import com.copytrader.exception.ExecutionException;
import com.copytrader.execution.BundleRelay;
import com.copytrader.execution.ExecutionResult;
import com.copytrader.execution.NetworkCallGuard;
import com.copytrader.execution.PercentileTipStrategy;
import com.copytrader.execution.RpcHealthTracker;
import com.copytrader.execution.SignedTransaction;
import com.copytrader.execution.TransactionExecutor;
import com.copytrader.execution.TransactionNetwork;
import com.copytrader.service.AuditService;
import com.copytrader.support.MutableClock;
import com.copytrader.support.Signals;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TransactionExecutorTest {

    @Mock
    private AuditService auditService;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private final List<String> calls = new ArrayList<>();

    private FakeNetwork primary;
    private FakeNetwork fallback;
    private FakeRelay bundleRelay;
    private FakeRelay senderRelay;
    private RpcHealthTracker tracker;
    private MutableClock clock;
    private ExecutorService networkPool;
    private TransactionExecutor executor;

    @BeforeEach
    void setUp() {
        primary = new FakeNetwork("primary");
        fallback = new FakeNetwork("fallback");
        bundleRelay = new FakeRelay("bundle", SubmissionPath.BUNDLE_RELAY);
        senderRelay = new FakeRelay("sender", SubmissionPath.SECONDARY_RELAY);
        tracker = new RpcHealthTracker();
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        networkPool = Executors.newCachedThreadPool();
        ExecutorProperties properties = new ExecutorProperties();
        executor = new TransactionExecutor(
                primary,
                fallback,
                List.of(bundleRelay, senderRelay),
                (signal, tip, blockhash) -> new SignedTransaction(
                        blockhash.getBytes(StandardCharsets.UTF_8), "sig-" + signal.getTradeUuid(), tip),
                new PercentileTipStrategy(properties),
                tracker,
                new NetworkCallGuard(networkPool),
                properties,
                auditService,
                eventPublisherHelper,
                clock);
    }

    @AfterEach
    void tearDown() {
        networkPool.shutdownNow();
    }

    private Signal conservative(String uuid) {
        return Signals.signal(uuid, SignalStrategy.CONSERVATIVE);
    }

    private void failOnce(String uuid) {
        catchThrowableOfType(() -> executor.execute(conservative(uuid)), ExecutionException.class);
    }

    private void failOver() {
        bundleRelay.failing = true;
        senderRelay.failing = true;
        primary.failing = true;
        failOnce("f1");
        failOnce("f2");
        failOnce("f3");
    }

    @Nested
    @DisplayName("Primary mode")
    class PrimaryMode {

        @Test
        @DisplayName("First relay lands the tipped transaction")
        void firstRelay() {
            ExecutionResult result = executor.execute(conservative("uuid-1"));

            assertThat(result.getSignature()).isEqualTo("sig-uuid-1");
            assertThat(result.getPath()).isEqualTo(SubmissionPath.BUNDLE_RELAY);
            assertThat(result.getMode()).isEqualTo(RpcMode.PRIMARY_BUNDLE);
            assertThat(result.getTipSol()).isEqualByComparingTo("0.002");
            assertThat(calls).containsExactly("primary.blockhash", "bundle.submit");
        }

        @Test
        @DisplayName("Relays are tried in order, then direct submission to the primary endpoint")
        void relayOrder() {
            bundleRelay.failing = true;
            senderRelay.failing = true;

            ExecutionResult result = executor.execute(conservative("uuid-1"));

            assertThat(result.getPath()).isEqualTo(SubmissionPath.DIRECT_PRIMARY);
            assertThat(calls).containsExactly(
                    "primary.blockhash", "bundle.submit", "sender.submit", "primary.send");
        }

        @Test
        @DisplayName("Second relay is used when the first rejects")
        void secondRelay() {
            bundleRelay.failing = true;

            assertThat(executor.execute(conservative("uuid-1")).getPath()).isEqualTo(SubmissionPath.SECONDARY_RELAY);
        }

        @Test
        @DisplayName("All paths failing is a retryable submission failure")
        void allPathsFail() {
            bundleRelay.failing = true;
            senderRelay.failing = true;
            primary.failing = true;

            ExecutionException e = catchThrowableOfType(
                    () -> executor.execute(conservative("uuid-1")), ExecutionException.class);

            assertThat(e.getReasonCode()).isEqualTo("SUBMISSION_FAILED");
            assertThat(e.isRetryable()).isTrue();
            assertThat(tracker.getFailureCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Amounts outside the position bounds are rejected before any network call")
        void amountBounds() {
            Signal tooBig = conservative("uuid-1").toBuilder().amount(new BigDecimal("1.5")).build();

            ExecutionException e = catchThrowableOfType(() -> executor.execute(tooBig), ExecutionException.class);

            assertThat(e.getReasonCode()).isEqualTo("AMOUNT_OUT_OF_BOUNDS");
            assertThat(e.isRetryable()).isFalse();
            assertThat(calls).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failover")
    class Failover {

        @Test
        @DisplayName("Three consecutive failures switch to fallback with an audit row and an alert")
        void switchesAfterThreeFailures() {
            failOver();

            assertThat(tracker.getMode()).isEqualTo(RpcMode.FALLBACK_DIRECT);
            verify(auditService).logConfigChange(
                    eq(AuditService.KEY_RPC_MODE), eq("PRIMARY_BUNDLE"), eq("FALLBACK_DIRECT"),
                    eq(TransactionExecutor.ACTOR_FAILOVER), anyString());
            verify(eventPublisherHelper).publishSafety(
                    any(), eq(SafetyEventType.RPC_FALLBACK_ENGAGED), eq(AlertSeverity.WARNING), anyString(),
                    anyMap());
        }

        @Test
        @DisplayName("Fallback submits untipped, directly to the fallback endpoint")
        void fallbackDirect() {
            failOver();
            calls.clear();

            ExecutionResult result = executor.execute(conservative("uuid-9"));

            assertThat(result.getPath()).isEqualTo(SubmissionPath.DIRECT_FALLBACK);
            assertThat(result.getTipSol()).isEqualByComparingTo("0");
            assertThat(calls).containsExactly("fallback.blockhash", "fallback.send");
        }

        @Test
        @DisplayName("Aggressive signals are disabled in fallback")
        void aggressiveDisabled() {
            failOver();

            ExecutionException e = catchThrowableOfType(
                    () -> executor.execute(Signals.signal("agg", SignalStrategy.AGGRESSIVE)),
                    ExecutionException.class);

            assertThat(e.getReasonCode()).isEqualTo("STRATEGY_DISABLED");
            assertThat(e.isRetryable()).isFalse();
        }

        @Test
        @DisplayName("A successful send in fallback does not restore primary mode")
        void successDoesNotRestore() {
            failOver();

            executor.execute(conservative("uuid-9"));

            assertThat(tracker.getMode()).isEqualTo(RpcMode.FALLBACK_DIRECT);
        }

        @Test
        @DisplayName("Healthy probe after the recovery interval restores primary mode")
        void probeRestores() {
            failOver();
            primary.failing = false;
            bundleRelay.failing = false;
            clock.advance(Duration.ofSeconds(60));

            ExecutionResult result = executor.execute(conservative("uuid-9"));

            assertThat(result.getPath()).isEqualTo(SubmissionPath.BUNDLE_RELAY);
            assertThat(tracker.getMode()).isEqualTo(RpcMode.PRIMARY_BUNDLE);
            verify(auditService).logConfigChange(
                    eq(AuditService.KEY_RPC_MODE), eq("FALLBACK_DIRECT"), eq("PRIMARY_BUNDLE"),
                    eq(TransactionExecutor.ACTOR_RECOVERY), anyString());
        }

        @Test
        @DisplayName("No probe before the recovery interval has passed")
        void noEarlyProbe() {
            failOver();
            primary.failing = false;
            clock.advance(Duration.ofSeconds(59));
            calls.clear();

            executor.execute(conservative("uuid-9"));

            assertThat(calls).doesNotContain("primary.health");
            assertThat(tracker.getMode()).isEqualTo(RpcMode.FALLBACK_DIRECT);
            verify(auditService, never()).logConfigChange(
                    eq(AuditService.KEY_RPC_MODE), eq("FALLBACK_DIRECT"), anyString(), anyString(), anyString());
        }
    }

    private class FakeNetwork implements TransactionNetwork {

        private final String name;
        volatile boolean failing;

        FakeNetwork(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isHealthy() {
            calls.add(name + ".health");
            return !failing;
        }

        @Override
        public String getLatestBlockhash() {
            calls.add(name + ".blockhash");
            return "EkSnNWid2cvwEVnVx9aBqawnmiCNiDgp3gUdkDPTKN1N";
        }

        @Override
        public String sendTransaction(SignedTransaction transaction) {
            calls.add(name + ".send");
            if (failing) {
                throw new IllegalStateException(name + " unavailable");
            }
            return transaction.signature();
        }

        @Override
        public OnChainStatus getTransactionStatus(String signature) {
            return OnChainStatus.INDETERMINATE;
        }
    }

    private class FakeRelay implements BundleRelay {

        private final String name;
        private final SubmissionPath path;
        volatile boolean failing;

        FakeRelay(String name, SubmissionPath path) {
            this.name = name;
            this.path = path;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public SubmissionPath path() {
            return path;
        }

        @Override
        public String submit(SignedTransaction transaction) {
            calls.add(name + ".submit");
            if (failing) {
                throw new IllegalStateException(name + " rejected bundle");
            }
            return "bundle-" + transaction.signature();
        }
    }
}
