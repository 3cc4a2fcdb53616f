package com.copytrader.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;

import com.copytrader.api.dto.request.SignalRequest;
import com.copytrader.config.CircuitBreakerProperties;
import com.copytrader.config.ExecutorProperties;
import com.copytrader.config.RecoveryProperties;
import com.copytrader.domain.enums.OnChainStatus;
import com.copytrader.domain.enums.RpcMode;
import com.copytrader.domain.enums.SignalStrategy;
import com.copytrader.domain.enums.SubmissionPath;
import com.copytrader.domain.enums.TradeAction;
import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.Signal;
import com.copytrader.event.EventPublisherHelper;
import com.copytrader.exception.TradingHaltedException;
import com.copytrader.execution.BundleRelay;
import com.copytrader.execution.NetworkCallGuard;
import com.copytrader.execution.PercentileTipStrategy;
import com.copytrader.execution.RpcHealthTracker;
import com.copytrader.execution.SignedTransaction;
import com.copytrader.execution.TransactionExecutor;
import com.copytrader.execution.TransactionNetwork;
import com.copytrader.observability.CustomMetricsService;
import com.copytrader.oms.FailedTradeRetryService;
import com.copytrader.oms.SignalAdmissionService;
import com.copytrader.oms.SignalQueue;
import com.copytrader.oms.SignalQueueProcessor;
import com.copytrader.recovery.RecoveryOutcome;
import com.copytrader.recovery.RecoveryResult;
import com.copytrader.recovery.StoredRealizedPnlSource;
import com.copytrader.recovery.StuckTradeRecoveryService;
import com.copytrader.risk.CircuitBreakerService;
import com.copytrader.risk.TradingMetricsProvider;
import com.copytrader.service.AuditService;
import com.copytrader.service.DeadLetterService;
import com.copytrader.solana.Base58;
import com.copytrader.support.InMemoryTradeLifecycleService;
import com.copytrader.support.MutableClock;
import com.copytrader.support.Signals;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Runs signals through admission, queue, consumer, executor, retry and recovery with
 * real services. Only persistence side channels, metrics and the network are faked.
 */
@ExtendWith(MockitoExtension.class)
class SignalPipelineIntegrationTest {

    @Mock
    private TradingMetricsProvider tradingMetricsProvider;

    @Mock
    private AuditService auditService;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private DeadLetterService deadLetterService;

    @Mock
    private CustomMetricsService customMetricsService;

    private MutableClock clock;
    private ExecutorService networkPool;
    private FakeNetwork primary;
    private FakeNetwork fallback;
    private FakeRelay relay;

    private InMemoryTradeLifecycleService lifecycle;
    private SignalQueue queue;
    private CircuitBreakerService breaker;
    private RpcHealthTracker rpcHealthTracker;
    private SignalAdmissionService admission;
    private SignalQueueProcessor processor;
    private FailedTradeRetryService retryService;
    private StuckTradeRecoveryService recoveryService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        networkPool = Executors.newCachedThreadPool();
        primary = new FakeNetwork("primary-rpc");
        fallback = new FakeNetwork("fallback-rpc");
        relay = new FakeRelay();

        lenient().when(tradingMetricsProvider.realizedPnl24hUsd()).thenReturn(BigDecimal.ZERO);
        lenient().when(tradingMetricsProvider.consecutiveLosses()).thenReturn(0);
        lenient().when(tradingMetricsProvider.maxDrawdownPercent()).thenReturn(BigDecimal.ZERO);

        lifecycle = new InMemoryTradeLifecycleService(clock);
        queue = new SignalQueue(10, 80);
        breaker = new CircuitBreakerService(
                tradingMetricsProvider, new CircuitBreakerProperties(), auditService, eventPublisherHelper, clock);
        rpcHealthTracker = new RpcHealthTracker();
        NetworkCallGuard guard = new NetworkCallGuard(networkPool);
        ExecutorProperties executorProperties = new ExecutorProperties();
        TransactionExecutor executor = new TransactionExecutor(
                primary,
                fallback,
                List.of(relay),
                SignalPipelineIntegrationTest::sign,
                new PercentileTipStrategy(executorProperties),
                rpcHealthTracker,
                guard,
                executorProperties,
                auditService,
                eventPublisherHelper,
                clock);
        RecoveryProperties recoveryProperties = new RecoveryProperties();

        admission = new SignalAdmissionService(
                breaker, lifecycle, deadLetterService, queue, customMetricsService, clock);
        processor = new SignalQueueProcessor(
                queue, executor, lifecycle, breaker, deadLetterService, customMetricsService, recoveryProperties);
        retryService = new FailedTradeRetryService(lifecycle, queue, deadLetterService, breaker, recoveryProperties);
        recoveryService = new StuckTradeRecoveryService(
                lifecycle, primary, guard, auditService, eventPublisherHelper, customMetricsService,
                recoveryProperties, new StoredRealizedPnlSource());
    }

    @AfterEach
    void tearDown() {
        networkPool.shutdownNow();
    }

    private static SignedTransaction sign(Signal signal, BigDecimal tip, String blockhash) {
        byte[] signature = new byte[64];
        Arrays.fill(signature, (byte) (signal.getTradeUuid().hashCode() | 1));
        return new SignedTransaction(new byte[] {1}, Base58.encode(signature), tip);
    }

    private static SignalRequest request(String uuid, SignalStrategy strategy) {
        return SignalRequest.builder()
                .tradeUuid(uuid)
                .strategy(strategy)
                .action(strategy == SignalStrategy.EXIT ? TradeAction.SELL : TradeAction.BUY)
                .token("BONK")
                .amount(new BigDecimal("0.5"))
                .walletAddress(Signals.WALLET)
                .build();
    }

    private void drain() {
        Signal signal;
        while ((signal = queue.poll()) != null) {
            processor.processSignal(signal);
        }
    }

    private TradeStatus status(String uuid) {
        return lifecycle.get(uuid).getStatus();
    }

    @Test
    @DisplayName("Buy lands, a copied sell exits it, and recovery closes both once the exit confirms")
    void buySellRecover() {
        admission.admit(request("buy-1", SignalStrategy.CONSERVATIVE));
        drain();
        assertThat(status("buy-1")).isEqualTo(TradeStatus.ACTIVE);
        assertThat(lifecycle.get("buy-1").getTxSignature()).isNotBlank();

        admission.admit(request("sell-1", SignalStrategy.EXIT));
        drain();
        assertThat(status("sell-1")).isEqualTo(TradeStatus.EXITING);
        assertThat(status("buy-1")).isEqualTo(TradeStatus.EXITING);
        assertThat(lifecycle.get("buy-1").getExitTxSignature()).isEqualTo(lifecycle.get("sell-1").getTxSignature());

        primary.onChain = OnChainStatus.CONFIRMED;
        clock.advance(Duration.ofSeconds(61));
        RecoveryResult result = recoveryService.recoverStuckTrades();

        assertThat(result.count(RecoveryOutcome.CLOSED)).isEqualTo(2);
        assertThat(status("buy-1")).isEqualTo(TradeStatus.CLOSED);
        assertThat(status("sell-1")).isEqualTo(TradeStatus.CLOSED);
    }

    @Test
    @DisplayName("An exit that never landed puts the position back to ACTIVE")
    void exitNeverLanded() {
        admission.admit(request("buy-1", SignalStrategy.CONSERVATIVE));
        drain();
        admission.admit(request("sell-1", SignalStrategy.EXIT));
        drain();

        primary.onChain = OnChainStatus.NOT_FOUND;
        clock.advance(Duration.ofSeconds(61));
        recoveryService.recoverStuckTrades();

        assertThat(status("buy-1")).isEqualTo(TradeStatus.ACTIVE);
        assertThat(lifecycle.get("buy-1").getExitTxSignature()).isNull();
    }

    @Test
    @DisplayName("Exits dequeue ahead of conservative and aggressive entries")
    void priorityOrder() {
        admission.admit(request("agg", SignalStrategy.AGGRESSIVE));
        admission.admit(request("con", SignalStrategy.CONSERVATIVE));
        admission.admit(request("exit", SignalStrategy.EXIT));

        assertThat(queue.poll().getTradeUuid()).isEqualTo("exit");
        assertThat(queue.poll().getTradeUuid()).isEqualTo("con");
        assertThat(queue.poll().getTradeUuid()).isEqualTo("agg");
    }

    @Test
    @DisplayName("A breaker trip dead-letters queued signals and rejects new ones")
    void breakerTrip() {
        admission.admit(request("queued-1", SignalStrategy.CONSERVATIVE));
        lenient().when(tradingMetricsProvider.consecutiveLosses()).thenReturn(5);

        breaker.evaluate();
        drain();

        assertThat(status("queued-1")).isEqualTo(TradeStatus.DEAD_LETTER);
        assertThatThrownBy(() -> admission.admit(request("late-1", SignalStrategy.CONSERVATIVE)))
                .isInstanceOf(TradingHaltedException.class);
        assertThat(lifecycle.exists("late-1")).isFalse();
    }

    @Test
    @DisplayName("Failing primary paths trigger failover, and retried trades land through the fallback")
    void failoverAndRetry() {
        relay.failing = true;
        primary.failing = true;
        for (int i = 1; i <= 3; i++) {
            admission.admit(request("t-" + i, SignalStrategy.CONSERVATIVE));
        }
        drain();

        assertThat(rpcHealthTracker.getMode()).isEqualTo(RpcMode.FALLBACK_DIRECT);
        assertThat(lifecycle.findByStatus(TradeStatus.FAILED)).hasSize(3);

        retryService.retryFailedTrades();
        drain();

        for (int i = 1; i <= 3; i++) {
            assertThat(status("t-" + i)).isEqualTo(TradeStatus.ACTIVE);
            assertThat(lifecycle.get("t-" + i).getRetryCount()).isEqualTo(1);
        }
        assertThat(fallback.sent).isEqualTo(3);
    }

    @Test
    @DisplayName("Aggressive signals are dead-lettered while in fallback")
    void aggressiveInFallback() {
        relay.failing = true;
        primary.failing = true;
        for (int i = 1; i <= 3; i++) {
            admission.admit(request("t-" + i, SignalStrategy.CONSERVATIVE));
        }
        drain();

        admission.admit(request("agg-1", SignalStrategy.AGGRESSIVE));
        drain();

        assertThat(status("agg-1")).isEqualTo(TradeStatus.DEAD_LETTER);
    }

    private static class FakeNetwork implements TransactionNetwork {

        private final String name;
        volatile boolean failing;
        volatile OnChainStatus onChain = OnChainStatus.INDETERMINATE;
        volatile int sent;

        FakeNetwork(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isHealthy() {
            return !failing;
        }

        @Override
        public String getLatestBlockhash() {
            return "EkSnNWid2cvwEVnVx9aBqawnmiCNiDgp3gUdkDPTKN1N";
        }

        @Override
        public synchronized String sendTransaction(SignedTransaction transaction) {
            if (failing) {
                throw new IllegalStateException(name + " unavailable");
            }
            sent++;
            return transaction.signature();
        }

        @Override
        public OnChainStatus getTransactionStatus(String signature) {
            return onChain;
        }
    }

    private static class FakeRelay implements BundleRelay {

        volatile boolean failing;

        @Override
        public String name() {
            return "bundle-relay";
        }

        @Override
        public SubmissionPath path() {
            return SubmissionPath.BUNDLE_RELAY;
        }

        @Override
        public String submit(SignedTransaction transaction) {
            if (failing) {
                throw new IllegalStateException("bundle rejected");
            }
            return "bundle-id";
        }
    }
}
