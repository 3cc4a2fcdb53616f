package com.copytrader.unit.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.copytrader.config.RecoveryProperties;
import com.copytrader.domain.enums.OnChainStatus;
import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.Trade;
import com.copytrader.event.EventPublisherHelper;
import com.copytrader.execution.NetworkCallGuard;
import com.copytrader.execution.TransactionNetwork;
import com.copytrader.lifecycle.TradeLifecycleService;
import com.copytrader.observability.CustomMetricsService;
import com.copytrader.recovery.RealizedPnl;
import com.copytrader.recovery.RealizedPnlSource;
import com.copytrader.recovery.RecoveryOutcome;
import com.copytrader.recovery.RecoveryResult;
import com.copytrader.recovery.StoredRealizedPnlSource;
import com.copytrader.recovery.StuckTradeRecoveryService;
import com.copytrader.service.AuditService;
import com.copytrader.solana.Base58;
import com.copytrader.support.Signals;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StuckTradeRecoveryServiceTest {

    private static final String EXIT_SIG = signature((byte) 7);
    private static final String ENTRY_SIG = signature((byte) 3);

    @Mock
    private TradeLifecycleService tradeLifecycleService;

    @Mock
    private TransactionNetwork network;

    @Mock
    private AuditService auditService;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private CustomMetricsService customMetricsService;

    private ExecutorService pool;
    private RecoveryProperties properties;
    private StuckTradeRecoveryService service;

    private static String signature(byte fill) {
        byte[] bytes = new byte[64];
        Arrays.fill(bytes, fill);
        return Base58.encode(bytes);
    }

    @BeforeEach
    void setUp() {
        pool = Executors.newCachedThreadPool();
        properties = new RecoveryProperties();
        properties.setLookupTimeout(Duration.ofMillis(200));
        service = service(new StoredRealizedPnlSource());
        lenient().when(network.name()).thenReturn("primary-rpc");
    }

    private StuckTradeRecoveryService service(RealizedPnlSource pnlSource) {
        return new StuckTradeRecoveryService(tradeLifecycleService, network, new NetworkCallGuard(pool),
                auditService, eventPublisherHelper, customMetricsService, properties, pnlSource);
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private Trade exiting(String uuid, String entrySig, String exitSig) {
        Trade trade = Signals.trade(uuid, TradeStatus.EXITING);
        trade.setTxSignature(entrySig);
        trade.setExitTxSignature(exitSig);
        trade.setPnlSol(new BigDecimal("0.12"));
        trade.setPnlUsd(new BigDecimal("18.40"));
        return trade;
    }

    private void stuck(Trade... trades) {
        when(tradeLifecycleService.findStuck(TradeStatus.EXITING, properties.getStuckThreshold()))
                .thenReturn(List.of(trades));
    }

    @Test
    @DisplayName("Confirmed exit closes the trade with its P&L and logs the reconciliation")
    void confirmedCloses() {
        Trade trade = exiting("uuid-1", ENTRY_SIG, EXIT_SIG);
        stuck(trade);
        when(network.getTransactionStatus(EXIT_SIG)).thenReturn(OnChainStatus.CONFIRMED);

        RecoveryResult result = service.recoverStuckTrades();

        assertThat(result.getExamined()).isEqualTo(1);
        assertThat(result.count(RecoveryOutcome.CLOSED)).isEqualTo(1);
        verify(tradeLifecycleService).transition(eq("uuid-1"), eq(TradeStatus.CLOSED),
                argThat(ctx -> new BigDecimal("18.40").equals(ctx.getPnlUsd())));
        verify(auditService).logReconciliation(
                eq("uuid-1"), eq("EXITING"), eq("FOUND"), eq("NONE"), eq(EXIT_SIG), eq("SYSTEM_RECOVERY"), anyString());
        verify(eventPublisherHelper).publishTradeUpdate(any(), any(), eq(TradeStatus.EXITING), anyString());
        verify(customMetricsService).recordRecovery("CLOSED");
    }

    @Test
    @DisplayName("Confirmed exit is priced by the realized P&L source at close")
    void closeUsesRealizedPnlSource() {
        Trade trade = exiting("uuid-1", ENTRY_SIG, EXIT_SIG);
        trade.setPnlSol(null);
        trade.setPnlUsd(null);
        stuck(trade);
        when(network.getTransactionStatus(EXIT_SIG)).thenReturn(OnChainStatus.CONFIRMED);
        RealizedPnlSource pnlSource = (t, sig) -> EXIT_SIG.equals(sig)
                ? Optional.of(new RealizedPnl(new BigDecimal("-0.30"), new BigDecimal("-45.00")))
                : Optional.empty();

        service(pnlSource).recoverStuckTrades();

        verify(tradeLifecycleService).transition(eq("uuid-1"), eq(TradeStatus.CLOSED),
                argThat(ctx -> new BigDecimal("-45.00").equals(ctx.getPnlUsd())
                        && new BigDecimal("-0.30").equals(ctx.getPnlSol())));
    }

    @Test
    @DisplayName("Unpriced trades still close, without P&L")
    void closeWithoutPnl() {
        Trade trade = exiting("uuid-1", ENTRY_SIG, EXIT_SIG);
        trade.setPnlSol(null);
        trade.setPnlUsd(null);
        stuck(trade);
        when(network.getTransactionStatus(EXIT_SIG)).thenReturn(OnChainStatus.CONFIRMED);

        RecoveryResult result = service.recoverStuckTrades();

        assertThat(result.count(RecoveryOutcome.CLOSED)).isEqualTo(1);
        verify(tradeLifecycleService).transition(eq("uuid-1"), eq(TradeStatus.CLOSED),
                argThat(ctx -> ctx.getPnlUsd() == null && ctx.getPnlSol() == null));
    }

    @Test
    @DisplayName("Missing exit reverts the position to ACTIVE and audits the revert")
    void notFoundReverts() {
        stuck(exiting("uuid-1", ENTRY_SIG, EXIT_SIG));
        when(network.getTransactionStatus(EXIT_SIG)).thenReturn(OnChainStatus.NOT_FOUND);

        RecoveryResult result = service.recoverStuckTrades();

        assertThat(result.count(RecoveryOutcome.REVERTED)).isEqualTo(1);
        verify(tradeLifecycleService).transition(eq("uuid-1"), eq(TradeStatus.ACTIVE),
                argThat(ctx -> ctx.isClearExitSignature()));
        verify(auditService).logReconciliation(
                eq("uuid-1"), eq("EXITING"), eq("MISSING"), eq("MISSING_TX"), eq(EXIT_SIG), eq("SYSTEM_RECOVERY"),
                anyString());
        verify(auditService).logConfigChange(
                eq("position:uuid-1"), eq("EXITING"), eq("ACTIVE"), eq("SYSTEM_RECOVERY"), anyString());
    }

    @Test
    @DisplayName("Indeterminate status leaves the trade for the next pass")
    void indeterminateUnresolved() {
        stuck(exiting("uuid-1", ENTRY_SIG, EXIT_SIG));
        when(network.getTransactionStatus(EXIT_SIG)).thenReturn(OnChainStatus.INDETERMINATE);

        RecoveryResult result = service.recoverStuckTrades();

        assertThat(result.count(RecoveryOutcome.UNRESOLVED)).isEqualTo(1);
        verify(tradeLifecycleService, never()).transition(any(), any(), any());
        verifyNoInteractions(auditService);
    }

    @Test
    @DisplayName("A lookup that times out is treated as indeterminate")
    void lookupTimeout() {
        stuck(exiting("uuid-1", ENTRY_SIG, EXIT_SIG));
        when(network.getTransactionStatus(EXIT_SIG)).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return OnChainStatus.CONFIRMED;
        });

        RecoveryResult result = service.recoverStuckTrades();

        assertThat(result.count(RecoveryOutcome.UNRESOLVED)).isEqualTo(1);
        verify(tradeLifecycleService, never()).transition(any(), any(), any());
    }

    @Test
    @DisplayName("Without an exit signature the entry signature is looked up")
    void fallsBackToEntrySignature() {
        stuck(exiting("uuid-1", ENTRY_SIG, null));
        when(network.getTransactionStatus(ENTRY_SIG)).thenReturn(OnChainStatus.CONFIRMED);

        assertThat(service.recoverStuckTrades().count(RecoveryOutcome.CLOSED)).isEqualTo(1);
    }

    @Test
    @DisplayName("Unparseable signatures are skipped without a network call")
    void invalidSignatureSkipped() {
        stuck(exiting("uuid-1", null, "not-a-signature!"), exiting("uuid-2", null, null));

        RecoveryResult result = service.recoverStuckTrades();

        assertThat(result.count(RecoveryOutcome.SKIPPED)).isEqualTo(2);
        verify(network, never()).getTransactionStatus(anyString());
    }

    @Test
    @DisplayName("A trade that moved on mid-pass is counted as an error and the pass continues")
    void raceCountsAsError() {
        stuck(exiting("uuid-1", ENTRY_SIG, EXIT_SIG), exiting("uuid-2", ENTRY_SIG, ENTRY_SIG));
        when(network.getTransactionStatus(anyString())).thenReturn(OnChainStatus.CONFIRMED);
        when(tradeLifecycleService.transition(eq("uuid-1"), eq(TradeStatus.CLOSED), any()))
                .thenThrow(new IllegalStateException("Row was updated by another transaction"));

        RecoveryResult result = service.recoverStuckTrades();

        assertThat(result.count(RecoveryOutcome.ERROR)).isEqualTo(1);
        assertThat(result.count(RecoveryOutcome.CLOSED)).isEqualTo(1);
    }
}
