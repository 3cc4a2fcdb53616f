package com.copytrader.unit.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.copytrader.exception.ExecutionException;
import com.copytrader.execution.NetworkCallGuard;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NetworkCallGuardTest {

    private ExecutorService executor;
    private NetworkCallGuard guard;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        guard = new NetworkCallGuard(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Returns the call's value when it completes in time")
    void completes() {
        assertThat(guard.call("getSlot", Duration.ofSeconds(1), () -> 42L)).isEqualTo(42L);
    }

    @Test
    @DisplayName("Overrunning call becomes a retryable timeout")
    void timeout() {
        ExecutionException e = catchThrowableOfType(
                () -> guard.call("sendTransaction", Duration.ofMillis(50), () -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }),
                ExecutionException.class);

        assertThat(e.getReasonCode()).isEqualTo("EXECUTION_TIMEOUT");
        assertThat(e.isRetryable()).isTrue();
        assertThat(e.getMessage()).isEqualTo("sendTransaction timed out");
    }

    @Test
    @DisplayName("Transport errors become RPC_UNAVAILABLE with the cause kept")
    void transportError() {
        ExecutionException e = catchThrowableOfType(
                () -> guard.call("getLatestBlockhash", Duration.ofSeconds(1), () -> {
                    throw new IllegalStateException("connection refused");
                }),
                ExecutionException.class);

        assertThat(e.getReasonCode()).isEqualTo("RPC_UNAVAILABLE");
        assertThat(e.getMessage()).contains("connection refused");
        assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Execution failures thrown by the call pass through unchanged")
    void executionExceptionPassesThrough() {
        ExecutionException original = ExecutionException.amountOutOfBounds("too big");

        ExecutionException e = catchThrowableOfType(
                () -> guard.call("build", Duration.ofSeconds(1), () -> {
                    throw original;
                }),
                ExecutionException.class);

        assertThat(e).isSameAs(original);
    }
}
