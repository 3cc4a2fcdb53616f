package com.copytrader.execution;

import com.copytrader.exception.ExecutionException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a blocking network call on a dedicated pool and bounds it with a resilience4j
 * {@link TimeLimiter}. A call that overruns is cancelled and reported as a timeout.
 *
 * <p>Failures surface as {@link ExecutionException}: timeouts as EXECUTION_TIMEOUT, anything
 * else as RPC_UNAVAILABLE unless the call already threw an ExecutionException.
 */
public class NetworkCallGuard {

    private static final Logger log = LoggerFactory.getLogger(NetworkCallGuard.class);

    private final ExecutorService networkExecutor;

    public NetworkCallGuard(ExecutorService networkExecutor) {
        this.networkExecutor = networkExecutor;
    }

    public <T> T call(String operation, Duration timeout, Supplier<T> call) {
        TimeLimiter timeLimiter = TimeLimiter.of(
                operation,
                TimeLimiterConfig.custom()
                        .timeoutDuration(timeout)
                        .cancelRunningFuture(true)
                        .build());
        try {
            return timeLimiter.executeFutureSupplier(() -> networkExecutor.submit(call::get));
        } catch (TimeoutException e) {
            log.warn("{} timed out after {} ms", operation, timeout.toMillis());
            throw ExecutionException.timeout(operation);
        } catch (ExecutionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ExecutionException.rpcUnavailable(operation + " interrupted", e);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (cause instanceof ExecutionException executionException) {
                throw executionException;
            }
            log.warn("{} failed: {}", operation, cause.getMessage());
            throw ExecutionException.rpcUnavailable(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof java.util.concurrent.ExecutionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
