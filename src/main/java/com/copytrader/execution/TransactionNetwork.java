package com.copytrader.execution;

import com.copytrader.domain.enums.OnChainStatus;

/**
 * One RPC endpoint of the transaction network.
 *
 * <p>Implementations throw unchecked exceptions on transport or RPC errors; callers bound
 * every call with a timeout.
 */
public interface TransactionNetwork {

    /** Endpoint label for logs. */
    String name();

    /** @return true when the node reports itself healthy */
    boolean isHealthy();

    String getLatestBlockhash();

    /** @return the transaction signature as acknowledged by the node */
    String sendTransaction(SignedTransaction transaction);

    /**
     * Ground truth for a signature. Must answer {@link OnChainStatus#INDETERMINATE} rather
     * than guess when the node cannot tell.
     */
    OnChainStatus getTransactionStatus(String signature);
}
