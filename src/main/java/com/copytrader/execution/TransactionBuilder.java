package com.copytrader.execution;

import com.copytrader.domain.model.Signal;
import java.math.BigDecimal;

/**
 * Builds and signs the swap transaction for a signal.
 */
public interface TransactionBuilder {

    /**
     * @param tipSol          relay tip to embed; zero builds an untipped transaction
     * @param recentBlockhash blockhash the transaction must reference
     */
    SignedTransaction build(Signal signal, BigDecimal tipSol, String recentBlockhash);
}
