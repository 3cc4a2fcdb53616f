package com.copytrader.execution;

import java.math.BigDecimal;
import java.util.Base64;

/**
 * A fully signed, serialized transaction ready for submission.
 *
 * @param bytes     wire bytes
 * @param signature base58 of the first signature, the transaction id
 * @param tipSol    relay tip embedded in the transaction, zero for direct submission
 */
public record SignedTransaction(byte[] bytes, String signature, BigDecimal tipSol) {

    public String toBase64() {
        return Base64.getEncoder().encodeToString(bytes);
    }
}
