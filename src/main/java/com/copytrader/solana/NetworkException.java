package com.copytrader.solana;

import com.copytrader.exception.BaseException;
import com.copytrader.exception.ErrorCode;

/**
 * Transport or JSON-RPC error from a network endpoint, relay or swap aggregator.
 */
public class NetworkException extends BaseException {

    public NetworkException(String message) {
        super(ErrorCode.RPC_UNAVAILABLE, message);
    }

    public NetworkException(String message, Throwable cause) {
        super(ErrorCode.RPC_UNAVAILABLE, message, cause);
    }
}
