package com.copytrader.domain.model;

import com.copytrader.domain.enums.SignalStrategy;
import com.copytrader.domain.enums.TradeAction;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * A validated, admitted unit of work.
 *
 * <p>Immutable once built: the queue lane owns it until the consumer hands it to the
 * executor. {@code amount} is in SOL and always a BigDecimal.
 */
@Value
@Builder(toBuilder = true)
public class Signal {

    String tradeUuid;
    SignalStrategy strategy;
    TradeAction action;
    String token;

    /** Mint address when it differs from the token identifier; null means {@code token} is the mint. */
    String tokenAddress;

    BigDecimal amount;
    String walletAddress;
    Instant timestamp;

    public String getMint() {
        return tokenAddress != null ? tokenAddress : token;
    }

    public boolean isSell() {
        return action == TradeAction.SELL;
    }
}
