package com.copytrader.recovery;

import com.copytrader.domain.model.Trade;
import java.util.Optional;

/**
 * Prices a trade whose exit has confirmed on chain.
 *
 * <p>Realized P&amp;L is owned by the position and exit-strategy side of the operator; this is
 * the seam it plugs into. The value is written with the CLOSED transition and feeds the
 * circuit breaker's loss, streak and drawdown checks.
 */
public interface RealizedPnlSource {

    /** Empty when the trade cannot be priced yet; the trade then closes without P&amp;L. */
    Optional<RealizedPnl> realizedPnl(Trade trade, String exitSignature);
}
