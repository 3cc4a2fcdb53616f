package com.copytrader.recovery;

import com.copytrader.domain.model.Trade;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default source: uses the P&amp;L already attached to the trade record, if any.
 * A trade closed without it contributes nothing to the breaker's loss metrics.
 */
@Component
public class StoredRealizedPnlSource implements RealizedPnlSource {

    private static final Logger log = LoggerFactory.getLogger(StoredRealizedPnlSource.class);

    @Override
    public Optional<RealizedPnl> realizedPnl(Trade trade, String exitSignature) {
        if (trade.getPnlSol() == null && trade.getPnlUsd() == null) {
            log.warn("Trade {} closing on {} without realized P&L; breaker loss metrics will not see it",
                    trade.getTradeUuid(), exitSignature);
            return Optional.empty();
        }
        return Optional.of(new RealizedPnl(trade.getPnlSol(), trade.getPnlUsd()));
    }
}
