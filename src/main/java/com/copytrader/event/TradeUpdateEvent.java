package com.copytrader.event;

import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.Trade;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Broadcast of a trade status change made outside the request path, such as a
 * recovery resolution.
 */
@Getter
public class TradeUpdateEvent extends ApplicationEvent {

    private final Trade trade;
    private final TradeStatus previousStatus;
    private final String message;

    public TradeUpdateEvent(Object source, Trade trade, TradeStatus previousStatus, String message) {
        super(source);
        this.trade = trade;
        this.previousStatus = previousStatus;
        this.message = message;
    }
}
