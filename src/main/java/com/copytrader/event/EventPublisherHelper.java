package com.copytrader.event;

import com.copytrader.domain.enums.AlertSeverity;
import com.copytrader.domain.enums.TradeStatus;
import com.copytrader.domain.model.Trade;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed wrapper around {@link ApplicationEventPublisher} for operator events.
 *
 * <p>Publishing never throws into the caller: listeners that matter for delivery are
 * {@code @Async}, and the breaker and executor do not wait on them.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Safety controls ----

    public void publishSafety(
            Object source,
            SafetyEventType eventType,
            AlertSeverity severity,
            String message,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new SafetyEvent(source, eventType, severity, message, details));
    }

    // ---- Trades ----

    public void publishTradeUpdate(Object source, Trade trade, TradeStatus previousStatus, String message) {
        applicationEventPublisher.publishEvent(new TradeUpdateEvent(source, trade, previousStatus, message));
    }
}
