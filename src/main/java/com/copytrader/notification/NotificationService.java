package com.copytrader.notification;

import com.copytrader.domain.enums.AlertSeverity;
import com.copytrader.domain.model.Trade;
import com.copytrader.event.SafetyEvent;
import com.copytrader.event.TradeUpdateEvent;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Turns breaker, RPC-mode and recovery events into operator alerts.
 *
 * <p>Listeners run on the {@code eventExecutor} pool. A failed delivery is logged and
 * goes no further: the publisher has already moved on.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss").withZone(ZoneOffset.UTC);

    private final TelegramNotifier telegramNotifier;
    private final Clock clock;

    public NotificationService(TelegramNotifier telegramNotifier, Clock clock) {
        this.telegramNotifier = telegramNotifier;
        this.clock = clock;
    }

    public void notify(Alert alert) {
        try {
            telegramNotifier.send(render(alert), alert.getSeverity());
        } catch (Exception e) {
            log.error("Failed to deliver alert '{}': {}", alert.getTitle(), e.getMessage());
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onSafetyEvent(SafetyEvent event) {
        notify(Alert.builder()
                .severity(event.getSeverity())
                .title(event.getEventType().name().replace('_', ' '))
                .message(event.getMessage())
                .timestamp(clock.instant())
                .build());
    }

    @Async("eventExecutor")
    @EventListener
    public void onTradeUpdate(TradeUpdateEvent event) {
        Trade trade = event.getTrade();
        notify(Alert.builder()
                .severity(AlertSeverity.INFO)
                .title("TRADE " + event.getPreviousStatus() + " -> " + trade.getStatus())
                .message(String.format("%s %s %s: %s", trade.getTradeUuid(), trade.getAction(), trade.getToken(),
                        event.getMessage()))
                .timestamp(clock.instant())
                .build());
    }

    String render(Alert alert) {
        return String.format("<b>%s</b> [%s]\n%s\n<b>Time:</b> %s UTC",
                alert.getTitle(), alert.getSeverity(), alert.getMessage(), TIME_FORMAT.format(alert.getTimestamp()));
    }
}
