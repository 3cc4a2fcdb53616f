package com.copytrader.event;

import com.copytrader.domain.enums.AlertSeverity;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a safety control changes state: circuit breaker trips and resumes,
 * RPC failover and recovery.
 *
 * <p>Listeners must not feed back into trading control flow; the notification listener
 * runs asynchronously so a slow alert channel never delays a trip.
 */
@Getter
public class SafetyEvent extends ApplicationEvent {

    private final SafetyEventType eventType;
    private final AlertSeverity severity;
    private final String message;
    private final Map<String, Object> details;

    public SafetyEvent(Object source, SafetyEventType eventType, AlertSeverity severity, String message) {
        this(source, eventType, severity, message, new HashMap<>());
    }

    public SafetyEvent(
            Object source,
            SafetyEventType eventType,
            AlertSeverity severity,
            String message,
            Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.severity = severity;
        this.message = message;
        this.details = details != null ? details : new HashMap<>();
    }
}
