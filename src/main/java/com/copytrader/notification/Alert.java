package com.copytrader.notification;

import com.copytrader.domain.enums.AlertSeverity;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Operator-facing alert built from a safety or trade event.
 */
@Data
@Builder
public class Alert {

    private AlertSeverity severity;
    private String title;
    private String message;
    private Instant timestamp;
}
