package com.copytrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the dead_letters table.
 * Holds signals that were admitted but could not be executed, with the original
 * payload for manual inspection. Also consulted by duplicate detection.
 */
@Entity
@Table(name = "dead_letters")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeadLetterEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_uuid", length = 64, nullable = false, unique = true)
    private String tradeUuid;

    @Column(columnDefinition = "CLOB")
    private String payload;

    @Column(length = 32, nullable = false)
    private String reason;

    @Column(name = "error_details", length = 2000)
    private String errorDetails;

    @Column(name = "retry_count")
    private int retryCount;

    @Column(name = "can_retry")
    private boolean canRetry;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
