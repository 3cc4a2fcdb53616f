package com.copytrader.entity;

import com.copytrader.domain.enums.SignalStrategy;
import com.copytrader.domain.enums.TradeAction;
import com.copytrader.domain.enums.TradeStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table.
 *
 * <p>The primary key is the signal's trade UUID, so a second insert of the same signal
 * fails on the key. {@code version} serializes concurrent status writes.
 */
@Entity
@Table(
        name = "trades",
        indexes = {
            @Index(name = "idx_trades_status_updated", columnList = "status, updated_at"),
            @Index(name = "idx_trades_wallet_token", columnList = "wallet_address, token")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(name = "trade_uuid", length = 64)
    private String tradeUuid;

    @Column(name = "wallet_address", length = 44, nullable = false)
    private String walletAddress;

    @Column(length = 64, nullable = false)
    private String token;

    @Column(name = "token_address", length = 44)
    private String tokenAddress;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(16)", nullable = false)
    private SignalStrategy strategy;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(8)", nullable = false)
    private TradeAction action;

    @Column(precision = 20, scale = 9, nullable = false)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(16)", nullable = false)
    private TradeStatus status;

    @Column(name = "retry_count")
    private int retryCount;

    @Column(name = "tx_signature", length = 100)
    private String txSignature;

    @Column(name = "exit_tx_signature", length = 100)
    private String exitTxSignature;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "pnl_sol", precision = 20, scale = 9)
    private BigDecimal pnlSol;

    @Column(name = "pnl_usd", precision = 15, scale = 2)
    private BigDecimal pnlUsd;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Version
    private Long version;
}
