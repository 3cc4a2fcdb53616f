package com.copytrader.api.dto.request;

import com.copytrader.domain.enums.SignalStrategy;
import com.copytrader.domain.enums.TradeAction;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound copy-trade signal as delivered by the transport layer.
 * {@code tradeUuid} and {@code timestamp} are optional; missing values are derived.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalRequest {

    private String tradeUuid;

    @NotNull
    private SignalStrategy strategy;

    @NotNull
    private TradeAction action;

    private String token;
    private String tokenAddress;

    @NotNull
    private BigDecimal amount;

    private String walletAddress;
    private Instant timestamp;
}
