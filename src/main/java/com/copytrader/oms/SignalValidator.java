package com.copytrader.oms;

import com.copytrader.api.dto.request.SignalRequest;
import com.copytrader.domain.enums.SignalStrategy;
import com.copytrader.domain.enums.TradeAction;
import com.copytrader.exception.SignalValidationException;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Semantic checks on an inbound signal. Collects every violation before failing so the
 * caller sees all field errors at once.
 */
public final class SignalValidator {

    static final int MIN_WALLET_LENGTH = 32;
    static final int MAX_WALLET_LENGTH = 44;
    static final BigDecimal MAX_SIGNAL_AMOUNT = new BigDecimal("100");
    static final int MAX_TRADE_UUID_LENGTH = 64;

    private SignalValidator() {}

    public static void validate(SignalRequest request) {
        Map<String, Object> errors = new LinkedHashMap<>();

        String tradeUuid = request.getTradeUuid();
        if (tradeUuid != null && (tradeUuid.isBlank() || tradeUuid.length() > MAX_TRADE_UUID_LENGTH)) {
            errors.put("tradeUuid", "must be 1-" + MAX_TRADE_UUID_LENGTH + " characters when supplied");
        }

        if (request.getToken() == null || request.getToken().isBlank()) {
            errors.put("token", "must not be empty");
        }

        String wallet = request.getWalletAddress();
        if (wallet == null || wallet.length() < MIN_WALLET_LENGTH || wallet.length() > MAX_WALLET_LENGTH) {
            errors.put("walletAddress", "must be " + MIN_WALLET_LENGTH + "-" + MAX_WALLET_LENGTH + " characters");
        }

        BigDecimal amount = request.getAmount();
        if (amount == null || amount.signum() <= 0) {
            errors.put("amount", "must be positive");
        } else if (amount.compareTo(MAX_SIGNAL_AMOUNT) > 0) {
            errors.put("amount", "must not exceed " + MAX_SIGNAL_AMOUNT);
        }

        if (request.getStrategy() == null) {
            errors.put("strategy", "is required");
        }
        if (request.getAction() == null) {
            errors.put("action", "is required");
        }
        if (request.getStrategy() == SignalStrategy.EXIT && request.getAction() != null
                && request.getAction() != TradeAction.SELL) {
            errors.put("action", "EXIT signals must be SELL");
        }

        if (!errors.isEmpty()) {
            throw new SignalValidationException("Signal validation failed", errors);
        }
    }
}
