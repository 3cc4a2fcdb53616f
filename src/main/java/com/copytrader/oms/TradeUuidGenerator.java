package com.copytrader.oms;

import com.copytrader.domain.enums.TradeAction;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Derives the idempotency key of a signal.
 *
 * <p>A caller-supplied UUID always wins. Otherwise the key is the hex of the first
 * 16 bytes of SHA-256 over: timestamp millis (8 bytes, big-endian), token, action,
 * amount as a plain decimal string, wallet. Redelivery of the same webhook therefore
 * yields the same key.
 */
public final class TradeUuidGenerator {

    private TradeUuidGenerator() {}

    public static String generate(
            String suppliedUuid,
            Instant timestamp,
            String token,
            TradeAction action,
            BigDecimal amount,
            String walletAddress) {
        if (suppliedUuid != null && !suppliedUuid.isBlank()) {
            return suppliedUuid.trim();
        }
        MessageDigest digest = sha256();
        digest.update(ByteBuffer.allocate(Long.BYTES).putLong(timestamp.toEpochMilli()).array());
        digest.update(token.getBytes(StandardCharsets.UTF_8));
        digest.update(action.name().getBytes(StandardCharsets.UTF_8));
        digest.update(amount.stripTrailingZeros().toPlainString().getBytes(StandardCharsets.UTF_8));
        digest.update(walletAddress.getBytes(StandardCharsets.UTF_8));
        byte[] hash = digest.digest();
        return HexFormat.of().formatHex(hash, 0, 16);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
