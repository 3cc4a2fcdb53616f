package com.copytrader.solana;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Base58 (Bitcoin alphabet) codec for Solana keys, signatures and blockhashes.
 */
public final class Base58 {

    private static final char[] ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz".toCharArray();
    private static final int[] INDEXES = new int[128];
    private static final BigInteger BASE = BigInteger.valueOf(58);

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length; i++) {
            INDEXES[ALPHABET[i]] = i;
        }
    }

    private Base58() {}

    public static String encode(byte[] input) {
        if (input.length == 0) {
            return "";
        }
        int leadingZeros = 0;
        while (leadingZeros < input.length && input[leadingZeros] == 0) {
            leadingZeros++;
        }
        StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, input);
        while (value.signum() > 0) {
            BigInteger[] divRem = value.divideAndRemainder(BASE);
            sb.append(ALPHABET[divRem[1].intValue()]);
            value = divRem[0];
        }
        for (int i = 0; i < leadingZeros; i++) {
            sb.append(ALPHABET[0]);
        }
        return sb.reverse().toString();
    }

    /**
     * @throws IllegalArgumentException on characters outside the alphabet
     */
    public static byte[] decode(String input) {
        if (input.isEmpty()) {
            return new byte[0];
        }
        BigInteger value = BigInteger.ZERO;
        int leadingZeros = 0;
        boolean leading = true;
        for (char c : input.toCharArray()) {
            int digit = c < 128 ? INDEXES[c] : -1;
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid base58 character '" + c + "'");
            }
            if (leading && digit == 0) {
                leadingZeros++;
            } else {
                leading = false;
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }
        byte[] magnitude = value.signum() == 0 ? new byte[0] : value.toByteArray();
        // BigInteger may prepend a sign byte
        int stripSign = magnitude.length > 1 && magnitude[0] == 0 ? 1 : 0;
        byte[] result = new byte[leadingZeros + magnitude.length - stripSign];
        System.arraycopy(magnitude, stripSign, result, leadingZeros, magnitude.length - stripSign);
        return result;
    }

    /** Whether {@code value} decodes to exactly {@code length} bytes. */
    public static boolean isValid(String value, int length) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            return decode(value).length == length;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
