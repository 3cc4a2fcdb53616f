package com.copytrader.solana;

import java.util.Arrays;

/**
 * Just enough of the Solana transaction wire format to re-sign an unsigned transaction
 * from the swap aggregator.
 *
 * <pre>
 * transaction := compact-u16 numSignatures, numSignatures * 64-byte signature, message
 * message     := [0x80 | version] (v0 only), 3-byte header, compact-u16 numKeys,
 *                numKeys * 32-byte key, 32-byte recent blockhash, ...
 * </pre>
 */
public final class SolanaTransactionCodec {

    static final int SIGNATURE_LENGTH = 64;
    static final int KEY_LENGTH = 32;
    private static final int HEADER_LENGTH = 3;
    private static final int VERSION_PREFIX_MASK = 0x80;

    private SolanaTransactionCodec() {}

    /**
     * Replaces the recent blockhash and writes the fee payer signature into slot 0.
     *
     * @return the signed wire bytes; the input is not modified
     */
    public static byte[] replaceBlockhashAndSign(byte[] transaction, byte[] blockhash, TransactionSigner signer) {
        if (blockhash.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Blockhash must be 32 bytes, got " + blockhash.length);
        }
        byte[] tx = transaction.clone();

        int[] sigCount = readCompactU16(tx, 0);
        int numSignatures = sigCount[0];
        if (numSignatures < 1) {
            throw new IllegalArgumentException("Transaction has no signature slots");
        }
        int messageOffset = sigCount[1] + numSignatures * SIGNATURE_LENGTH;

        int cursor = messageOffset;
        if ((tx[cursor] & VERSION_PREFIX_MASK) != 0) {
            cursor++;
        }
        cursor += HEADER_LENGTH;
        int[] keyCount = readCompactU16(tx, cursor);
        cursor = keyCount[1] + keyCount[0] * KEY_LENGTH;
        if (cursor + KEY_LENGTH > tx.length) {
            throw new IllegalArgumentException("Truncated transaction message");
        }
        System.arraycopy(blockhash, 0, tx, cursor, KEY_LENGTH);

        byte[] message = Arrays.copyOfRange(tx, messageOffset, tx.length);
        byte[] signature = signer.sign(message);
        System.arraycopy(signature, 0, tx, sigCount[1], SIGNATURE_LENGTH);
        return tx;
    }

    /** Base58 of the first signature slot, the transaction id. */
    public static String firstSignature(byte[] transaction) {
        int offset = readCompactU16(transaction, 0)[1];
        return Base58.encode(Arrays.copyOfRange(transaction, offset, offset + SIGNATURE_LENGTH));
    }

    /**
     * @return {value, offset after the encoded value}
     */
    static int[] readCompactU16(byte[] data, int offset) {
        int value = 0;
        int cursor = offset;
        for (int shift = 0; shift < 21; shift += 7) {
            if (cursor >= data.length) {
                throw new IllegalArgumentException("Truncated compact-u16 at offset " + offset);
            }
            int b = data[cursor++] & 0xFF;
            value |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return new int[] {value, cursor};
            }
        }
        throw new IllegalArgumentException("Invalid compact-u16 at offset " + offset);
    }
}
