package com.copytrader.solana;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.EdECPrivateKeySpec;
import java.security.spec.NamedParameterSpec;
import java.util.Arrays;

/**
 * Signs transaction messages with the operator's Ed25519 key.
 *
 * <p>The keypair is the usual 64-byte Solana format: 32-byte seed followed by the
 * 32-byte public key, base58-encoded.
 */
public class TransactionSigner {

    private static final int KEYPAIR_LENGTH = 64;
    private static final int SEED_LENGTH = 32;

    private final PrivateKey privateKey;
    private final byte[] publicKey;

    public TransactionSigner(String base58Keypair) {
        if (base58Keypair == null || base58Keypair.isBlank()) {
            throw new IllegalArgumentException("Operator keypair is not configured");
        }
        byte[] keypair = Base58.decode(base58Keypair.trim());
        if (keypair.length != KEYPAIR_LENGTH) {
            throw new IllegalArgumentException("Operator keypair must be 64 bytes, got " + keypair.length);
        }
        this.publicKey = Arrays.copyOfRange(keypair, SEED_LENGTH, KEYPAIR_LENGTH);
        try {
            KeyFactory keyFactory = KeyFactory.getInstance("Ed25519");
            this.privateKey = keyFactory.generatePrivate(new EdECPrivateKeySpec(
                    NamedParameterSpec.ED25519, Arrays.copyOfRange(keypair, 0, SEED_LENGTH)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 is not available", e);
        }
    }

    public String publicKeyBase58() {
        return Base58.encode(publicKey);
    }

    public byte[] publicKey() {
        return publicKey.clone();
    }

    /** @return 64-byte Ed25519 signature over {@code message} */
    public byte[] sign(byte[] message) {
        try {
            Signature signature = Signature.getInstance("Ed25519");
            signature.initSign(privateKey);
            signature.update(message);
            return signature.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign transaction", e);
        }
    }
}
