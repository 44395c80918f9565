package com.phillippitts.selfspy.service.crypto;

import com.phillippitts.selfspy.exception.EncryptionException;

import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * Derives the AES-256 keystroke key from a password with PBKDF2-HMAC-SHA256.
 *
 * <p>The salt is fixed so the same password always yields the same key across runs;
 * the verification digest guards against a mistyped password.
 */
public final class KeyDerivation {

    public static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    public static final int KEY_SIZE_BITS = 256;
    public static final int DEFAULT_ITERATIONS = 100_000;

    private static final byte[] SALT = "selfspy-salt".getBytes(StandardCharsets.UTF_8);

    private KeyDerivation() {}

    public static SecretKey derive(String password, int iterations) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("password must not be empty");
        }
        if (iterations <= 0) {
            throw new IllegalArgumentException("iterations must be positive");
        }
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), SALT, iterations, KEY_SIZE_BITS);
        try {
            byte[] raw = SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
            return new SecretKeySpec(raw, "AES");
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
        }
    }
}
