package com.phillippitts.selfspy.service.crypto;

import com.phillippitts.selfspy.exception.EncryptionException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;

/**
 * AES-256-GCM payload codec.
 *
 * <p>Packed form (then Base64):
 * <pre>
 *   [12 bytes: IV] [cipher-text bytes + 16 byte tag]
 * </pre>
 * A fresh random IV is generated for every call, so encrypting the same text twice
 * yields different ciphertexts.
 */
public final class AesGcmPayloadCodec implements PayloadCodec {

    public static final String TRANSFORMATION = "AES/GCM/NoPadding";
    public static final int GCM_IV_LENGTH = 12;
    public static final int GCM_TAG_BITS = 128;

    private final SecureRandom random;

    public AesGcmPayloadCodec() {
        this(new SecureRandom());
    }

    AesGcmPayloadCodec(SecureRandom random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public String encrypt(String plaintext, SecretKey key) {
        Objects.requireNonNull(plaintext, "plaintext");
        Objects.requireNonNull(key, "key");
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buf = ByteBuffer.allocate(iv.length + ciphertext.length);
            buf.put(iv);
            buf.put(ciphertext);
            return Base64.getEncoder().encodeToString(buf.array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Encryption failed", e);
        }
    }

    @Override
    public String decrypt(String ciphertext, SecretKey key) {
        Objects.requireNonNull(ciphertext, "ciphertext");
        Objects.requireNonNull(key, "key");
        byte[] packed;
        try {
            packed = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new EncryptionException("Ciphertext is not valid Base64", e);
        }
        // IV plus at least the tag
        if (packed.length < GCM_IV_LENGTH + GCM_TAG_BITS / 8) {
            throw new EncryptionException("Ciphertext too short: " + packed.length + " bytes");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, packed, 0, GCM_IV_LENGTH));
            byte[] plaintext = cipher.doFinal(packed, GCM_IV_LENGTH, packed.length - GCM_IV_LENGTH);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Decryption failed: wrong key or tampered payload", e);
        }
    }
}
