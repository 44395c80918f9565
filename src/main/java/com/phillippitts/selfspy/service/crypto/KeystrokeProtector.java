package com.phillippitts.selfspy.service.crypto;

import com.phillippitts.selfspy.exception.EncryptionException;

import javax.crypto.SecretKey;
import java.util.Objects;

/**
 * Applies the configured encryption policy to keystroke text.
 *
 * <p>With a key, {@link #protect(String)} always encrypts and flags the payload encrypted;
 * without one it passes text through flagged plaintext. A payload is never flagged
 * encrypted unless the codec actually ran.
 */
public final class KeystrokeProtector {

    private final PayloadCodec codec;
    private final SecretKey key;

    private KeystrokeProtector(PayloadCodec codec, SecretKey key) {
        this.codec = codec;
        this.key = key;
    }

    public static KeystrokeProtector encrypting(PayloadCodec codec, SecretKey key) {
        return new KeystrokeProtector(Objects.requireNonNull(codec, "codec"), Objects.requireNonNull(key, "key"));
    }

    public static KeystrokeProtector plaintext() {
        return new KeystrokeProtector(null, null);
    }

    public boolean isEncrypting() {
        return key != null;
    }

    /**
     * @throws EncryptionException if encryption fails for this payload
     */
    public ProtectedPayload protect(String text) {
        String value = text == null ? "" : text;
        if (key == null) {
            return new ProtectedPayload(value, false);
        }
        return new ProtectedPayload(codec.encrypt(value, key), true);
    }

    /**
     * Recovers the text of a stored payload.
     *
     * @throws EncryptionException if the payload is encrypted and cannot be decrypted,
     *                             including when no key is configured
     */
    public String reveal(String payload, boolean encrypted) {
        if (!encrypted) {
            return payload;
        }
        if (key == null) {
            throw new EncryptionException("No key configured to decrypt payload");
        }
        return codec.decrypt(payload, key);
    }
}
