package com.phillippitts.selfspy.service.crypto;

import com.phillippitts.selfspy.exception.EncryptionException;

import javax.crypto.SecretKey;

/**
 * Symmetric, authenticated encryption of keystroke text.
 *
 * <p>Implementations are stateless: the key is supplied on every call and never retained.
 * The ciphertext form is printable text so it can be stored in a TEXT column.
 */
public interface PayloadCodec {

    /**
     * Encrypts UTF-8 text.
     *
     * @throws EncryptionException if the key is unusable
     */
    String encrypt(String plaintext, SecretKey key);

    /**
     * Decrypts text produced by {@link #encrypt(String, SecretKey)}.
     *
     * @throws EncryptionException on a wrong key, tampered or malformed ciphertext
     */
    String decrypt(String ciphertext, SecretKey key);
}
