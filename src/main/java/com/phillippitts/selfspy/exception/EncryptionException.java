package com.phillippitts.selfspy.exception;

/**
 * Thrown when a payload cannot be encrypted or decrypted: wrong key, tampered
 * ciphertext, or malformed input. Affects a single record, never a whole flush.
 */
public class EncryptionException extends SelfspyException {

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
