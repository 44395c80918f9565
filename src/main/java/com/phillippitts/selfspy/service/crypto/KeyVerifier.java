package com.phillippitts.selfspy.service.crypto;

import com.phillippitts.selfspy.exception.EncryptionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Checks a derived key against the verification digest in the data directory.
 *
 * <p>The digest is an encrypted magic token. On first run it is written; on later runs
 * it must decrypt back to the token, otherwise the key is rejected before any row
 * could be written with it.
 */
public final class KeyVerifier {

    private static final Logger LOG = LogManager.getLogger(KeyVerifier.class);

    static final String MAGIC_TOKEN = "selfspy-v2-verification-token";

    private final PayloadCodec codec;

    public KeyVerifier(PayloadCodec codec) {
        this.codec = codec;
    }

    /**
     * Verifies the key against {@code digestPath}, creating the digest if absent.
     *
     * @throws EncryptionException if the digest exists and the key does not match
     * @throws UncheckedIOException if the digest cannot be read or written
     */
    public void verifyOrCreate(Path digestPath, SecretKey key) {
        try {
            if (Files.exists(digestPath)) {
                String stored = Files.readString(digestPath, StandardCharsets.US_ASCII).trim();
                if (!matches(stored, key)) {
                    throw new EncryptionException("Password does not match digest at " + digestPath);
                }
                LOG.debug("Encryption key verified against {}", digestPath);
                return;
            }
            Path parent = digestPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(digestPath, codec.encrypt(MAGIC_TOKEN, key), StandardCharsets.US_ASCII);
            LOG.info("Created password digest at {}", digestPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot access password digest " + digestPath, e);
        }
    }

    private boolean matches(String stored, SecretKey key) {
        try {
            return MAGIC_TOKEN.equals(codec.decrypt(stored, key));
        } catch (EncryptionException e) {
            LOG.debug("Digest decryption failed: {}", e.getMessage());
            return false;
        }
    }
}
