package com.phillippitts.selfspy.config;

import com.phillippitts.selfspy.config.properties.EncryptionProperties;
import com.phillippitts.selfspy.config.properties.MonitorProperties;
import com.phillippitts.selfspy.service.crypto.AesGcmPayloadCodec;
import com.phillippitts.selfspy.service.crypto.KeyDerivation;
import com.phillippitts.selfspy.service.crypto.KeyVerifier;
import com.phillippitts.selfspy.service.crypto.KeystrokeProtector;
import com.phillippitts.selfspy.service.crypto.PayloadCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.crypto.SecretKey;
import java.nio.file.Path;

/**
 * Derives and verifies the keystroke key at startup.
 *
 * <p>A wrong password fails startup. Encryption enabled without a password falls back
 * to plaintext storage with a warning; every such row is flagged unencrypted.
 */
@Configuration
public class EncryptionConfig {

    private static final Logger LOG = LogManager.getLogger(EncryptionConfig.class);

    @Bean
    public PayloadCodec payloadCodec() {
        return new AesGcmPayloadCodec();
    }

    @Bean
    public KeystrokeProtector keystrokeProtector(PayloadCodec codec,
                                                 EncryptionProperties encryption,
                                                 MonitorProperties monitor) {
        if (!encryption.enabled()) {
            LOG.info("Keystroke encryption disabled by configuration");
            return KeystrokeProtector.plaintext();
        }
        if (!encryption.hasPassword()) {
            LOG.warn("Keystroke encryption enabled but no password configured (selfspy.encryption.password); "
                    + "keystrokes will be stored unencrypted");
            return KeystrokeProtector.plaintext();
        }
        SecretKey key = KeyDerivation.derive(encryption.password(), encryption.iterations());
        Path digest = Path.of(monitor.getDataDir()).resolve(encryption.digestFile());
        new KeyVerifier(codec).verifyOrCreate(digest, key);
        LOG.info("Keystroke encryption enabled (AES-256-GCM, PBKDF2 iterations={})", encryption.iterations());
        return KeystrokeProtector.encrypting(codec, key);
    }
}
