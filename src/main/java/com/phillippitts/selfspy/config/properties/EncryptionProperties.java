package com.phillippitts.selfspy.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Keystroke encryption settings. The password is only used to derive a key at
 * startup; neither is ever written to the store.
 *
 * @param enabled encrypt keystroke text before it is persisted
 * @param password secret the key is derived from (usually supplied via SELFSPY_PASSWORD)
 * @param digestFile file name, inside the data directory, of the key verification digest
 * @param iterations PBKDF2 iteration count
 */
@ConfigurationProperties(prefix = "selfspy.encryption")
@Validated
public record EncryptionProperties(
        boolean enabled,

        String password,

        @NotBlank(message = "Digest file name must not be blank")
        String digestFile,

        @Min(value = 10_000, message = "PBKDF2 iterations must be at least 10000")
        int iterations
) {

    public EncryptionProperties {
        digestFile = digestFile == null ? "password.digest" : digestFile;
        iterations = iterations == 0 ? 100_000 : iterations;
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }

    @Override
    public String toString() {
        return "EncryptionProperties[enabled=" + enabled + ", password=" + (hasPassword() ? "****" : "<none>")
                + ", digestFile=" + digestFile + ", iterations=" + iterations + "]";
    }
}
