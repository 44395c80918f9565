package com.phillippitts.selfspy.service.crypto;

import com.phillippitts.selfspy.exception.EncryptionException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeystrokeProtectorTest {

    private final AesGcmPayloadCodec codec = new AesGcmPayloadCodec();

    @Test
    void plaintextPassesThroughUnflagged() {
        KeystrokeProtector protector = KeystrokeProtector.plaintext();

        ProtectedPayload p = protector.protect("abc");

        assertThat(protector.isEncrypting()).isFalse();
        assertThat(p.payload()).isEqualTo("abc");
        assertThat(p.encrypted()).isFalse();
        assertThat(protector.reveal("abc", false)).isEqualTo("abc");
    }

    @Test
    void encryptingProtectorFlagsPayload() {
        KeystrokeProtector protector = KeystrokeProtector.encrypting(codec, KeyDerivation.derive("pw", 10_000));

        ProtectedPayload p = protector.protect("abc");

        assertThat(protector.isEncrypting()).isTrue();
        assertThat(p.encrypted()).isTrue();
        assertThat(p.payload()).isNotEqualTo("abc");
        assertThat(protector.reveal(p.payload(), true)).isEqualTo("abc");
    }

    @Test
    void nullTextBecomesEmpty() {
        assertThat(KeystrokeProtector.plaintext().protect(null).payload()).isEmpty();
    }

    @Test
    void revealWithoutKeyFailsForEncryptedPayload() {
        assertThatThrownBy(() -> KeystrokeProtector.plaintext().reveal("AAAA", true))
                .isInstanceOf(EncryptionException.class);
    }
}
