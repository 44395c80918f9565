package com.phillippitts.selfspy.service.crypto;

import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyDerivationTest {

    @Test
    void samePasswordYieldsSameKey() {
        SecretKey a = KeyDerivation.derive("pw", 10_000);
        SecretKey b = KeyDerivation.derive("pw", 10_000);

        assertThat(a.getEncoded()).isEqualTo(b.getEncoded());
        assertThat(a.getEncoded()).hasSize(32);
        assertThat(a.getAlgorithm()).isEqualTo("AES");
    }

    @Test
    void differentPasswordsYieldDifferentKeys() {
        assertThat(KeyDerivation.derive("pw1", 10_000).getEncoded())
                .isNotEqualTo(KeyDerivation.derive("pw2", 10_000).getEncoded());
    }

    @Test
    void rejectsEmptyPasswordAndBadIterations() {
        assertThatThrownBy(() -> KeyDerivation.derive("", 10_000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> KeyDerivation.derive(null, 10_000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> KeyDerivation.derive("pw", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
