package com.phillippitts.selfspy.service.crypto;

import com.phillippitts.selfspy.exception.EncryptionException;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.util.Base64;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AesGcmPayloadCodecTest {

    private static final SecretKey KEY = KeyDerivation.derive("correct horse", 10_000);
    private static final SecretKey OTHER_KEY = KeyDerivation.derive("battery staple", 10_000);

    private final AesGcmPayloadCodec codec = new AesGcmPayloadCodec();

    @Test
    void decryptRecoversPlaintext() {
        String ct = codec.encrypt("hello <[Enter]>", KEY);

        assertThat(ct).doesNotContain("hello");
        assertThat(codec.decrypt(ct, KEY)).isEqualTo("hello <[Enter]>");
    }

    @Test
    void multibyteTextRoundTrips() {
        List<String> samples = List.of(
                "héllo 日本語 😀",
                "Ünïcödé straße",
                "e\u0301 combining accent",
                "مرحبا بالعالم",
                "👩\u200D💻 at the keyboard",
                "𝔘𝔫𝔦𝔠𝔬𝔡𝔢 <[Shift]>");

        for (String text : samples) {
            assertThat(codec.decrypt(codec.encrypt(text, KEY), KEY)).as(text).isEqualTo(text);
        }
    }

    @Test
    void randomCodePointStringsRoundTrip() {
        Random random = new Random(20260105L);
        for (int i = 0; i < 200; i++) {
            StringBuilder text = new StringBuilder();
            int length = random.nextInt(40);
            while (text.codePointCount(0, text.length()) < length) {
                int cp = random.nextInt(Character.MAX_CODE_POINT + 1);
                if (cp < 0x20 || (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE)) {
                    continue;
                }
                text.appendCodePoint(cp);
            }
            String plain = text.toString();

            assertThat(codec.decrypt(codec.encrypt(plain, KEY), KEY)).isEqualTo(plain);
        }
    }

    @Test
    void emptyStringIsEncryptedToo() {
        String ct = codec.encrypt("", KEY);

        assertThat(ct).isNotEmpty();
        assertThat(codec.decrypt(ct, KEY)).isEmpty();
    }

    @Test
    void freshIvPerCall() {
        assertThat(codec.encrypt("same", KEY)).isNotEqualTo(codec.encrypt("same", KEY));
    }

    @Test
    void ciphertextCarriesIvAndTag() {
        byte[] raw = Base64.getDecoder().decode(codec.encrypt("abc", KEY));
        assertThat(raw).hasSize(AesGcmPayloadCodec.GCM_IV_LENGTH + 3 + AesGcmPayloadCodec.GCM_TAG_BITS / 8);
    }

    @Test
    void wrongKeyFails() {
        String ct = codec.encrypt("secret", KEY);

        assertThatThrownBy(() -> codec.decrypt(ct, OTHER_KEY))
                .isInstanceOf(EncryptionException.class);
    }

    @Test
    void tamperedCiphertextFails() {
        byte[] raw = Base64.getDecoder().decode(codec.encrypt("secret", KEY));
        raw[raw.length - 1] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(raw);

        assertThatThrownBy(() -> codec.decrypt(tampered, KEY))
                .isInstanceOf(EncryptionException.class);
    }

    @Test
    void malformedInputFails() {
        assertThatThrownBy(() -> codec.decrypt("not base64 !!", KEY))
                .isInstanceOf(EncryptionException.class);
        assertThatThrownBy(() -> codec.decrypt(Base64.getEncoder().encodeToString(new byte[4]), KEY))
                .isInstanceOf(EncryptionException.class);
    }
}
