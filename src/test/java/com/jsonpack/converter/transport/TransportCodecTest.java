package com.jsonpack.converter.transport;

import com.jsonpack.converter.exception.ErrorKind;
import com.jsonpack.converter.exception.TransportDecodeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for hex/base64 detection and decoding.
 */
class TransportCodecTest {

    private static byte[] decode(String text) throws TransportDecodeException {
        return TransportCodec.decode(text, TransportCodec.detect(text));
    }

    @ParameterizedTest
    @CsvSource({
        "a1b2c3, HEX",
        "0f0f0f, HEX",
        "ABCDEF, HEX",
        "g1h2i3, BASE64",
        "z1g2h3, BASE64",
        "g6NhZ2UepGNpdHmqV29uZGVybGFuZKRuYW1lpUFsaWNl, BASE64",
        "AQ==, BASE64",
        "invalid_base64_string, BASE64"
    })
    void testDetect(String text, TextEncoding expected) {
        assertThat(TransportCodec.detect(text)).isEqualTo(expected);
    }

    @Test
    void testEmptyTextIsHex() {
        assertThat(TransportCodec.detect("")).isEqualTo(TextEncoding.HEX);
    }

    @Test
    void testDigitOnlyBase64IsReadAsHex() {
        // "1234" is valid base64 for d7 6d f8, but it is classified by its characters alone
        assertThat(TransportCodec.detect("1234")).isEqualTo(TextEncoding.HEX);
    }

    @Test
    void testNonAsciiDigitsAreNotHex() {
        assertThat(TransportCodec.detect("１２")).isEqualTo(TextEncoding.BASE64);
    }

    @Test
    void testDetectionIsRepeatable() {
        String[] samples = { "deadBEEF", "gaFhAQ==", "", "0", "a b" };
        for (String sample : samples) {
            TextEncoding first = TransportCodec.detect(sample);
            for (int i = 0; i < 5; i++) {
                assertThat(TransportCodec.detect(sample)).isEqualTo(first);
            }
        }
    }

    @Test
    void testDecodeHexEitherCase() throws Exception {
        assertThat(decode("0aFf")).containsExactly(0x0a, 0xff);
        assertThat(decode("")).isEmpty();
    }

    @Test
    void testOddLengthHexIsRejected() {
        assertThatThrownBy(() -> decode("abc"))
                .isInstanceOf(TransportDecodeException.class)
                .satisfies(e -> {
                    TransportDecodeException ex = (TransportDecodeException) e;
                    assertThat(ex.getEncoding()).isEqualTo(TextEncoding.HEX);
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.TRANSPORT_DECODE);
                    assertThat(ex.describe()).isEqualTo("Failed to decode Hex: Odd number of digits (3)");
                });
    }

    @Test
    void testExplicitHexDecodeRejectsNonHexCharacters() {
        assertThatThrownBy(() -> TransportCodec.decode("zz", TextEncoding.HEX))
                .isInstanceOf(TransportDecodeException.class)
                .hasMessage("Invalid character 'z' at index 0");
    }

    @Test
    void testDecodeBase64() throws Exception {
        assertThat(decode("gaFhAQ==")).containsExactly(0x81, 0xa1, 0x61, 0x01);
        assertThat(decode("QQ==")).containsExactly(0x41);
    }

    @Test
    void testBase64RequiresPadding() {
        assertThatThrownBy(() -> decode("QQ"))
                .isInstanceOf(TransportDecodeException.class)
                .satisfies(e -> assertThat(((TransportDecodeException) e).describe())
                        .startsWith("Failed to decode Base64: Invalid input length 2"));
    }

    @Test
    void testBase64RejectsCharactersOutsideStandardAlphabet() {
        assertThatThrownBy(() -> decode("invalid_base64_string"))
                .isInstanceOf(TransportDecodeException.class)
                .satisfies(e -> assertThat(((TransportDecodeException) e).getEncoding()).isEqualTo(TextEncoding.BASE64));
        assertThatThrownBy(() -> decode("ab_c"))
                .isInstanceOf(TransportDecodeException.class);
        assertThatThrownBy(() -> decode("ab c"))
                .isInstanceOf(TransportDecodeException.class);
    }

    @Test
    void testBase64RejectsNonCanonicalLastSymbol() {
        assertThatThrownBy(() -> decode("QR=="))
                .isInstanceOf(TransportDecodeException.class)
                .hasMessageContaining("Invalid last symbol");
    }

    @Test
    void testEncodeBase64UsesStandardAlphabetWithPadding() {
        assertThat(TransportCodec.encodeBase64(new byte[] { (byte) 0x81, (byte) 0xa1, 0x61, 0x01 })).isEqualTo("gaFhAQ==");
        assertThat(TransportCodec.encodeBase64(new byte[] { (byte) 0xfb, (byte) 0xff })).isEqualTo("+/8=");
        assertThat(TransportCodec.encodeBase64(new byte[0])).isEmpty();
    }
}
