package com.jsonpack.converter.transport;

import java.util.Base64;
import java.util.HexFormat;

import com.jsonpack.converter.exception.TransportDecodeException;

/**
 * Moves raw bytes in and out of text.
 *
 * Output is always standard base64. Input is classified by its character set:
 * text made only of ASCII hex digits is hexadecimal, anything else is base64.
 * The rule is a heuristic. Base64 text that happens to use only the characters
 * {@code 0-9a-fA-F} (for example {@code "1234"}) is read as hex.
 */
public final class TransportCodec {
    private static final HexFormat HEX = HexFormat.of();

    private TransportCodec() {
        // Utility class
    }

    public static String encodeBase64(byte[] bytes) {
        return Base64.getEncoder().encodeToString(bytes);
    }

    /**
     * Classifies text as {@link TextEncoding#HEX} when every character is an
     * ASCII hex digit, {@link TextEncoding#BASE64} otherwise. The empty string
     * is hex.
     */
    public static TextEncoding detect(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (!isAsciiHexDigit(text.charAt(i))) {
                return TextEncoding.BASE64;
            }
        }
        return TextEncoding.HEX;
    }

    /**
     * Decodes text with the given alphabet, normally the one {@link #detect(String)}
     * picked for it.
     */
    public static byte[] decode(String text, TextEncoding encoding) throws TransportDecodeException {
        return switch (encoding) {
            case HEX -> decodeHex(text);
            case BASE64 -> decodeBase64(text);
        };
    }

    static byte[] decodeHex(String text) throws TransportDecodeException {
        if (text.length() % 2 != 0) {
            throw new TransportDecodeException(TextEncoding.HEX,
                    "Odd number of digits (" + text.length() + ")");
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isAsciiHexDigit(text.charAt(i))) {
                throw new TransportDecodeException(TextEncoding.HEX,
                        "Invalid character '" + text.charAt(i) + "' at index " + i);
            }
        }
        return HEX.parseHex(text);
    }

    static byte[] decodeBase64(String text) throws TransportDecodeException {
        if (text.length() % 4 != 0) {
            throw new TransportDecodeException(TextEncoding.BASE64,
                    "Invalid input length " + text.length() + ", expected a padded multiple of 4");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(text);
        } catch (IllegalArgumentException e) {
            throw new TransportDecodeException(TextEncoding.BASE64, e.getMessage(), e);
        }
        // The JDK decoder tolerates non-zero unused bits in the last symbol.
        if (!encodeBase64(bytes).equals(text)) {
            throw new TransportDecodeException(TextEncoding.BASE64,
                    "Invalid last symbol, input is not canonical base64");
        }
        return bytes;
    }

    private static boolean isAsciiHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
