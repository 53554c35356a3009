package com.jsonpack.converter.transport;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Text alphabets used to carry raw MessagePack bytes.
 */
@Getter
@RequiredArgsConstructor
public enum TextEncoding {
    /**
     * Two hexadecimal digits per byte, either case.
     */
    HEX("Hex"),

    /**
     * RFC 4648 standard alphabet with '=' padding.
     */
    BASE64("Base64");

    private final String displayName;
}
