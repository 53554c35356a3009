package com.jsonpack.converter.exception;

/**
 * Failure categories surfaced to callers of the conversion operations.
 */
public enum ErrorKind {
    /**
     * Input JSON text is malformed.
     */
    JSON_PARSE,

    /**
     * A value could not be written as MessagePack.
     */
    MESSAGEPACK_ENCODE,

    /**
     * Input bytes are not one well-formed MessagePack value with a JSON shape.
     */
    MESSAGEPACK_DECODE,

    /**
     * Input text is neither valid hexadecimal nor valid base64.
     */
    TRANSPORT_DECODE,

    /**
     * A decoded value could not be written as JSON text.
     */
    JSON_SERIALIZE
}
