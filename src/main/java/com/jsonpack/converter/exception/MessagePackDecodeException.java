package com.jsonpack.converter.exception;

/**
 * Malformed or unsupported MessagePack input.
 *
 * Covers truncated buffers and invalid markers as well as well-formed values
 * JSON has no shape for (binary, extension types, non-string map keys).
 */
public class MessagePackDecodeException extends ConversionException {

    private static final long serialVersionUID = 1L;

    public MessagePackDecodeException(String message) {
        super(message);
    }

    public MessagePackDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.MESSAGEPACK_DECODE;
    }

    @Override
    public String getStageLabel() {
        return "Failed to deserialize MessagePack";
    }
}
