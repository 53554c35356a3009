package com.jsonpack.converter.exception;

/**
 * A value could not be written as MessagePack.
 */
public class MessagePackEncodeException extends ConversionException {

    private static final long serialVersionUID = 1L;

    public MessagePackEncodeException(String message) {
        super(message);
    }

    public MessagePackEncodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.MESSAGEPACK_ENCODE;
    }

    @Override
    public String getStageLabel() {
        return "Failed to serialize to MessagePack";
    }
}
