package com.jsonpack.converter.exception;

import com.jsonpack.converter.transport.TextEncoding;

/**
 * Input text could not be decoded with the alphabet it was classified as.
 */
public class TransportDecodeException extends ConversionException {

    private static final long serialVersionUID = 1L;

    private final TextEncoding encoding;

    public TransportDecodeException(TextEncoding encoding, String message) {
        super(message);
        this.encoding = encoding;
    }

    public TransportDecodeException(TextEncoding encoding, String message, Throwable cause) {
        super(message, cause);
        this.encoding = encoding;
    }

    public TextEncoding getEncoding() {
        return encoding;
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.TRANSPORT_DECODE;
    }

    @Override
    public String getStageLabel() {
        return "Failed to decode " + encoding.getDisplayName();
    }
}
