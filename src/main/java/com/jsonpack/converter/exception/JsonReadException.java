package com.jsonpack.converter.exception;

/**
 * Malformed JSON input.
 */
public class JsonReadException extends ConversionException {

    private static final long serialVersionUID = 1L;

    public JsonReadException(String message) {
        super(message);
    }

    public JsonReadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.JSON_PARSE;
    }

    @Override
    public String getStageLabel() {
        return "Failed to parse JSON";
    }
}
