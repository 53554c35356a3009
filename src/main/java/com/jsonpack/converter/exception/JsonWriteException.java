package com.jsonpack.converter.exception;

public class JsonWriteException extends ConversionException {

    private static final long serialVersionUID = 1L;

    public JsonWriteException(String message) {
        super(message);
    }

    public JsonWriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.JSON_SERIALIZE;
    }

    @Override
    public String getStageLabel() {
        return "Failed to serialize to JSON";
    }
}
