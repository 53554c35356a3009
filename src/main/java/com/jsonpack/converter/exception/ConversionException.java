package com.jsonpack.converter.exception;

/**
 * Base type for failures of a single conversion stage.
 *
 * The message is the underlying cause only; {@link #getStageLabel()} names the
 * stage so the two can be joined into the user-facing error text.
 */
public abstract class ConversionException extends Exception {

    private static final long serialVersionUID = 1L;

    protected ConversionException(String message) {
        super(message);
    }

    protected ConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind getKind();

    public abstract String getStageLabel();

    /**
     * Stage label and cause, e.g. {@code "Failed to parse JSON: unexpected end-of-input"}.
     */
    public String describe() {
        return getStageLabel() + ": " + getMessage();
    }
}
