package com.jsonpack.converter.cli.exception;

import java.util.List;

/**
 * Every problem found in the converter's command-line options, reported at
 * once. The message holds one problem per line.
 */
public class OptionsValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public OptionsValidationException(List<String> errors) {
        super(String.join(System.lineSeparator(), errors));
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("At least one option error is required");
        }
        this.errors = List.copyOf(errors);
    }

    /**
     * Problems in the order they were detected.
     */
    public List<String> getErrors() {
        return errors;
    }

    public int getErrorCount() {
        return errors.size();
    }
}
