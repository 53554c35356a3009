package com.jsonpack.converter.convert;

import com.jsonpack.converter.exception.ConversionException;
import com.jsonpack.converter.exception.ErrorKind;
import com.jsonpack.converter.transport.TextEncoding;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one conversion: either the output text or a single
 * stage-labelled error message, never both.
 */
@Value
@Builder
public class ConversionResult {
    boolean success;
    String output;
    ErrorKind errorKind;
    String errorMessage;

    /**
     * Alphabet the input was read as; only set for MessagePack to JSON.
     */
    TextEncoding inputEncoding;

    public static ConversionResult success(String output, TextEncoding inputEncoding) {
        return ConversionResult.builder()
                .success(true)
                .output(output)
                .inputEncoding(inputEncoding)
                .build();
    }

    public static ConversionResult failure(ConversionException cause, TextEncoding inputEncoding) {
        return ConversionResult.builder()
                .success(false)
                .errorKind(cause.getKind())
                .errorMessage(cause.describe())
                .inputEncoding(inputEncoding)
                .build();
    }
}
