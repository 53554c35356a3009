package com.jsonpack.converter.cli.model;

import java.nio.file.Path;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the command. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    InputSource inputSource;
    Path outputFile;

    public enum InputSource {
        ARGUMENT,
        FILE,
        STDIN
    }
}
