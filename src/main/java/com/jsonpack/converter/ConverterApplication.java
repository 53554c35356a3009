package com.jsonpack.converter;

import com.jsonpack.converter.cli.ConvertCommand;
import picocli.CommandLine;

/**
 * Main entry point for the JSON / MessagePack converter.
 * Reads one document from an argument, a file or stdin and writes the
 * converted text to stdout or a file.
 */
public class ConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
