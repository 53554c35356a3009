package com.jsonpack.converter.cli.output;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonpack.converter.cli.model.ConvertOptions;
import com.jsonpack.converter.cli.model.ValidatedConvertOptions;
import com.jsonpack.converter.convert.ConversionResult;

/**
 * Responsible only for printing CLI output for the converter.
 * No validation, no execution.
 *
 * Conversion output and error text go to the command's writers verbatim;
 * everything else is logged, which keeps stdout limited to the result.
 */
public class ConversionResultPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConversionResultPrinter.class);

    public void printBanner(ConvertOptions o, ValidatedConvertOptions v) {
        log.debug("Target Format: {}", o.getTarget());
        log.debug("Input Source: {}", v.getInputSource());
        if (o.getInputFile() != null) {
            log.debug("Input File: {}", o.getInputFile().toAbsolutePath());
        }
        log.debug("Output File: {}", v.getOutputFile() != null ? v.getOutputFile() : "stdout");
        log.debug("Max Depth: {}", o.getMaxDepth());
    }

    public void printSuccess(PrintWriter out, ConversionResult result) {
        if (result.getInputEncoding() != null) {
            log.debug("Input read as {}", result.getInputEncoding().getDisplayName());
        }
        out.println(result.getOutput());
        out.flush();
    }

    public void printWritten(Path outputFile, ConversionResult result) {
        log.info("Wrote {} characters to {}", result.getOutput().length(), outputFile);
    }

    public void printFailure(PrintWriter err, ConversionResult result) {
        log.debug("Conversion failed: {}", result.getErrorKind());
        err.println(result.getErrorMessage());
        err.flush();
    }

    public void printValidationErrors(PrintWriter err, List<String> errors) {
        errors.forEach(err::println);
        err.flush();
    }
}
