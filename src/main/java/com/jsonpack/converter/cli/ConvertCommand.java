package com.jsonpack.converter.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonpack.converter.cli.exception.OptionsValidationException;
import com.jsonpack.converter.cli.model.ConvertOptions;
import com.jsonpack.converter.cli.model.TargetFormat;
import com.jsonpack.converter.cli.model.ValidatedConvertOptions;
import com.jsonpack.converter.cli.output.ConversionResultPrinter;
import com.jsonpack.converter.cli.validation.ConvertOptionsValidator;
import com.jsonpack.converter.convert.ConversionResult;
import com.jsonpack.converter.convert.ConversionService;
import com.jsonpack.converter.convert.ConverterConfig;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command converting between JSON and MessagePack text.
 */
@Command(
        name = "msgpack-json",
        mixinStandardHelpOptions = true,
        version = "msgpack-json-converter 1.0.0",
        description = "Converts JSON to base64 MessagePack, or hex/base64 MessagePack to pretty-printed JSON."
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options = new ConvertOptions();

    @Spec
    private CommandSpec spec;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConversionResultPrinter printer = new ConversionResultPrinter();
    private final InputStream stdin;

    public ConvertCommand() {
        this(System.in);
    }

    public ConvertCommand(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ValidatedConvertOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            log.debug("Rejected options with {} problem(s)", e.getErrorCount());
            printer.printValidationErrors(err, e.getErrors());
            return 1;
        }

        printer.printBanner(options, validated);

        try {
            String input = readInput(validated);

            ConversionService service = new ConversionService(ConverterConfig.builder()
                    .maxNestingDepth(options.getMaxDepth())
                    .build());

            // Files and piped input usually end with a newline; JSON tolerates it, hex and base64 do not.
            ConversionResult result = options.getTarget() == TargetFormat.MSGPACK
                    ? service.jsonToMessagePack(input)
                    : service.messagePackToJson(input.strip());

            if (!result.isSuccess()) {
                printer.printFailure(err, result);
                return 1;
            }

            if (validated.getOutputFile() != null) {
                Files.writeString(validated.getOutputFile(), result.getOutput(), StandardCharsets.UTF_8);
                printer.printWritten(validated.getOutputFile(), result);
            } else {
                printer.printSuccess(out, result);
            }
            return 0;

        } catch (IOException e) {
            log.error("Conversion failed with I/O error", e);
            err.println("I/O error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private String readInput(ValidatedConvertOptions validated) throws IOException {
        return switch (validated.getInputSource()) {
            case ARGUMENT -> options.getInputText();
            case FILE -> Files.readString(options.getInputFile(), StandardCharsets.UTF_8);
            case STDIN -> new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        };
    }
}
