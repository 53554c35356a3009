package com.jsonpack.converter.cli.validation;

import com.jsonpack.converter.cli.exception.OptionsValidationException;
import com.jsonpack.converter.cli.model.ConvertOptions;
import com.jsonpack.converter.cli.model.ValidatedConvertOptions;
import com.jsonpack.converter.cli.model.ValidatedConvertOptions.InputSource;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ConvertOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();

    private static ConvertOptions parse(String... args) {
        return CommandLine.populateCommand(new ConvertOptions(), args);
    }

    @Test
    void testInlineTextSelectsArgumentSource() {
        ValidatedConvertOptions validated = validator.validate(parse("--to", "MSGPACK", "{}"));

        assertThat(validated.getInputSource()).isEqualTo(InputSource.ARGUMENT);
        assertThat(validated.getOutputFile()).isNull();
    }

    @Test
    void testNoInputSelectsStdin() {
        assertThat(validator.validate(parse("-t", "JSON")).getInputSource()).isEqualTo(InputSource.STDIN);
    }

    @Test
    void testExistingInputFileSelectsFileSource() throws IOException {
        Path input = Files.writeString(tempDir.resolve("in.json"), "{}");

        assertThat(validator.validate(parse("--to", "MSGPACK", "-i", input.toString())).getInputSource())
                .isEqualTo(InputSource.FILE);
    }

    @Test
    void testOutputFileIsNormalizedToAbsolutePath() {
        Path output = tempDir.resolve("sub").resolve("..").resolve("out.txt");

        ValidatedConvertOptions validated = validator.validate(parse("--to", "JSON", "-o", output.toString(), "80"));

        assertThat(validated.getOutputFile()).isEqualTo(tempDir.resolve("out.txt").toAbsolutePath().normalize());
    }

    @Test
    void testAllProblemsAreReportedTogether() {
        Path missingInput = tempDir.resolve("missing.json");
        Path missingDir = tempDir.resolve("nowhere").resolve("out.txt");

        assertThatThrownBy(() -> validator.validate(parse("--to", "MSGPACK",
                "-i", missingInput.toString(), "-o", missingDir.toString(), "--max-depth", "0")))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .containsExactly(
                                "Input file does not exist or is not a regular file: " + missingInput,
                                "Output directory does not exist: " + missingDir.getParent().toAbsolutePath().normalize(),
                                "Max depth must be in range 1-1000. Got: 0"));
    }

    @Test
    void testTextAndInputFileAreExclusive() throws IOException {
        Path input = Files.writeString(tempDir.resolve("in.json"), "{}");

        assertThatThrownBy(() -> validator.validate(parse("--to", "MSGPACK", "-i", input.toString(), "{}")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Provide either inline TEXT or --input-file, not both.");
    }

    @Test
    void testExistingOutputFileNeedsForce() throws IOException {
        Path output = Files.writeString(tempDir.resolve("out.txt"), "old");

        assertThatThrownBy(() -> validator.validate(parse("--to", "MSGPACK", "-o", output.toString(), "{}")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Use --force to overwrite.");

        assertThatCode(() -> validator.validate(parse("--to", "MSGPACK", "-o", output.toString(), "-f", "{}")))
                .doesNotThrowAnyException();
    }

    @Test
    void testOutputFileMustNotBeADirectory() {
        assertThatThrownBy(() -> validator.validate(parse("--to", "JSON", "-o", tempDir.toString(), "80")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Output file is a directory");
    }

    @Test
    void testMissingTargetIsReported() {
        // Bypasses picocli, which would reject the missing required option itself
        ConvertOptions options = new ConvertOptions();

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOf(OptionsValidationException.class)
                .satisfies(e -> assertThat(((OptionsValidationException) e).getErrors())
                        .contains("Target format is required (--to / -t)."));
    }

    @Test
    void testMaxDepthUpperBound() {
        assertThatCode(() -> validator.validate(parse("--to", "JSON", "--max-depth", "1000", "80")))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> validator.validate(parse("--to", "JSON", "--max-depth", "1001", "80")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Got: 1001");
    }
}
