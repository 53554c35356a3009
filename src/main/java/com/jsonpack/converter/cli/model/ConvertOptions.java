package com.jsonpack.converter.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the converter. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Option(names = { "--to", "-t" }, required = true, description = "Target format: MSGPACK or JSON")
	private TargetFormat target;

	@Parameters(index = "0", arity = "0..1", paramLabel = "TEXT", description = "Input text (omit to use --input-file or stdin)")
	private String inputText;

	@Option(names = { "--input-file", "-i" }, description = "Read input from this UTF-8 file")
	private Path inputFile;

	@Option(names = { "--output-file", "-o" }, description = "Write output to this file instead of stdout")
	private Path outputFile;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = {
			"--max-depth" }, defaultValue = "128", description = "Maximum array/object nesting depth (default: 128)")
	private int maxDepth;

}
