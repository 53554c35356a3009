package com.jsonpack.converter.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.jsonpack.converter.cli.exception.OptionsValidationException;
import com.jsonpack.converter.cli.model.ConvertOptions;
import com.jsonpack.converter.cli.model.ValidatedConvertOptions;
import com.jsonpack.converter.cli.model.ValidatedConvertOptions.InputSource;

public class ConvertOptionsValidator {

	static final int MAX_DEPTH_LIMIT = 1000;

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getTarget() == null) {
			errors.add("Target format is required (--to / -t).");
		}

		InputSource inputSource;
		if (o.getInputText() != null && o.getInputFile() != null) {
			errors.add("Provide either inline TEXT or --input-file, not both.");
			inputSource = InputSource.ARGUMENT;
		} else if (o.getInputFile() != null) {
			inputSource = InputSource.FILE;
			if (!Files.isRegularFile(o.getInputFile())) {
				errors.add("Input file does not exist or is not a regular file: " + o.getInputFile());
			}
		} else if (o.getInputText() != null) {
			inputSource = InputSource.ARGUMENT;
		} else {
			inputSource = InputSource.STDIN;
		}

		Path outputFile = null;
		if (o.getOutputFile() != null) {
			outputFile = o.getOutputFile().toAbsolutePath().normalize();
			if (Files.isDirectory(outputFile)) {
				errors.add("Output file is a directory: " + outputFile);
			} else if (Files.exists(outputFile) && !o.isForce()) {
				errors.add("Output file already exists: " + outputFile + ". Use --force to overwrite.");
			}
			Path parent = outputFile.getParent();
			if (parent != null && !Files.isDirectory(parent)) {
				errors.add("Output directory does not exist: " + parent);
			}
		}

		if (o.getMaxDepth() < 1 || o.getMaxDepth() > MAX_DEPTH_LIMIT) {
			errors.add("Max depth must be in range 1-" + MAX_DEPTH_LIMIT + ". Got: " + o.getMaxDepth());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedConvertOptions(inputSource, outputFile);
	}
}
