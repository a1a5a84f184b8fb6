package com.chemdata.dwar.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.chemdata.dwar.cli.exception.OptionsValidationException;
import com.chemdata.dwar.cli.model.ConvertOptions;
import com.chemdata.dwar.cli.model.ValidatedConvertOptions;

public class ConvertOptionsValidator {

	private static final String CSV_EXTENSION = ".csv";

	public ValidatedConvertOptions validate(ConvertOptions o) {
		List<String> errors = new ArrayList<>();

		Path inputFile = null;
		if (o.getInputFile() == null) {
			errors.add("Input DWAR file is required.");
		} else if (!Files.isRegularFile(o.getInputFile())) {
			errors.add("File '" + o.getInputFile() + "' not found");
		} else {
			inputFile = o.getInputFile().toAbsolutePath().normalize();
		}

		List<String> decoderCommand = parseCommand(o.getDecoderCommand());
		if (decoderCommand.isEmpty()) {
			errors.add("Decoder command must not be empty (--decoder-command).");
		}

		if (o.getDecoderDir() != null && !Files.isDirectory(o.getDecoderDir())) {
			errors.add("Decoder directory does not exist or is not a directory: " + o.getDecoderDir());
		}

		if (o.getDecodeTimeoutSeconds() <= 0) {
			errors.add("Decode timeout must be > 0 seconds. Got: " + o.getDecodeTimeoutSeconds());
		}

		Path outputFile = null;
		if (!o.isInfoOnly() && inputFile != null) {
			outputFile = o.getOutputFile() != null
					? o.getOutputFile().toAbsolutePath().normalize()
					: defaultOutputFile(inputFile);
			if (Files.isDirectory(outputFile)) {
				errors.add("Output path is a directory: " + outputFile);
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		Path decoderDir = o.getDecoderDir() == null ? null : o.getDecoderDir().toAbsolutePath().normalize();
		return new ValidatedConvertOptions(inputFile, outputFile, decoderCommand, decoderDir,
				Duration.ofSeconds(o.getDecodeTimeoutSeconds()));
	}

	static Path defaultOutputFile(Path inputFile) {
		String name = inputFile.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String stem = (dot > 0) ? name.substring(0, dot) : name;
		return inputFile.resolveSibling(stem + CSV_EXTENSION);
	}

	private static List<String> parseCommand(String raw) {
		if (raw == null || raw.isBlank()) {
			return List.of();
		}
		return Arrays.stream(raw.trim().split("\\s+")).toList();
	}
}
