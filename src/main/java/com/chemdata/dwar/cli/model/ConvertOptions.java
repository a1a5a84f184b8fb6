package com.chemdata.dwar.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the convert command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConvertOptions {

	@Parameters(index = "0", paramLabel = "INPUT", description = "Input DWAR file path")
	private Path inputFile;

	@Option(names = { "--output", "-o" }, description = "Output CSV file path (defaults to the input name with .csv)")
	private Path outputFile;

	@Option(names = { "--keep-structures" }, description = "Keep original structure columns in output")
	private boolean keepStructures;

	@Option(names = { "--info" }, description = "Show file information only")
	private boolean infoOnly;

	@Option(names = { "--decoder-command" }, defaultValue = "node decode.mjs",
			description = "Command that decodes idcodes given as trailing arguments (default: ${DEFAULT-VALUE})")
	private String decoderCommand;

	@Option(names = { "--decoder-dir" }, description = "Working directory of the decoder (where its script lives)")
	private Path decoderDir;

	@Option(names = { "--decode-timeout-seconds" }, defaultValue = "30",
			description = "Seconds to wait for one decode batch (default: ${DEFAULT-VALUE})")
	private long decodeTimeoutSeconds;

	@Option(names = { "--skip-preflight" }, description = "Do not check the decoder runtime before converting")
	private boolean skipPreflight;

	// ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
