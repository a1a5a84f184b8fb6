package com.chemdata.dwar.cli.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ConvertCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConvertOptions {
    Path inputFile;
    Path outputFile;
    List<String> decoderCommand;
    Path decoderWorkingDir;
    Duration decodeTimeout;
}
