package com.chemdata.dwar.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chemdata.dwar.cli.model.ValidatedConvertOptions;
import com.chemdata.dwar.model.DwarInfo;
import com.chemdata.dwar.model.DwarTable;

/**
 * Responsible only for printing CLI output for the convert command.
 * No validation, no execution.
 */
public class ConvertResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConvertResultsPrinter.class);

    public void printBanner(ValidatedConvertOptions v, boolean keepStructures) {
        log.info("=================================================");
        log.info("DWAR Converter");
        log.info("=================================================");
        log.info("Input File: {}", v.getInputFile());
        log.info("Output File: {}", v.getOutputFile() != null ? v.getOutputFile() : "None");
        log.info("Keep Structures: {}", keepStructures);
        log.info("Decoder Command: {}", String.join(" ", v.getDecoderCommand()));
        log.info("Decoder Directory: {}", v.getDecoderWorkingDir() != null ? v.getDecoderWorkingDir() : "Current");
        log.info("Decode Timeout: {} seconds", v.getDecodeTimeout().toSeconds());
        log.info("=================================================");
    }

    public void printInfo(Path inputFile, DwarInfo info) {
        log.info("File: {}", inputFile);
        log.info("Version: {}", info.findVersion().orElse("unknown"));
        log.info("Created: {}", info.findCreated().orElse("unknown"));
        log.info("Rows: {}", info.getRowCount());
        log.info("Columns: {}", info.getColumns().size());
        log.info("Structure columns: {}", info.getStructureColumns());
    }

    public void printSuccess(DwarTable table, Path outputFile) {
        log.info("Successfully converted {} rows to {}", table.getRowCount(), outputFile);
        log.info("Columns: {}", table.getColumnNames());
    }

    public void printFailure(String message) {
        log.error("Error: {}", message);
    }
}
