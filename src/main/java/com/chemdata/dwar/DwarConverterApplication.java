package com.chemdata.dwar;

import com.chemdata.dwar.cli.ConvertCommand;
import picocli.CommandLine;

/**
 * Main entry point for the DWAR converter.
 * Turns DataWarrior (.dwar) files into CSV, decoding idcode structure columns
 * to SMILES through an external decoder.
 */
public class DwarConverterApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConvertCommand()).execute(args);
        System.exit(exitCode);
    }
}
