package com.chemdata.dwar.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chemdata.dwar.cli.exception.OptionsValidationException;
import com.chemdata.dwar.cli.model.ConvertOptions;
import com.chemdata.dwar.cli.model.ValidatedConvertOptions;
import com.chemdata.dwar.cli.output.ConvertResultsPrinter;
import com.chemdata.dwar.cli.validation.ConvertOptionsValidator;
import com.chemdata.dwar.convert.ConverterConfig;
import com.chemdata.dwar.convert.DwarLoader;
import com.chemdata.dwar.decode.DecoderPreflight;
import com.chemdata.dwar.decode.DecoderUnavailableException;
import com.chemdata.dwar.model.DwarInfo;
import com.chemdata.dwar.model.DwarTable;
import com.chemdata.dwar.output.CsvTableWriter;
import com.chemdata.dwar.parser.DwarFormatException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command converting a DWAR file to CSV with SMILES decoding.
 */
@Command(
        name = "dwar-converter",
        mixinStandardHelpOptions = true,
        version = "dwar-converter 1.0.0",
        description = "Converts DataWarrior (.dwar) files to CSV, decoding idcode structure columns to SMILES.",
        footer = {
                "",
                "Examples:",
                "  dwar-converter input.dwar --output output.csv",
                "  dwar-converter input.dwar --keep-structures",
                "  dwar-converter input.dwar --info"
        }
)
public class ConvertCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

    @Mixin
    private ConvertOptions options;

    private final ConvertOptionsValidator validator = new ConvertOptionsValidator();
    private final ConvertResultsPrinter printer = new ConvertResultsPrinter();
    private final DecoderPreflight preflight = new DecoderPreflight();
    private final CsvTableWriter csvWriter = new CsvTableWriter();

    @Override
    public Integer call() {
        ValidatedConvertOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(printer::printFailure);
            return 1;
        }

        ConverterConfig config = ConverterConfig.builder()
                .excludeStructureColumns(!options.isKeepStructures())
                .decoderCommand(validated.getDecoderCommand())
                .decoderWorkingDir(validated.getDecoderWorkingDir())
                .decodeTimeout(validated.getDecodeTimeout())
                .build();
        DwarLoader loader = new DwarLoader(config);

        try {
            if (options.isInfoOnly()) {
                DwarInfo info = loader.info(validated.getInputFile());
                printer.printInfo(validated.getInputFile(), info);
                return 0;
            }

            printer.printBanner(validated, options.isKeepStructures());

            if (!options.isSkipPreflight()) {
                preflight.check(validated.getDecoderCommand(), validated.getDecoderWorkingDir());
            }

            DwarTable table = loader.load(validated.getInputFile());
            if (table.isEmpty()) {
                printer.printFailure("No data found in DWAR file");
                return 1;
            }

            csvWriter.write(table, validated.getOutputFile());
            printer.printSuccess(table, validated.getOutputFile());
            return 0;

        } catch (DwarFormatException | DecoderUnavailableException e) {
            printer.printFailure(e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Conversion failed with exception", e);
            return 1;
        }
    }
}
