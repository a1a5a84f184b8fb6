package com.chemdata.dwar.convert;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chemdata.dwar.decode.BatchDecodeGateway;
import com.chemdata.dwar.decode.ProcessStructureDecoder;
import com.chemdata.dwar.decode.StructureDecoder;
import com.chemdata.dwar.model.ColumnMetadata;
import com.chemdata.dwar.model.DecodePlan;
import com.chemdata.dwar.model.DecodeStats;
import com.chemdata.dwar.model.DwarBody;
import com.chemdata.dwar.model.DwarInfo;
import com.chemdata.dwar.model.DwarTable;
import com.chemdata.dwar.parser.BodyLocator;
import com.chemdata.dwar.parser.ColumnPropertiesExtractor;
import com.chemdata.dwar.parser.DwarFormat;
import com.chemdata.dwar.parser.DwarFormatException;
import com.chemdata.dwar.parser.TabHeuristicBodyLocator;
import com.chemdata.dwar.parser.TableAssembler;

/**
 * Loads a DataWarrior document into a {@link DwarTable}, decoding idcode
 * structure columns into {@code <column>_SMILES} columns.
 *
 * Pipeline: column properties and body are read in independent passes, the
 * table is assembled, structure columns are planned from the metadata, each is
 * decoded as one batch, and structure by-products are projected away.
 */
public class DwarLoader {
    private static final Logger log = LoggerFactory.getLogger(DwarLoader.class);

    static final String NOT_A_DWAR_FILE = "File does not appear to be a valid DWAR file";

    private static final Pattern VERSION_PATTERN = Pattern.compile("version\\s+(\\S+)");
    private static final Pattern CREATED_PATTERN = Pattern.compile("created\\s+(.+)");

    private final ConverterConfig config;
    private final ColumnPropertiesExtractor propertiesExtractor;
    private final BodyLocator bodyLocator;
    private final TableAssembler tableAssembler;
    private final DecodePlanner decodePlanner;
    private final BatchDecodeGateway decodeGateway;
    private final ColumnProjector columnProjector;

    public DwarLoader(ConverterConfig config) {
        this(config, new ProcessStructureDecoder(config.getDecoderCommand(), config.getDecoderWorkingDir(),
                config.getDecodeTimeout()));
    }

    public DwarLoader(ConverterConfig config, StructureDecoder decoder) {
        this(config, decoder, new TabHeuristicBodyLocator());
    }

    public DwarLoader(ConverterConfig config, StructureDecoder decoder, BodyLocator bodyLocator) {
        this.config = config;
        this.propertiesExtractor = new ColumnPropertiesExtractor();
        this.bodyLocator = bodyLocator;
        this.tableAssembler = new TableAssembler();
        this.decodePlanner = new DecodePlanner();
        this.decodeGateway = new BatchDecodeGateway(decoder);
        this.columnProjector = new ColumnProjector();
    }

    public DwarTable load(Path file) throws IOException {
        log.info("Parsing DWAR file: {}", file);
        return loadText(Files.readString(file, StandardCharsets.UTF_8));
    }

    /**
     * @throws DwarFormatException if the content has neither file-info nor column properties markers
     */
    public DwarTable loadText(String content) {
        if (!DwarFormat.isDwarDocument(content)) {
            throw new DwarFormatException(NOT_A_DWAR_FILE);
        }

        DwarBody body = bodyLocator.locate(content);
        if (!body.hasData()) {
            log.warn("No data found in DWAR file");
            return DwarTable.empty();
        }

        ColumnMetadata metadata = propertiesExtractor.extract(content);
        log.debug("Detected column properties: {}", metadata);

        DwarTable table = tableAssembler.assemble(body);
        log.info("Loaded {} rows with {} columns", table.getRowCount(), table.getColumnCount());

        DecodePlan plan = decodePlanner.plan(table, metadata);
        decodeStructures(table, plan);

        columnProjector.project(table, plan, config.isExcludeStructureColumns());
        return table;
    }

    private void decodeStructures(DwarTable table, DecodePlan plan) {
        if (plan.isEmpty()) {
            log.info("No structure columns found for decoding");
            return;
        }
        log.info("Found structure columns: {}", plan.getToDecode());

        for (String column : plan.getToDecode()) {
            log.info("Decoding structures in column: {}", column);
            List<String> identifiers = table.getColumn(column);
            List<String> smiles = decodeGateway.decode(identifiers);
            table.putColumn(column + config.getSmilesSuffix(), smiles);

            DecodeStats stats = DecodeStats.of(column, identifiers, smiles);
            log.info("Successfully decoded {}/{} structures in {}",
                    stats.getDecoded(), stats.getStructures(), stats.getColumn());
        }
    }

    public DwarInfo info(Path file) throws IOException {
        log.info("Getting file info for: {}", file);
        return infoText(Files.readString(file, StandardCharsets.UTF_8));
    }

    public DwarInfo infoText(String content) {
        DwarInfo.DwarInfoBuilder info = DwarInfo.builder();

        Matcher version = VERSION_PATTERN.matcher(content);
        if (version.find()) {
            info.version(version.group(1));
        }
        Matcher created = CREATED_PATTERN.matcher(content);
        if (created.find()) {
            info.created(created.group(1).strip());
        }

        info.rowCount(bodyLocator.locate(content).getDataRows().size());
        info.columns(propertiesExtractor.extract(content));

        DwarInfo result = info.build();
        log.info("File info: version={}, created={}, rows={}, columns={}",
                result.getVersion(), result.getCreated(), result.getRowCount(), result.getColumns());
        return result;
    }
}
