package com.chemdata.dwar.convert;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for loading and converting a document.
 */
@Data
@Builder
public class ConverterConfig {

    public static final List<String> DEFAULT_DECODER_COMMAND = List.of("node", "decode.mjs");
    public static final Duration DEFAULT_DECODE_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_SMILES_SUFFIX = "_SMILES";

    @Builder.Default
    private boolean excludeStructureColumns = true;

    @Builder.Default
    private List<String> decoderCommand = DEFAULT_DECODER_COMMAND;

    /**
     * Directory the decoder runs in; relative script paths resolve against it.
     */
    private Path decoderWorkingDir;

    @Builder.Default
    private Duration decodeTimeout = DEFAULT_DECODE_TIMEOUT;

    @Builder.Default
    private String smilesSuffix = DEFAULT_SMILES_SUFFIX;

    public static ConverterConfig defaults() {
        return ConverterConfig.builder().build();
    }
}
