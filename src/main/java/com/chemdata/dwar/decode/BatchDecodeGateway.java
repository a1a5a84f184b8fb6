package com.chemdata.dwar.decode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.RequiredArgsConstructor;

/**
 * Decodes one column of structure identifiers through a {@link StructureDecoder}.
 *
 * Each distinct non-blank identifier is submitted once; its result is copied to
 * every row holding the same identifier. The returned list always has the
 * input's length, with {@code null} wherever no decoded value is available.
 * A failing batch yields an all-null column and is logged, never thrown.
 */
@RequiredArgsConstructor
public class BatchDecodeGateway {
    private static final Logger log = LoggerFactory.getLogger(BatchDecodeGateway.class);

    static final String ERROR_PREFIX = "ERROR:";

    private final StructureDecoder decoder;

    public List<String> decode(List<String> identifiers) {
        String[] results = new String[identifiers.size()];

        // identifier -> rows holding it, in first-occurrence order
        Map<String, List<Integer>> rowsByIdentifier = new LinkedHashMap<>();
        for (int i = 0; i < identifiers.size(); i++) {
            String id = identifiers.get(i);
            if (id != null && !id.isBlank()) {
                rowsByIdentifier.computeIfAbsent(id, k -> new ArrayList<>()).add(i);
            }
        }

        if (rowsByIdentifier.isEmpty()) {
            return Arrays.asList(results);
        }

        List<String> batch = new ArrayList<>(rowsByIdentifier.keySet());
        List<String> response;
        try {
            response = decoder.decodeBatch(batch);
        } catch (DecoderException e) {
            log.warn("Decoding failed: {}", e.getMessage());
            return Arrays.asList(results);
        } catch (RuntimeException e) {
            log.warn("Unexpected error while decoding {} structures", batch.size(), e);
            return Arrays.asList(results);
        }

        for (String line : response) {
            log.debug("Decoder: {}", line);
            int colon = line.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String value = line.substring(colon + 1);
            if (value.startsWith(ERROR_PREFIX)) {
                continue;
            }
            int position;
            try {
                position = Integer.parseInt(line.substring(0, colon).trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring decoder line without a numeric index: {}", line);
                continue;
            }
            if (position < 0 || position >= batch.size()) {
                log.debug("Ignoring decoder line with index {} outside batch of {}", position, batch.size());
                continue;
            }
            for (int row : rowsByIdentifier.get(batch.get(position))) {
                results[row] = value;
            }
        }

        return Arrays.asList(results);
    }
}
