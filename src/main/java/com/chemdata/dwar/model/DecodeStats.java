package com.chemdata.dwar.model;

import java.util.List;
import java.util.Objects;

import lombok.Value;

/**
 * Outcome counts of decoding one structure column.
 */
@Value
public class DecodeStats {

    String column;
    int structures;
    int decoded;

    public static DecodeStats of(String column, List<String> identifiers, List<String> decodedValues) {
        int structures = (int) identifiers.stream()
                .filter(s -> s != null && !s.isBlank())
                .count();
        int decoded = (int) decodedValues.stream()
                .filter(Objects::nonNull)
                .count();
        return new DecodeStats(column, structures, decoded);
    }
}
