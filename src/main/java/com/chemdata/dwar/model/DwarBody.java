package com.chemdata.dwar.model;

import java.util.List;
import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * Header row (when one could be identified) and raw data rows of a document body.
 */
@Value
public class DwarBody {

    List<String> header;

    @NonNull
    List<List<String>> dataRows;

    public static DwarBody of(List<String> header, List<List<String>> dataRows) {
        return new DwarBody(header == null ? null : List.copyOf(header), List.copyOf(dataRows));
    }

    public Optional<List<String>> findHeader() {
        return Optional.ofNullable(header);
    }

    public boolean hasData() {
        return !dataRows.isEmpty();
    }
}
