package com.chemdata.dwar.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * File-level facts about a document, gathered without building the table.
 */
@Value
@Builder
public class DwarInfo {

    String version;
    String created;
    int rowCount;

    @NonNull
    ColumnMetadata columns;

    public Optional<String> findVersion() {
        return Optional.ofNullable(version);
    }

    public Optional<String> findCreated() {
        return Optional.ofNullable(created);
    }

    public List<String> getStructureColumns() {
        return columns.getIdcodeColumns();
    }
}
