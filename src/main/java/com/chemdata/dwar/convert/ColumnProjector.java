package com.chemdata.dwar.convert;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chemdata.dwar.model.DecodePlan;
import com.chemdata.dwar.model.DwarTable;

/**
 * Removes structure by-products from a decoded table.
 *
 * With structure exclusion on: decoded identifier columns, coordinate columns
 * and columns named {@code smiles} (any case). Fingerprint columns (name ending
 * in {@code Fp}) and {@code smiles} columns are removed either way.
 */
public class ColumnProjector {
    private static final Logger log = LoggerFactory.getLogger(ColumnProjector.class);

    static final List<String> COORDINATE_PATTERNS = List.of("coordinate", "coord", "atomcoord", "scaffoldatom");
    static final String SMILES_NAME = "smiles";
    static final String FINGERPRINT_SUFFIX = "Fp";

    public void project(DwarTable table, DecodePlan plan, boolean excludeStructureColumns) {
        if (excludeStructureColumns) {
            Set<String> structureColumns = new LinkedHashSet<>(plan.getToRemove());
            for (String name : table.getColumnNames()) {
                if (isCoordinateColumn(name)) {
                    structureColumns.add(name);
                }
            }
            collectSmilesColumns(table, structureColumns);
            if (structureColumns.isEmpty()) {
                log.info("No ID code/coordinate/Smiles columns detected for removal");
            } else {
                List<String> removed = table.dropColumns(structureColumns);
                log.info("Removed original ID code/coordinate/Smiles columns: {}", removed);
            }
        } else {
            Set<String> smilesColumns = new LinkedHashSet<>();
            collectSmilesColumns(table, smilesColumns);
            if (!smilesColumns.isEmpty()) {
                log.info("Removed Smiles columns: {}", table.dropColumns(smilesColumns));
            }
        }

        Set<String> fingerprints = new LinkedHashSet<>();
        for (String name : table.getColumnNames()) {
            if (name.endsWith(FINGERPRINT_SUFFIX)) {
                fingerprints.add(name);
            }
        }
        if (!fingerprints.isEmpty()) {
            log.warn("Removed fingerprint columns: {}", table.dropColumns(fingerprints));
        }
    }

    private static void collectSmilesColumns(DwarTable table, Set<String> into) {
        for (String name : table.getColumnNames()) {
            if (name.toLowerCase(Locale.ROOT).equals(SMILES_NAME)) {
                into.add(name);
            }
        }
    }

    static boolean isCoordinateColumn(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return COORDINATE_PATTERNS.stream().anyMatch(lower::contains);
    }
}
