package com.chemdata.dwar.convert;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.chemdata.dwar.model.ColumnMetadata;
import com.chemdata.dwar.model.ColumnProperties;
import com.chemdata.dwar.model.DecodePlan;
import com.chemdata.dwar.model.DwarTable;

/**
 * Picks the structure identifier columns of a table from its column metadata.
 * Cell contents are never inspected.
 */
public class DecodePlanner {

    public DecodePlan plan(DwarTable table, ColumnMetadata metadata) {
        Set<String> toDecode = new LinkedHashSet<>();
        for (Map.Entry<String, ColumnProperties> entry : metadata.asMap().entrySet()) {
            if (table.hasColumn(entry.getKey()) && entry.getValue().isIdcode()) {
                toDecode.add(entry.getKey());
            }
        }
        // originals go once their decoded counterpart exists
        return new DecodePlan(toDecode, toDecode);
    }
}
