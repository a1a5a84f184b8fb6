package com.chemdata.dwar.parser;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chemdata.dwar.model.DwarBody;
import com.chemdata.dwar.model.DwarTable;

/**
 * Builds a {@link DwarTable} from a located body.
 *
 * The table is as wide as its widest row. Header names are used only when the
 * header has exactly that many fields; otherwise columns are named
 * {@code Column_0 .. Column_n-1}. Rows without any non-blank cell are dropped.
 */
public class TableAssembler {
    private static final Logger log = LoggerFactory.getLogger(TableAssembler.class);

    static final String GENERATED_COLUMN_PREFIX = "Column_";

    public DwarTable assemble(DwarBody body) {
        if (!body.hasData()) {
            return DwarTable.empty();
        }

        int width = body.getDataRows().stream()
                .mapToInt(List::size)
                .max()
                .orElse(0);

        List<String> columnNames = body.findHeader()
                .filter(header -> header.size() == width)
                .map(header -> header.stream().map(String::valueOf).toList())
                .orElseGet(() -> generatedNames(width));

        if (body.findHeader().isPresent() && !columnNames.equals(body.getHeader())) {
            log.warn("Header has {} fields but rows have {} columns, using generic column names",
                    body.getHeader().size(), width);
        }

        Set<String> repeated = repeatedNames(columnNames);
        if (!repeated.isEmpty()) {
            log.warn("Header repeats column names {}; only the first copy is read and dropping removes every copy",
                    repeated);
        }

        DwarTable table = new DwarTable(columnNames, body.getDataRows());
        int dropped = table.dropEmptyRows();
        if (dropped > 0) {
            log.debug("Dropped {} empty rows", dropped);
        }
        return table;
    }

    static Set<String> repeatedNames(List<String> names) {
        Set<String> seen = new HashSet<>();
        Set<String> repeated = new LinkedHashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                repeated.add(name);
            }
        }
        return repeated;
    }

    private static List<String> generatedNames(int width) {
        List<String> names = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            names.add(GENERATED_COLUMN_PREFIX + i);
        }
        return names;
    }
}
