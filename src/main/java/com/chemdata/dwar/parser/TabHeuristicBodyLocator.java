package com.chemdata.dwar.parser;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chemdata.dwar.model.DwarBody;

/**
 * Locates the body by position and shape, since the format has no row count.
 *
 * The header is the first non-markup, tab-delimited line after the column
 * properties block that splits into at least {@code minHeaderFields} fields.
 * Every later non-markup line containing a tab is a data row, except
 * {@code settings=} lines. Without a header no rows are collected.
 */
public class TabHeuristicBodyLocator implements BodyLocator {
    private static final Logger log = LoggerFactory.getLogger(TabHeuristicBodyLocator.class);

    public static final int DEFAULT_MIN_HEADER_FIELDS = 3;

    private final int minHeaderFields;

    public TabHeuristicBodyLocator() {
        this(DEFAULT_MIN_HEADER_FIELDS);
    }

    public TabHeuristicBodyLocator(int minHeaderFields) {
        if (minHeaderFields < 1) {
            throw new IllegalArgumentException("minHeaderFields must be >= 1. Got: " + minHeaderFields);
        }
        this.minHeaderFields = minHeaderFields;
    }

    @Override
    public DwarBody locate(String content) {
        List<String> header = null;
        List<List<String>> dataRows = new ArrayList<>();
        boolean metadataClosed = false;

        for (String raw : DwarFormat.lines(content)) {
            String line = DwarFormat.stripLine(raw);

            if (line.contains(DwarFormat.COLUMN_PROPERTIES_START)) {
                continue;
            }
            if (line.contains(DwarFormat.COLUMN_PROPERTIES_END)) {
                metadataClosed = true;
                continue;
            }

            if (line.isEmpty() || line.indexOf(DwarFormat.FIELD_SEPARATOR) < 0 || DwarFormat.isMarkup(line)) {
                continue;
            }

            if (header == null) {
                if (metadataClosed) {
                    List<String> fields = DwarFormat.splitFields(line);
                    if (fields.size() >= minHeaderFields) {
                        header = fields;
                        log.debug("Header found with {} fields: {}", fields.size(), fields);
                    }
                }
                continue;
            }

            if (!line.startsWith(DwarFormat.SETTINGS_PREFIX)) {
                dataRows.add(DwarFormat.splitFields(line));
            }
        }

        if (header == null) {
            log.debug("No header line found after the column properties block");
        }
        return DwarBody.of(header, dataRows);
    }
}
