package com.chemdata.dwar.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.chemdata.dwar.model.ColumnMetadata;
import com.chemdata.dwar.model.ColumnProperties;

/**
 * Reads per-column typing from the column properties block.
 *
 * Format:
 * <pre>
 * &lt;column properties&gt;
 * &lt;columnName="Structure"&gt;
 * &lt;columnProperty="specialType[TAB]idcode"&gt;
 * &lt;columnName="Structure [idcoordinates2D]"&gt;
 * &lt;columnProperty="parent[TAB]Structure"&gt;
 * &lt;/column properties&gt;
 * </pre>
 * Lines outside the block, property lines before any column name and lines that
 * do not match the expected shape are skipped.
 */
public class ColumnPropertiesExtractor {
    private static final Logger log = LoggerFactory.getLogger(ColumnPropertiesExtractor.class);

    private static final String COLUMN_NAME_PREFIX = "<columnName=";
    private static final String COLUMN_PROPERTY_PREFIX = "<columnProperty=";
    private static final String SPECIAL_TYPE_KEY = "specialType";
    private static final String PARENT_KEY = "parent";

    private static final Pattern COLUMN_NAME_PATTERN = Pattern.compile("<columnName=\"([^\"]+)\">");
    private static final Pattern COLUMN_PROPERTY_PATTERN = Pattern.compile("<columnProperty=\"([^\"]+)\">");

    public ColumnMetadata extract(String content) {
        ColumnMetadata metadata = new ColumnMetadata();
        boolean inBlock = false;
        ColumnProperties current = null;

        for (String raw : DwarFormat.lines(content)) {
            String line = raw.trim();

            if (line.equals(DwarFormat.COLUMN_PROPERTIES_START)) {
                inBlock = true;
                continue;
            }
            if (line.equals(DwarFormat.COLUMN_PROPERTIES_END)) {
                inBlock = false;
                continue;
            }
            if (!inBlock) {
                continue;
            }

            if (line.startsWith(COLUMN_NAME_PREFIX)) {
                Matcher matcher = COLUMN_NAME_PATTERN.matcher(line);
                if (matcher.find()) {
                    String name = matcher.group(1);
                    if (metadata.contains(name)) {
                        log.debug("Column {} declared again, later declaration wins", name);
                    }
                    current = metadata.declare(name);
                }
            } else if (line.startsWith(COLUMN_PROPERTY_PREFIX) && current != null) {
                Matcher matcher = COLUMN_PROPERTY_PATTERN.matcher(line);
                if (matcher.find()) {
                    applyProperty(current, matcher.group(1));
                }
            }
        }

        return metadata;
    }

    private void applyProperty(ColumnProperties props, String property) {
        int specialType = property.indexOf(SPECIAL_TYPE_KEY);
        if (specialType >= 0) {
            props.setSpecialType(property.substring(specialType + SPECIAL_TYPE_KEY.length()).trim());
            return;
        }
        int parent = property.indexOf(PARENT_KEY);
        if (parent >= 0) {
            props.setParent(property.substring(parent + PARENT_KEY.length()).trim());
        }
    }
}
