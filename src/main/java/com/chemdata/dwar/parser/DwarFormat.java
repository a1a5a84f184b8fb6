package com.chemdata.dwar.parser;

import java.util.Arrays;
import java.util.List;

/**
 * Markers and line conventions of the DataWarrior document format.
 */
public final class DwarFormat {

    public static final String FILE_INFO_MARKER = "<datawarrior-fileinfo>";
    public static final String COLUMN_PROPERTIES_START = "<column properties>";
    public static final String COLUMN_PROPERTIES_END = "</column properties>";
    public static final String SETTINGS_PREFIX = "settings=";
    public static final char FIELD_SEPARATOR = '\t';

    private DwarFormat() {
        // Constants only
    }

    /**
     * A document is recognised by its file-info block or its column properties block.
     */
    public static boolean isDwarDocument(String content) {
        return content.contains(FILE_INFO_MARKER) || content.contains(COLUMN_PROPERTIES_START);
    }

    public static List<String> lines(String content) {
        return Arrays.asList(content.split("\n", -1));
    }

    /**
     * Removes the line terminator and surrounding spaces. Tabs are kept so that
     * empty leading and trailing cells survive.
     */
    public static String stripLine(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && isPadding(line.charAt(start))) {
            start++;
        }
        while (end > start && isPadding(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(start, end);
    }

    public static boolean isMarkup(String line) {
        return line.startsWith("<") || line.startsWith(">");
    }

    public static List<String> splitFields(String line) {
        return Arrays.asList(line.split(String.valueOf(FIELD_SEPARATOR), -1));
    }

    private static boolean isPadding(char c) {
        return c == ' ' || c == '\r' || c == '\n' || c == '\f' || c == '\u000B';
    }
}
