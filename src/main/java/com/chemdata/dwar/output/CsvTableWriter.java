package com.chemdata.dwar.output;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.chemdata.dwar.model.DwarTable;

/**
 * Writes a {@link DwarTable} as comma separated values: one header line, then
 * one line per row. Missing values become empty fields.
 */
public class CsvTableWriter {

    private static final String LINE_END = "\n";

    public void write(DwarTable table, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(table, writer);
        }
    }

    public void write(DwarTable table, Writer writer) throws IOException {
        writeLine(writer, table.getColumnNames());
        for (List<String> row : table.getRows()) {
            writeLine(writer, row);
        }
        writer.flush();
    }

    private static void writeLine(Writer writer, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                writer.write(',');
            }
            writer.write(escape(cells.get(i)));
        }
        writer.write(LINE_END);
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean needsQuotes = value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }
}
