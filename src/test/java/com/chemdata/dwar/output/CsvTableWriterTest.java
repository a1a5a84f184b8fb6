package com.chemdata.dwar.output;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.chemdata.dwar.model.DwarTable;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CsvTableWriter.
 */
class CsvTableWriterTest {

    private final CsvTableWriter writer = new CsvTableWriter();

    @TempDir
    Path tempDir;

    @Test
    void testWriteHeaderAndRows() throws IOException {
        DwarTable table = new DwarTable(List.of("Name", "Structure_SMILES"),
                List.of(List.of("Benzene", "c1ccccc1"), Arrays.asList("Unknown", null)));
        StringWriter out = new StringWriter();

        writer.write(table, out);

        assertThat(out.toString()).isEqualTo("Name,Structure_SMILES\nBenzene,c1ccccc1\nUnknown,\n");
    }

    @Test
    void testWriteToFileCreatesParentDirectories() throws IOException {
        DwarTable table = new DwarTable(List.of("A"), List.of(List.of("1")));
        Path file = tempDir.resolve("nested/out.csv");

        writer.write(table, file);

        assertThat(Files.readString(file)).isEqualTo("A\n1\n");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "plain|plain",
            "'a,b'|'\"a,b\"'",
            "'say \"hi\"'|'\"say \"\"hi\"\"\"'"
    })
    void testEscape(String raw, String expected) {
        assertThat(CsvTableWriter.escape(raw)).isEqualTo(expected);
    }

    @Test
    void testEscapeLineBreaksAndNull() {
        assertThat(CsvTableWriter.escape("a\nb")).isEqualTo("\"a\nb\"");
        assertThat(CsvTableWriter.escape(null)).isEmpty();
    }
}
