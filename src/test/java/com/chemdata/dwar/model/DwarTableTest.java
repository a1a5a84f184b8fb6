package com.chemdata.dwar.model;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DwarTable column operations.
 */
class DwarTableTest {

    private DwarTable sample() {
        return new DwarTable(List.of("A", "B", "C"),
                List.of(List.of("1", "2", "3"), List.of("4", "5", "6")));
    }

    @Test
    void testPutColumnAppendsNewColumn() {
        DwarTable table = sample();

        table.putColumn("D", Arrays.asList("x", null));

        assertThat(table.getColumnNames()).containsExactly("A", "B", "C", "D");
        assertThat(table.getRow(0)).containsExactly("1", "2", "3", "x");
        assertThat(table.getValue(1, "D")).isNull();
    }

    @Test
    void testPutColumnReplacesExistingColumn() {
        DwarTable table = sample();

        table.putColumn("B", List.of("b1", "b2"));

        assertThat(table.getColumnNames()).containsExactly("A", "B", "C");
        assertThat(table.getColumn("B")).containsExactly("b1", "b2");
    }

    @Test
    void testPutColumnRejectsWrongLength() {
        DwarTable table = sample();

        assertThatThrownBy(() -> table.putColumn("D", List.of("only one")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("2 rows");
    }

    @Test
    void testDropColumnsIgnoresUnknownNames() {
        DwarTable table = sample();

        List<String> removed = table.dropColumns(List.of("C", "A", "Missing"));

        assertThat(removed).containsExactly("A", "C");
        assertThat(table.getColumnNames()).containsExactly("B");
        assertThat(table.getRows()).containsExactly(List.of("2"), List.of("5"));
    }

    @Test
    void testGetColumnUnknownName() {
        assertThatThrownBy(() -> sample().getColumn("Z"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No such column: Z");
    }

    @Test
    void testRowsAreReadOnlyViews() {
        DwarTable table = sample();

        assertThatThrownBy(() -> table.getRow(0).set(0, "changed"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testDropColumnsRemovesEveryCopyOfRepeatedName() {
        DwarTable table = new DwarTable(List.of("A", "B", "A"), List.of(List.of("1", "2", "3")));

        List<String> removed = table.dropColumns(List.of("A"));

        assertThat(removed).containsExactly("A", "A");
        assertThat(table.getColumnNames()).containsExactly("B");
    }
}
