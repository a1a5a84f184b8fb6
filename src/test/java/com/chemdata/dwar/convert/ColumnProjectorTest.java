package com.chemdata.dwar.convert;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.chemdata.dwar.model.DecodePlan;
import com.chemdata.dwar.model.DwarTable;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ColumnProjector.
 */
class ColumnProjectorTest {

    private final ColumnProjector projector = new ColumnProjector();

    private DwarTable table(String... names) {
        List<String> row = List.of(names).stream().map(n -> "v").toList();
        return new DwarTable(List.of(names), List.of(row));
    }

    @Test
    void testExcludeRemovesStructureByProducts() {
        DwarTable table = table("Structure", "Structure [idcoordinates2D]", "SMILES", "FragFp",
                "Name", "Structure_SMILES");
        DecodePlan plan = new DecodePlan(Set.of("Structure"), Set.of("Structure"));

        projector.project(table, plan, true);

        assertThat(table.getColumnNames()).containsExactly("Name", "Structure_SMILES");
    }

    @Test
    void testKeepStructuresStillDropsSmilesAndFingerprints() {
        DwarTable table = table("Structure", "Structure [idcoordinates2D]", "smiles", "SkeletonSpheresFp",
                "Name", "Structure_SMILES");
        DecodePlan plan = new DecodePlan(Set.of("Structure"), Set.of("Structure"));

        projector.project(table, plan, false);

        assertThat(table.getColumnNames())
                .containsExactly("Structure", "Structure [idcoordinates2D]", "Name", "Structure_SMILES");
    }

    @Test
    void testNothingToRemoveIsNoOp() {
        DwarTable table = table("Name", "MW");

        projector.project(table, DecodePlan.empty(), true);

        assertThat(table.getColumnNames()).containsExactly("Name", "MW");
        assertThat(table.getRowCount()).isEqualTo(1);
    }

    @Test
    void testFingerprintSuffixIsCaseSensitive() {
        DwarTable table = table("FragFp", "Fpocket", "LogFP");

        projector.project(table, DecodePlan.empty(), true);

        assertThat(table.getColumnNames()).containsExactly("Fpocket", "LogFP");
    }

    @ParameterizedTest
    @CsvSource({
            "Structure [idcoordinates2D], true",
            "atomCoordinates, true",
            "ScaffoldAtoms, true",
            "COORD_X, true",
            "Name, false",
            "Structure_SMILES, false"
    })
    void testCoordinateColumnDetection(String name, boolean expected) {
        assertThat(ColumnProjector.isCoordinateColumn(name)).isEqualTo(expected);
    }
}
