package com.chemdata.dwar.convert;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.chemdata.dwar.model.ColumnMetadata;
import com.chemdata.dwar.model.DecodePlan;
import com.chemdata.dwar.model.DwarTable;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for DecodePlanner.
 */
class DecodePlannerTest {

    private final DecodePlanner planner = new DecodePlanner();

    @Test
    void testIdcodeColumnsPresentInTableArePlanned() {
        ColumnMetadata metadata = new ColumnMetadata();
        metadata.declare("Structure").setSpecialType("idcode");
        metadata.declare("Reactant").setSpecialType("IDCODE");
        metadata.declare("Coords").setSpecialType("idcoordinates2D");
        metadata.declare("NotInTable").setSpecialType("idcode");
        DwarTable table = new DwarTable(List.of("Structure", "Reactant", "Coords", "Name"),
                List.of(List.of("a", "b", "c", "d")));

        DecodePlan plan = planner.plan(table, metadata);

        assertThat(plan.getToDecode()).containsExactly("Structure", "Reactant");
        assertThat(plan.getToRemove()).containsExactly("Structure", "Reactant");
    }

    @Test
    void testColumnsWithoutMetadataAreNeverCandidates() {
        DwarTable table = new DwarTable(List.of("Structure", "Smiles", "Name"),
                List.of(List.of("gFp@DiTt@@@", "c1ccccc1", "Benzene")));

        DecodePlan plan = planner.plan(table, new ColumnMetadata());

        assertThat(plan.isEmpty()).isTrue();
        assertThat(plan.getToRemove()).isEmpty();
    }
}
