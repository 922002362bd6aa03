package io.fars.accidents;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecordTableTest {
    @Test
    void rowsAreACopyAndImmutable() {
        List<AccidentRecord> src = new ArrayList<>(List.of(AccidentFixtures.row(1, 1), AccidentFixtures.row(2, 1)));
        RecordTable table = new RecordTable(src);
        src.clear();

        assertEquals(2, table.size());
        assertThrows(UnsupportedOperationException.class, () -> table.rows().add(AccidentFixtures.row(3, 3)));
    }

    @Test
    void filtersByStateAndListsDistinctStates() {
        RecordTable table = new RecordTable(List.of(
                AccidentFixtures.row(20, 1), AccidentFixtures.row(1, 2), AccidentFixtures.row(20, 3)));

        assertEquals(Set.of(1, 20), table.states());
        RecordTable kansas = table.filterState(20);
        assertEquals(2, kansas.size());
        assertEquals(List.of(1, 3), kansas.rows().stream().map(AccidentRecord::month).toList());
        assertTrue(table.filterState(99).isEmpty());
        assertEquals(3, table.size());
    }
}
