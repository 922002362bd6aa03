package io.fars.accidents;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable, ordered rows of one accident file.
 */
public final class RecordTable {
    private final List<AccidentRecord> rows;

    public RecordTable(List<AccidentRecord> rows) {
        this.rows = List.copyOf(rows);
    }

    public List<AccidentRecord> rows() { return rows; }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }

    /** Distinct STATE values in first-seen order. */
    public Set<Integer> states() {
        Set<Integer> out = new LinkedHashSet<>();
        for (AccidentRecord r : rows) out.add(r.state());
        return out;
    }

    public RecordTable filterState(int state) {
        return new RecordTable(rows.stream().filter(r -> r.state() == state).toList());
    }

    @Override
    public String toString() {
        return "RecordTable{rows=" + rows.size() + '}';
    }
}
