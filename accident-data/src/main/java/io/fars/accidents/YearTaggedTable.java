package io.fars.accidents;

import java.util.List;

/**
 * A year's accidents projected to MONTH plus a constant year column.
 */
public record YearTaggedTable(int year, List<YearTaggedRow> rows) {

    public YearTaggedTable {
        rows = List.copyOf(rows);
    }

    public static YearTaggedTable project(int year, RecordTable table) {
        return new YearTaggedTable(year, table.rows().stream()
                .map(r -> new YearTaggedRow(r.month(), year))
                .toList());
    }

    public int size() { return rows.size(); }
}
