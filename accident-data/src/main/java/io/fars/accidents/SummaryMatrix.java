package io.fars.accidents;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Accident counts pivoted to one row per MONTH and one column per year, both ascending.
 * A month/year pair that never occurred has no value, which is distinct from a count of zero.
 */
public final class SummaryMatrix {
    private static final SummaryMatrix EMPTY = new SummaryMatrix(new TreeMap<>(), new TreeSet<>());

    private final TreeMap<Integer, TreeMap<Integer, Long>> cells; // month -> year -> count
    private final TreeSet<Integer> years;

    private SummaryMatrix(TreeMap<Integer, TreeMap<Integer, Long>> cells, TreeSet<Integer> years) {
        this.cells = cells;
        this.years = years;
    }

    public static SummaryMatrix empty() { return EMPTY; }

    /**
     * @param counts month -> (year -> count)
     */
    public static SummaryMatrix of(Map<Integer, ? extends Map<Integer, Long>> counts) {
        TreeMap<Integer, TreeMap<Integer, Long>> cells = new TreeMap<>();
        TreeSet<Integer> years = new TreeSet<>();
        counts.forEach((month, byYear) -> {
            if (byYear.isEmpty()) return;
            cells.put(month, new TreeMap<>(byYear));
            years.addAll(byYear.keySet());
        });
        return cells.isEmpty() ? EMPTY : new SummaryMatrix(cells, years);
    }

    public List<Integer> months() { return List.copyOf(cells.keySet()); }
    public List<Integer> years() { return List.copyOf(years); }
    public boolean isEmpty() { return cells.isEmpty(); }
    public int rowCount() { return cells.size(); }

    public OptionalLong count(int month, int year) {
        Map<Integer, Long> row = cells.get(month);
        if (row == null) return OptionalLong.empty();
        Long n = row.get(year);
        return n == null ? OptionalLong.empty() : OptionalLong.of(n);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SummaryMatrix that)) return false;
        return cells.equals(that.cells) && years.equals(that.years);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cells, years);
    }

    @Override
    public String toString() {
        return "SummaryMatrix{years=" + years + ", cells=" + cells + '}';
    }
}
