package io.fars.accidents;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of loading one requested year: either the projected table, or "no data" with the reason.
 */
public final class YearResult {
    private final int year;
    private final YearTaggedTable table;
    private final Exception failure;

    private YearResult(int year, YearTaggedTable table, Exception failure) {
        this.year = year;
        this.table = table;
        this.failure = failure;
    }

    public static YearResult loaded(YearTaggedTable table) {
        return new YearResult(table.year(), table, null);
    }

    public static YearResult noData(int year, Exception failure) {
        return new YearResult(year, null, Objects.requireNonNull(failure));
    }

    public int year() { return year; }
    public boolean isLoaded() { return table != null; }
    public Optional<YearTaggedTable> table() { return Optional.ofNullable(table); }
    public Optional<Exception> failure() { return Optional.ofNullable(failure); }

    @Override
    public String toString() {
        return isLoaded()
                ? "YearResult{year=" + year + ", rows=" + table.size() + '}'
                : "YearResult{year=" + year + ", noData=" + failure + '}';
    }
}
