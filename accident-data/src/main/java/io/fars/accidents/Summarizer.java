package io.fars.accidents;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Counts accidents per year and month over a batch of years and pivots the counts into a
 * {@link SummaryMatrix}. Years without data contribute nothing.
 */
public class Summarizer {
    private static final Logger log = LoggerFactory.getLogger(Summarizer.class);

    private final YearBatchLoader batchLoader;

    public Summarizer(YearBatchLoader batchLoader) {
        this.batchLoader = Objects.requireNonNull(batchLoader);
    }

    public SummaryMatrix summarize(List<Integer> years) {
        List<YearTaggedRow> combined = new ArrayList<>();
        for (YearResult r : batchLoader.loadYears(years)) {
            r.table().ifPresent(t -> combined.addAll(t.rows()));
        }
        SummaryMatrix matrix = pivot(combined);
        log.debug("summarized {} rows into {} month rows for years {}", combined.size(), matrix.rowCount(), matrix.years());
        return matrix;
    }

    static SummaryMatrix pivot(List<YearTaggedRow> rows) {
        if (rows.isEmpty()) return SummaryMatrix.empty();
        Map<Integer, Map<Integer, Long>> counts = new HashMap<>();
        for (YearTaggedRow row : rows) {
            counts.computeIfAbsent(row.month(), m -> new HashMap<>()).merge(row.year(), 1L, Long::sum);
        }
        return SummaryMatrix.of(counts);
    }
}
