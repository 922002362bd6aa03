package io.fars.accidents;

import com.codahale.metrics.MetricRegistry;
import io.fars.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Loads a sequence of years, one {@link YearResult} per requested year in request order.
 * A year that fails to load is logged as a warning and reported as "no data"; it never fails the batch.
 */
public class YearBatchLoader {
    private static final Logger log = LoggerFactory.getLogger(YearBatchLoader.class);

    private final RecordLoader loader;
    private final int workers;
    private final Metrics metrics;

    public YearBatchLoader(RecordLoader loader) { this(loader, 1, null); }
    public YearBatchLoader(RecordLoader loader, int workers, MetricRegistry registry) {
        this.loader = Objects.requireNonNull(loader);
        this.workers = Math.max(1, workers);
        this.metrics = new Metrics(registry);
    }

    /**
     * @param years requested years, duplicates allowed; null elements are not
     * @throws NullPointerException before any year is loaded if {@code years} holds a null
     */
    public List<YearResult> loadYears(List<Integer> years) {
        for (int i = 0; i < years.size(); i++) {
            Objects.requireNonNull(years.get(i), "years[" + i + "] is null");
        }
        if (workers == 1 || years.size() < 2) {
            List<YearResult> out = new ArrayList<>(years.size());
            for (Integer year : years) out.add(loadYear(year));
            return out;
        }
        return loadParallel(years);
    }

    private List<YearResult> loadParallel(List<Integer> years) {
        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, years.size()), r -> {
            Thread t = new Thread(r, "fars-year-loader-" + threadIndex.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<YearResult>> futures = new ArrayList<>(years.size());
            for (Integer year : years) futures.add(pool.submit(() -> loadYear(year)));
            List<YearResult> out = new ArrayList<>(years.size());
            for (int i = 0; i < futures.size(); i++) {
                out.add(await(futures.get(i), years.get(i)));
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    private YearResult await(Future<YearResult> future, Integer year) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while loading year " + year, e);
        } catch (ExecutionException e) {
            // loadYear catches everything it can; this is an Error escaping the worker
            throw new IllegalStateException("loading year " + year + " crashed", e.getCause());
        }
    }

    YearResult loadYear(int year) {
        try {
            RecordTable table = loader.loadYear(year);
            return YearResult.loaded(YearTaggedTable.project(year, table));
        } catch (Exception e) {
            metrics.counter(Metrics.YEARS_INVALID).inc();
            log.warn("invalid year: {} ({})", year, e.getMessage());
            return YearResult.noData(year, e);
        }
    }
}
