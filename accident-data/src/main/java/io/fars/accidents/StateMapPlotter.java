package io.fars.accidents;

import com.codahale.metrics.MetricRegistry;
import io.fars.core.CoordinateRange;
import io.fars.core.MapRenderer;
import io.fars.core.PointPlotter;
import io.fars.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Plots the accidents of one state in one year over a base map. Load failures propagate to the caller.
 */
public class StateMapPlotter {
    private static final Logger log = LoggerFactory.getLogger(StateMapPlotter.class);
    public static final String REGION = "state";

    private final RecordLoader loader;
    private final MapRenderer renderer;
    private final PointPlotter plotter;
    private final Metrics metrics;

    public StateMapPlotter(RecordLoader loader, MapRenderer renderer, PointPlotter plotter) {
        this(loader, renderer, plotter, null);
    }

    public StateMapPlotter(RecordLoader loader, MapRenderer renderer, PointPlotter plotter, MetricRegistry registry) {
        this.loader = Objects.requireNonNull(loader);
        this.renderer = Objects.requireNonNull(renderer);
        this.plotter = Objects.requireNonNull(plotter);
        this.metrics = new Metrics(registry);
    }

    /**
     * Same as {@link #plotState(int, int)} with the state code given as text, e.g. {@code "20"}.
     * Fractional codes are truncated.
     */
    public void plotState(String stateCode, int year) throws IOException {
        RecordTable table = loader.loadYear(year);
        plot(table, toState(stateCode), year);
    }

    public void plotState(int state, int year) throws IOException {
        RecordTable table = loader.loadYear(year);
        plot(table, state, year);
    }

    private void plot(RecordTable table, int state, int year) {
        if (!table.states().contains(state)) {
            throw new InvalidStateException(Integer.toString(state));
        }
        plotRecords(state, year, table.filterState(state).rows());
    }

    void plotRecords(int state, int year, List<AccidentRecord> rows) {
        if (rows.isEmpty()) {
            metrics.counter(Metrics.PLOT_EMPTY).inc();
            log.info("no accidents to plot");
            return;
        }
        StatePoints points = StatePoints.of(state, year, rows);
        Optional<CoordinateRange> lon = points.longitudeRange();
        Optional<CoordinateRange> lat = points.latitudeRange();
        if (lon.isEmpty() || lat.isEmpty()) {
            metrics.counter(Metrics.PLOT_EMPTY).inc();
            log.info("no located accidents to plot for state {} in {} ({} rows without coordinates)", state, year, rows.size());
            return;
        }
        renderer.drawBaseMap(REGION, lon.get(), lat.get());
        plotter.plotPoints(points.points());
        metrics.counter(Metrics.PLOT_RENDERED).inc();
        log.info("plotted {} of {} accidents for state {} in {}", points.locatedCount(), points.size(), state, year);
    }

    static int toState(String code) {
        if (code == null) throw new InvalidStateException("null");
        try {
            return new BigDecimal(code.trim()).setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidStateException(code, e);
        }
    }
}
