package io.fars.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;

public class Metrics {
    public static final String FILES_LOADED = "fars.files.loaded";
    public static final String RECORDS_LOADED = "fars.records.loaded";
    public static final String LOAD_TIME = "fars.load.time";
    public static final String YEARS_INVALID = "fars.years.invalid";
    public static final String PLOT_EMPTY = "fars.plot.empty";
    public static final String PLOT_RENDERED = "fars.plot.rendered";

    private final MetricRegistry registry;

    public Metrics(MetricRegistry registry) {
        this.registry = registry == null ? new MetricRegistry() : registry;
    }

    public Counter counter(String name) { return registry.counter(name); }
    public Timer timer(String name) { return registry.timer(name); }
}
