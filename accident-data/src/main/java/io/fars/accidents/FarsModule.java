package io.fars.accidents;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.fars.config.FarsConfig;
import io.fars.core.TableReader;

public class FarsModule extends AbstractModule {
    private final FarsConfig config;

    public FarsModule(FarsConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(FarsConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton TableReader<RecordTable> tableReader() { return new AccidentCsvReader(); }

    @Provides @Singleton RecordLoader recordLoader(TableReader<RecordTable> reader, MetricRegistry registry) {
        return new RecordLoader(reader, config.dataDir(), registry);
    }

    @Provides @Singleton YearBatchLoader yearBatchLoader(RecordLoader loader, MetricRegistry registry) {
        return new YearBatchLoader(loader, config.workers(), registry);
    }

    @Provides @Singleton Summarizer summarizer(YearBatchLoader batchLoader) { return new Summarizer(batchLoader); }
}
