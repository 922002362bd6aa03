package io.fars.accidents;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.fars.core.TableReader;
import io.fars.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads one accident file into a {@link RecordTable}. A missing file fails fast with
 * {@link NoSuchFileException}; reader failures propagate as thrown.
 */
public class RecordLoader {
    private static final Logger log = LoggerFactory.getLogger(RecordLoader.class);

    private final TableReader<RecordTable> reader;
    private final Path dataDir;
    private final Metrics metrics;

    public RecordLoader(TableReader<RecordTable> reader, Path dataDir) { this(reader, dataDir, null); }
    public RecordLoader(TableReader<RecordTable> reader, Path dataDir, MetricRegistry registry) {
        this.reader = Objects.requireNonNull(reader);
        this.dataDir = Objects.requireNonNull(dataDir);
        this.metrics = new Metrics(registry);
    }

    public RecordTable load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "does not exist");
        }
        RecordTable table;
        try (Timer.Context ignored = metrics.timer(Metrics.LOAD_TIME).time()) {
            table = reader.read(file);
        }
        metrics.counter(Metrics.FILES_LOADED).inc();
        metrics.counter(Metrics.RECORDS_LOADED).inc(table.size());
        log.debug("loaded {} rows from {}", table.size(), file);
        return table;
    }

    /** Loads the canonical file for {@code year} from the data directory. */
    public RecordTable loadYear(int year) throws IOException {
        return load(pathFor(year));
    }

    public Path pathFor(int year) {
        return dataDir.resolve(AccidentFiles.resolve(year));
    }
}
