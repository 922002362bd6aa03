package io.fars.accidents;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.fars.config.FarsConfig;
import io.fars.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI over the accident files: monthly summaries across years and per-state accident maps.
 */
@CommandLine.Command(name = "fars", mixinStandardHelpOptions = true,
        description = "Summarize and map FARS accident files (accident_<year>.csv.bz2)",
        subcommands = {FarsMain.Summarize.class, FarsMain.MapState.class})
public final class FarsMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(FarsMain.class);

    static final int EXIT_LOAD_FAILURE = 1;
    static final int EXIT_INVALID_INPUT = 2;

    @CommandLine.Option(names = {"-d", "--data-dir"}, description = "Directory holding the accident files (default: fars.data / FARS_DATA / .)")
    Path dataDir;

    @CommandLine.Option(names = {"-w", "--workers"}, description = "Threads used to load years (default: fars.workers / FARS_WORKERS / 1)")
    Integer workers;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int code = new CommandLine(new FarsMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_INVALID_INPUT;
    }

    FarsConfig config() {
        FarsConfig cfg = FarsConfig.fromEnv();
        if (dataDir != null) cfg = cfg.withDataDir(dataDir);
        if (workers != null) cfg = cfg.withWorkers(workers);
        return cfg;
    }

    Injector injector(FarsConfig cfg) {
        return Guice.createInjector(new FarsModule(cfg));
    }

    private static void logLoadStats(MetricRegistry registry) {
        log.info("loaded files={} records={} invalidYears={}",
                registry.counter(Metrics.FILES_LOADED).getCount(),
                registry.counter(Metrics.RECORDS_LOADED).getCount(),
                registry.counter(Metrics.YEARS_INVALID).getCount());
    }

    @CommandLine.Command(name = "summarize", mixinStandardHelpOptions = true,
            description = "Count accidents per month for each year")
    static final class Summarize implements Callable<Integer> {
        @CommandLine.ParentCommand
        FarsMain parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(arity = "1..*", paramLabel = "YEAR", description = "Years to summarize")
        List<String> years = new ArrayList<>();

        @CommandLine.Option(names = {"-o", "--out"}, description = "Write the summary CSV here instead of stdout")
        Path out;

        @Override
        public Integer call() throws IOException {
            PrintWriter err = spec.commandLine().getErr();
            List<Integer> parsed = new ArrayList<>(years.size());
            try {
                for (String y : years) parsed.add(AccidentFiles.toYear(y));
            } catch (InvalidYearException e) {
                err.println(e.getMessage());
                return EXIT_INVALID_INPUT;
            }

            Injector injector = parent.injector(parent.config());
            SummaryMatrix matrix = injector.getInstance(Summarizer.class).summarize(parsed);
            logLoadStats(injector.getInstance(MetricRegistry.class));

            SummaryCsvWriter writer = new SummaryCsvWriter();
            if (out != null) {
                writer.write(matrix, out);
                log.info("wrote summary of {} months to {}", matrix.rowCount(), out);
            } else {
                PrintWriter stdout = spec.commandLine().getOut();
                writer.write(matrix, stdout);
                stdout.flush();
            }
            return 0;
        }
    }

    @CommandLine.Command(name = "map", mixinStandardHelpOptions = true,
            description = "Plot the accidents of one state in one year as an SVG map")
    static final class MapState implements Callable<Integer> {
        @CommandLine.ParentCommand
        FarsMain parent;

        @CommandLine.Spec
        CommandLine.Model.CommandSpec spec;

        @CommandLine.Parameters(index = "0", paramLabel = "STATE", description = "FARS state code, e.g. 20")
        String state;

        @CommandLine.Parameters(index = "1", paramLabel = "YEAR")
        String year;

        @CommandLine.Option(names = {"-o", "--out"}, description = "SVG file (default: <out dir>/state_<STATE>_<YEAR>.svg)")
        Path out;

        @Override
        public Integer call() {
            PrintWriter err = spec.commandLine().getErr();
            FarsConfig cfg = parent.config();
            Injector injector = parent.injector(cfg);
            SvgMapCanvas canvas = new SvgMapCanvas(cfg.mapWidth(), cfg.mapHeight());
            StateMapPlotter plotter = new StateMapPlotter(injector.getInstance(RecordLoader.class),
                    canvas, canvas, injector.getInstance(MetricRegistry.class));
            try {
                int y = AccidentFiles.toYear(year);
                plotter.plotState(state, y);
                if (canvas.pointsDrawn() > 0) {
                    Path target = out != null ? out : cfg.outputDir().resolve("state_" + state.trim() + "_" + y + ".svg");
                    canvas.writeTo(target);
                    log.info("wrote map with {} accidents to {}", canvas.pointsDrawn(), target);
                }
                return 0;
            } catch (InvalidYearException | InvalidStateException e) {
                err.println(e.getMessage());
                return EXIT_INVALID_INPUT;
            } catch (NoSuchFileException e) {
                err.println("file '" + e.getFile() + "' does not exist");
                return EXIT_LOAD_FAILURE;
            } catch (IOException e) {
                err.println("failed to read " + year + ": " + e.getMessage());
                return EXIT_LOAD_FAILURE;
            }
        }
    }
}
