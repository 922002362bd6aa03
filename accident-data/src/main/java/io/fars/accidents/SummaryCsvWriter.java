package io.fars.accidents;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

/**
 * Writes a summary as CSV: a {@code MONTH,<year>,...} header and one line per month.
 * Cells without a value are left blank.
 */
public class SummaryCsvWriter {
    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator('\n')
            .build();

    public void write(SummaryMatrix matrix, Writer out) throws IOException {
        List<Integer> years = matrix.years();
        CSVPrinter printer = new CSVPrinter(out, FORMAT);
        printer.print("MONTH");
        for (Integer y : years) printer.print(y);
        printer.println();
        for (Integer month : matrix.months()) {
            printer.print(month);
            for (Integer y : years) {
                OptionalLong n = matrix.count(month, y);
                printer.print(n.isPresent() ? Long.toString(n.getAsLong()) : "");
            }
            printer.println();
        }
        printer.flush();
    }

    public void write(SummaryMatrix matrix, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(matrix, w);
        }
    }
}
