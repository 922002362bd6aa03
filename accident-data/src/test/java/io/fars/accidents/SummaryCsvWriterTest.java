package io.fars.accidents;

import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SummaryCsvWriterTest {
    @Test
    void writesBlankCellsForMissingCounts() throws Exception {
        SummaryMatrix m = SummaryMatrix.of(Map.of(
                1, Map.of(2013, 3L, 2014, 2L),
                2, Map.of(2014, 1L)));
        StringWriter out = new StringWriter();

        new SummaryCsvWriter().write(m, out);

        assertEquals("MONTH,2013,2014\n1,3,2\n2,,1\n", out.toString());
    }

    @Test
    void emptyMatrixIsHeaderOnly() throws Exception {
        StringWriter out = new StringWriter();
        new SummaryCsvWriter().write(SummaryMatrix.empty(), out);
        assertEquals("MONTH\n", out.toString());
    }

    @Test
    void writesToFileCreatingParents() throws Exception {
        Path tmp = Files.createTempDirectory("summary-csv-test");
        try {
            Path target = tmp.resolve("nested/summary.csv");
            new SummaryCsvWriter().write(SummaryMatrix.of(Map.of(6, Map.of(2015, 9L))), target);
            assertEquals(List.of("MONTH,2015", "6,9"), Files.readAllLines(target, StandardCharsets.UTF_8));
        } finally {
            AccidentFixtures.deleteRecursively(tmp);
        }
    }
}
