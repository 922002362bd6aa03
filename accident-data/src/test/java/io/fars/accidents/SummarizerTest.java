package io.fars.accidents;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class SummarizerTest {
    private Path tmp;
    private Summarizer summarizer;

    @BeforeEach
    void setup() throws IOException {
        tmp = Files.createTempDirectory("summary-test");
        summarizer = new Summarizer(new YearBatchLoader(new RecordLoader(new AccidentCsvReader(), tmp)));
    }

    @AfterEach
    void cleanup() throws IOException {
        AccidentFixtures.deleteRecursively(tmp);
    }

    @Test
    void countsPerMonthAndYearLeavingAbsentCellsEmpty() throws Exception {
        AccidentFixtures.writeYear(tmp, 2013, List.of(
                AccidentFixtures.row(1, 1), AccidentFixtures.row(2, 1), AccidentFixtures.row(1, 1)));
        AccidentFixtures.writeYear(tmp, 2014, List.of(
                AccidentFixtures.row(1, 1), AccidentFixtures.row(5, 2), AccidentFixtures.row(1, 1)));

        SummaryMatrix m = summarizer.summarize(List.of(2013, 2014));

        assertEquals(List.of(1, 2), m.months());
        assertEquals(List.of(2013, 2014), m.years());
        assertEquals(OptionalLong.of(3), m.count(1, 2013));
        assertEquals(OptionalLong.of(2), m.count(1, 2014));
        assertEquals(OptionalLong.empty(), m.count(2, 2013));
        assertEquals(OptionalLong.of(1), m.count(2, 2014));
        assertEquals(OptionalLong.empty(), m.count(7, 2014));
    }

    @Test
    void missingYearsContributeNothing() throws Exception {
        AccidentFixtures.writeYear(tmp, 2015, List.of(AccidentFixtures.row(1, 12), AccidentFixtures.row(1, 4)));

        SummaryMatrix m = summarizer.summarize(List.of(9999, 2015));

        assertEquals(List.of(2015), m.years());
        assertEquals(List.of(4, 12), m.months());
    }

    @Test
    void allYearsMissingGivesEmptyMatrixAndTwoWarnings() {
        SummaryMatrix m;
        try (LogCapture logs = LogCapture.of(YearBatchLoader.class)) {
            m = summarizer.summarize(List.of(8888, 9999));
            List<String> warnings = logs.messages(Level.WARN);
            assertEquals(2, warnings.size(), warnings.toString());
            assertTrue(warnings.get(0).contains("8888"));
            assertTrue(warnings.get(1).contains("9999"));
        }
        assertTrue(m.isEmpty());
        assertEquals(SummaryMatrix.empty(), m);
        assertTrue(m.months().isEmpty());
        assertTrue(m.years().isEmpty());
    }

    @Test
    void rowsWithBlankCoordinatesAreStillCounted() throws Exception {
        AccidentFixtures.writeBz2(tmp.resolve(AccidentFiles.resolve(2015)),
                "STATE,MONTH,LATITUDE,LONGITUD\n1,1,33.0,-86.0\n1,2,,-86.0\n");

        SummaryMatrix m = summarizer.summarize(List.of(2015));

        assertEquals(List.of(2015), m.years());
        assertEquals(OptionalLong.of(1), m.count(1, 2015));
        assertEquals(OptionalLong.of(1), m.count(2, 2015));
    }

    @Test
    void repeatedCallsGiveEqualMatrices() throws Exception {
        AccidentFixtures.writeYear(tmp, 2013, List.of(AccidentFixtures.row(1, 3), AccidentFixtures.row(1, 5)));
        AccidentFixtures.writeYear(tmp, 2014, List.of(AccidentFixtures.row(1, 3)));

        SummaryMatrix first = summarizer.summarize(List.of(2014, 2013));
        SummaryMatrix second = summarizer.summarize(List.of(2014, 2013));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void duplicateYearsAreCountedOncePerRequest() throws Exception {
        AccidentFixtures.writeYear(tmp, 2013, List.of(AccidentFixtures.row(1, 3)));
        SummaryMatrix m = summarizer.summarize(List.of(2013, 2013));
        assertEquals(OptionalLong.of(2), m.count(3, 2013));
    }

    @Test
    void pivotOfNoRowsIsEmpty() {
        assertTrue(Summarizer.pivot(List.of()).isEmpty());
    }

    @Test
    void pivotSortsMonthsAndYears() {
        SummaryMatrix m = Summarizer.pivot(List.of(
                new YearTaggedRow(11, 2015), new YearTaggedRow(2, 2013), new YearTaggedRow(11, 2015)));
        assertEquals(List.of(2, 11), m.months());
        assertEquals(List.of(2013, 2015), m.years());
        assertEquals(OptionalLong.of(2), m.count(11, 2015));
    }
}
