package io.fars.accidents;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/** Writes small bzip2 accident files shaped like the FARS releases. */
final class AccidentFixtures {
    static final String HEADER = "STATE,ST_CASE,MONTH,DAY,YEAR,LATITUDE,LONGITUD";

    private AccidentFixtures() {}

    static AccidentRecord row(int state, int month) {
        return new AccidentRecord(state, month, 39.05, -95.68);
    }

    static Path writeYear(Path dir, int year, List<AccidentRecord> rows) throws IOException {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        int caseNo = 1;
        for (AccidentRecord r : rows) {
            sb.append(r.state()).append(',')
              .append(r.state() * 10000 + caseNo++).append(',')
              .append(r.month()).append(',')
              .append(1).append(',')
              .append(year).append(',')
              .append(cell(r.latitude())).append(',')
              .append(cell(r.longitude())).append('\n');
        }
        return writeBz2(dir.resolve(AccidentFiles.resolve(year)), sb.toString());
    }

    private static String cell(Double coordinate) {
        return coordinate == null ? "" : coordinate.toString();
    }

    static Path writeBz2(Path file, String content) throws IOException {
        try (OutputStream out = new BZip2CompressorOutputStream(Files.newOutputStream(file))) {
            out.write(content.getBytes(StandardCharsets.UTF_8));
        }
        return file;
    }

    static void deleteRecursively(Path dir) throws IOException {
        if (dir == null || !Files.exists(dir)) return;
        try (var s = Files.walk(dir)) {
            s.sorted(Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (IOException ignore) {} });
        }
    }
}
