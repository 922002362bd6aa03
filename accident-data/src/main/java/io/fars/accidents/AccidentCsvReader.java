package io.fars.accidents;

import io.fars.core.TableReader;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPInputStream;

/**
 * Reads a FARS accident file (bzip2, gzip or plain CSV, chosen by extension) with a header row.
 * Only STATE, MONTH and the coordinate columns are kept; the coordinate columns go by
 * LATITUDE/LATITUD and LONGITUDE/LONGITUD depending on the release. A row with a blank or NA
 * coordinate is kept with that coordinate missing.
 */
public class AccidentCsvReader implements TableReader<RecordTable> {
    static final String STATE = "STATE";
    static final String MONTH = "MONTH";
    static final List<String> LATITUDE = List.of("LATITUDE", "LATITUD");
    static final List<String> LONGITUDE = List.of("LONGITUDE", "LONGITUD");
    static final String MISSING = "NA";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    @Override
    public RecordTable read(Path file) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(open(file), StandardCharsets.UTF_8));
             CSVParser parser = FORMAT.parse(reader)) {
            Map<String, Integer> header = parser.getHeaderMap();
            int state = require(file, header, List.of(STATE));
            int month = require(file, header, List.of(MONTH));
            int lat = require(file, header, LATITUDE);
            int lon = require(file, header, LONGITUDE);

            List<AccidentRecord> rows = new ArrayList<>();
            for (CSVRecord r : parser) {
                rows.add(new AccidentRecord(
                        intValue(file, r, state, STATE),
                        intValue(file, r, month, MONTH),
                        coordinate(file, r, lat, LATITUDE.get(0)),
                        coordinate(file, r, lon, LONGITUDE.get(0))));
            }
            return new RecordTable(rows);
        }
    }

    private static InputStream open(Path file) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(file));
        String name = file.getFileName().toString();
        try {
            if (name.endsWith(".bz2")) return new BZip2CompressorInputStream(in, true);
            if (name.endsWith(".gz")) return new GZIPInputStream(in);
            return in;
        } catch (IOException e) {
            in.close();
            throw e;
        }
    }

    private static int require(Path file, Map<String, Integer> header, List<String> aliases) throws RecordParseException {
        if (header != null) {
            for (String a : aliases) {
                Integer idx = header.get(a);
                if (idx != null) return idx;
            }
        }
        throw new RecordParseException(file, "missing column " + String.join("/", aliases));
    }

    private static int intValue(Path file, CSVRecord r, int idx, String column) throws RecordParseException {
        String raw = cell(file, r, idx, column);
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new RecordParseException(file, "line " + r.getRecordNumber() + ": " + column + " is not an integer: '" + raw + "'", e);
        }
    }

    /** Blank and NA cells are missing coordinates; NaN and infinities are not accepted. */
    private static Double coordinate(Path file, CSVRecord r, int idx, String column) throws RecordParseException {
        String raw = r.isSet(idx) ? r.get(idx) : "";
        if (raw.isEmpty() || MISSING.equals(raw)) return null;
        double v;
        try {
            v = Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new RecordParseException(file, "line " + r.getRecordNumber() + ": " + column + " is not a number: '" + raw + "'", e);
        }
        if (!Double.isFinite(v)) {
            throw new RecordParseException(file, "line " + r.getRecordNumber() + ": " + column + " is not finite: '" + raw + "'");
        }
        return v;
    }

    private static String cell(Path file, CSVRecord r, int idx, String column) throws RecordParseException {
        if (!r.isSet(idx)) {
            throw new RecordParseException(file, "line " + r.getRecordNumber() + ": no value for " + column);
        }
        return r.get(idx);
    }
}
