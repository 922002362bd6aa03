package io.fars.accidents;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Canonical names of the yearly FARS accident files: {@code accident_<year>.csv.bz2}.
 */
public final class AccidentFiles {
    private static final String PATTERN = "accident_%d.csv.bz2";

    private AccidentFiles() {}

    public static String resolve(int year) {
        return String.format(PATTERN, year);
    }

    /**
     * Fractional years are truncated toward zero, so 2015.7 resolves like 2015.
     */
    public static String resolve(Number year) {
        return resolve(toYear(year));
    }

    public static String resolve(String year) {
        return resolve(toYear(year));
    }

    static int toYear(Number year) {
        if (year == null) throw new InvalidYearException("year is required");
        if (year instanceof Integer i) return i;
        double d = year.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) throw new InvalidYearException("not an integer year: " + year);
        return toYear(BigDecimal.valueOf(d), year.toString());
    }

    static int toYear(String year) {
        if (year == null) throw new InvalidYearException("year is required");
        try {
            return toYear(new BigDecimal(year.trim()), year);
        } catch (NumberFormatException e) {
            throw new InvalidYearException("not an integer year: '" + year + "'", e);
        }
    }

    private static int toYear(BigDecimal value, String raw) {
        try {
            return value.setScale(0, RoundingMode.DOWN).intValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidYearException("year out of range: " + raw, e);
        }
    }
}
