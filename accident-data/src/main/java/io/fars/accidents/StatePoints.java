package io.fars.accidents;

import io.fars.core.CoordinateRange;
import io.fars.core.GeoPoint;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Accident coordinates of one state and year, in row order.
 *
 * <p>FARS files encode an unknown position with out-of-range values such as 999.9999. This is a
 * convention of those files, not of coordinates in general: longitudes above
 * {@value #LONGITUDE_UNKNOWN_ABOVE} and latitudes above {@value #LATITUDE_UNKNOWN_ABOVE} become
 * missing here, as are coordinates that were blank in the file.
 */
public final class StatePoints {
    public static final double LONGITUDE_UNKNOWN_ABOVE = 900;
    public static final double LATITUDE_UNKNOWN_ABOVE = 90;

    private final int state;
    private final int year;
    private final List<GeoPoint> points;

    private StatePoints(int state, int year, List<GeoPoint> points) {
        this.state = state;
        this.year = year;
        this.points = List.copyOf(points);
    }

    public static StatePoints of(int state, int year, List<AccidentRecord> rows) {
        return new StatePoints(state, year, rows.stream().map(StatePoints::normalize).toList());
    }

    static GeoPoint normalize(AccidentRecord r) {
        return new GeoPoint(known(r.longitude(), LONGITUDE_UNKNOWN_ABOVE), known(r.latitude(), LATITUDE_UNKNOWN_ABOVE));
    }

    private static Double known(Double v, double unknownAbove) {
        if (v == null || !Double.isFinite(v) || v > unknownAbove) return null;
        return v;
    }

    public int state() { return state; }
    public int year() { return year; }
    public List<GeoPoint> points() { return points; }
    public int size() { return points.size(); }

    public long locatedCount() {
        return points.stream().filter(GeoPoint::isLocated).count();
    }

    /** Observed range of the non-missing longitudes. */
    public Optional<CoordinateRange> longitudeRange() {
        return CoordinateRange.of(points.stream().map(GeoPoint::longitude).filter(Objects::nonNull).mapToDouble(Double::doubleValue));
    }

    /** Observed range of the non-missing latitudes. */
    public Optional<CoordinateRange> latitudeRange() {
        return CoordinateRange.of(points.stream().map(GeoPoint::latitude).filter(Objects::nonNull).mapToDouble(Double::doubleValue));
    }
}
