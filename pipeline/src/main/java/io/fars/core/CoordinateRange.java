package io.fars.core;

import java.util.Optional;
import java.util.stream.DoubleStream;

/** Closed interval [min, max] of degrees. */
public record CoordinateRange(double min, double max) {

    public CoordinateRange {
        if (!Double.isFinite(min) || !Double.isFinite(max) || min > max) {
            throw new IllegalArgumentException("invalid range [" + min + ", " + max + "]");
        }
    }

    public double span() { return max - min; }

    public boolean contains(double v) { return v >= min && v <= max; }

    /** This range limited to [lo, hi]; a range lying wholly outside collapses onto the nearer limit. */
    public CoordinateRange clamp(double lo, double hi) {
        double a = Math.min(Math.max(min, lo), hi);
        double b = Math.min(Math.max(max, lo), hi);
        return new CoordinateRange(a, b);
    }

    /**
     * Range over the given values, empty when there are none. Values must be finite.
     */
    public static Optional<CoordinateRange> of(DoubleStream values) {
        var stats = values.summaryStatistics();
        if (stats.getCount() == 0) return Optional.empty();
        return Optional.of(new CoordinateRange(stats.getMin(), stats.getMax()));
    }
}
