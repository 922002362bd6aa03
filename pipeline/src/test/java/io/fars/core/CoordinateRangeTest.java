package io.fars.core;

import org.junit.jupiter.api.Test;

import java.util.stream.DoubleStream;

import static org.junit.jupiter.api.Assertions.*;

class CoordinateRangeTest {
    @Test
    void rangeOfValues() {
        CoordinateRange r = CoordinateRange.of(DoubleStream.of(-95.2, -101.0, -94.6)).orElseThrow();
        assertEquals(-101.0, r.min());
        assertEquals(-94.6, r.max());
        assertEquals(6.4, r.span(), 1e-9);
        assertTrue(r.contains(-100));
        assertFalse(r.contains(-90));
    }

    @Test
    void noValuesNoRange() {
        assertTrue(CoordinateRange.of(DoubleStream.empty()).isEmpty());
    }

    @Test
    void rejectsInvertedOrNaNBounds() {
        assertThrows(IllegalArgumentException.class, () -> new CoordinateRange(2, 1));
        assertThrows(IllegalArgumentException.class, () -> new CoordinateRange(Double.NaN, 1));
        assertThrows(IllegalArgumentException.class, () -> new CoordinateRange(Double.NEGATIVE_INFINITY, 1));
        assertThrows(IllegalArgumentException.class, () -> new CoordinateRange(0, Double.POSITIVE_INFINITY));
    }

    @Test
    void clampLimitsBothEnds() {
        assertEquals(new CoordinateRange(-180, -95), new CoordinateRange(-1e9, -95).clamp(-180, 180));
        assertEquals(new CoordinateRange(-180, -180), new CoordinateRange(-2e9, -1e9).clamp(-180, 180));
        assertEquals(new CoordinateRange(30, 40), new CoordinateRange(30, 40).clamp(-90, 90));
    }

    @Test
    void pointIsLocatedOnlyWithBothCoordinates() {
        assertTrue(new GeoPoint(-95.0, 39.0).isLocated());
        assertFalse(new GeoPoint(null, 39.0).isLocated());
        assertFalse(new GeoPoint(-95.0, null).isLocated());
    }
}
