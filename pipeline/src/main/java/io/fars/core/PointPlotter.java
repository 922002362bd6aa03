package io.fars.core;

import java.util.List;

/**
 * Overlays points on the surface prepared by a {@link MapRenderer}.
 * Points with a missing coordinate are not drawn.
 */
public interface PointPlotter {
    void plotPoints(List<GeoPoint> points);
}
