package io.fars.core;

/**
 * Draws a base map for the given region restricted to longitude (x) and latitude (y) bounds.
 */
public interface MapRenderer {
    void drawBaseMap(String region, CoordinateRange longitude, CoordinateRange latitude);
}
