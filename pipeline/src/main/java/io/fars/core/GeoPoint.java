package io.fars.core;

/**
 * A longitude/latitude pair in decimal degrees. A null coordinate means the value is unknown.
 */
public record GeoPoint(Double longitude, Double latitude) {

    public boolean isLocated() {
        return longitude != null && latitude != null;
    }
}
