package io.fars.accidents;

/**
 * One accident row, reduced to the columns this pipeline consumes. Coordinates are kept as read,
 * sentinel values included; a null coordinate was blank or {@code NA} in the file.
 */
public record AccidentRecord(int state, int month, Double latitude, Double longitude) {}
