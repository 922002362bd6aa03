package io.fars.core;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parses a whole tabular file into an in-memory table. Implementations read to completion and
 * must not write progress output; format errors are reported by throwing.
 */
@FunctionalInterface
public interface TableReader<T> {
    T read(Path file) throws IOException;
}
