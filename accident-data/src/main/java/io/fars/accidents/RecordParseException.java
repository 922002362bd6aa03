package io.fars.accidents;

import java.io.IOException;
import java.nio.file.Path;

/**
 * An accident file was readable but did not hold the columns or values this pipeline consumes.
 */
public class RecordParseException extends IOException {
    private final Path file;

    public RecordParseException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public RecordParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }

    public Path file() { return file; }
}
