package io.fars.accidents;

/** Raised when a value cannot be coerced to an integer year. */
public class InvalidYearException extends IllegalArgumentException {
    public InvalidYearException(String message) {
        super(message);
    }

    public InvalidYearException(String message, Throwable cause) {
        super(message, cause);
    }
}
