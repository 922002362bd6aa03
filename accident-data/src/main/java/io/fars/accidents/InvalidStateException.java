package io.fars.accidents;

/** Raised when a state code is not present in the loaded year's data. */
public class InvalidStateException extends IllegalArgumentException {
    private final String stateCode;

    public InvalidStateException(String stateCode) {
        super("invalid STATE number: " + stateCode);
        this.stateCode = stateCode;
    }

    public InvalidStateException(String stateCode, Throwable cause) {
        super("invalid STATE number: " + stateCode, cause);
        this.stateCode = stateCode;
    }

    public String stateCode() { return stateCode; }
}
