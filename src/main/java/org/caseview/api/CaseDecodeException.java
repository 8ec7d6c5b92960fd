package org.caseview.api;

/**
 * Thrown when a stored value of a single case cannot be decoded.
 * <p>
 * Carries the iteration coordinate (or problem case name) of the corrupt
 * record so callers can tell which row is at fault.
 */
public class CaseDecodeException extends RuntimeException {

    private final String coordinate;

    public CaseDecodeException(String coordinate, String message, Throwable cause) {
        super("Failed to decode case '" + coordinate + "': " + message, cause);
        this.coordinate = coordinate;
    }

    public CaseDecodeException(String coordinate, String message) {
        this(coordinate, message, null);
    }

    /**
     * @return the coordinate or case name of the record that failed to decode.
     */
    public String getCoordinate() {
        return coordinate;
    }
}
