package org.caseview.api;

/**
 * Thrown when a source string names neither a category, a hierarchy location
 * nor a stored iteration coordinate.
 */
public class SourceNotFoundException extends Exception {

    private final String source;

    public SourceNotFoundException(String source) {
        super("Source not found: " + source + ".");
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
