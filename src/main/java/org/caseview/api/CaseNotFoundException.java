package org.caseview.api;

/**
 * Thrown when no recorded case exists for a given iteration coordinate or
 * problem case name.
 */
public class CaseNotFoundException extends Exception {

    /**
     * Creates a new CaseNotFoundException with the given message.
     *
     * @param message description of the missing case.
     */
    public CaseNotFoundException(String message) {
        super(message);
    }
}
