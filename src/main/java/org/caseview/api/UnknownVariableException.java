package org.caseview.api;

/**
 * Thrown by name lookups when a variable name is unknown, or when a promoted
 * name resolves to more than one absolute name.
 */
public class UnknownVariableException extends RuntimeException {

    private final String name;

    public UnknownVariableException(String name, String message) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
