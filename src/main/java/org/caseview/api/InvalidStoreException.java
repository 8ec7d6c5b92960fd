package org.caseview.api;

/**
 * Thrown when a file is missing, unreadable, not a SQLite container, or does
 * not carry the tables and metadata row a case store must have.
 */
public class InvalidStoreException extends CaseStoreException {

    public InvalidStoreException(String message) {
        super(message);
    }

    public InvalidStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
