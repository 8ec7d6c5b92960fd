package org.caseview.api;

/**
 * Base type for failures raised while opening a case store.
 * <p>
 * Both subtypes are fatal for the reader: no query method can be called
 * once construction has failed.
 */
public class CaseStoreException extends Exception {

    public CaseStoreException(String message) {
        super(message);
    }

    public CaseStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
