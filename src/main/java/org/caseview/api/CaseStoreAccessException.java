package org.caseview.api;

import java.sql.SQLException;

/**
 * Unchecked wrapper for a {@link SQLException} raised while a lazy case
 * sequence is being consumed.
 */
public class CaseStoreAccessException extends RuntimeException {

    public CaseStoreAccessException(String message, SQLException cause) {
        super(message, cause);
    }

    @Override
    public synchronized SQLException getCause() {
        return (SQLException) super.getCause();
    }
}
