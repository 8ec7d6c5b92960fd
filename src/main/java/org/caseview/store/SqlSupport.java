package org.caseview.store;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * JDBC helpers shared by the catalog builder and the category stores.
 */
public final class SqlSupport {

    private SqlSupport() {}

    /**
     * Checks whether a table exists in the open store.
     */
    public static boolean tableExists(Connection connection, String table) throws SQLException {
        String sql = "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?";
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Reads a serialized column as raw bytes, whether SQLite holds it as BLOB or TEXT.
     *
     * @return the bytes, or {@code null} for SQL NULL.
     */
    public static byte[] rawColumn(ResultSet rs, int column) throws SQLException {
        Object value = rs.getObject(column);
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        return value.toString().getBytes(StandardCharsets.UTF_8);
    }
}
