package org.caseview.store;

import java.nio.charset.StandardCharsets;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;

/**
 * One table row read positionally, detached from its result set.
 * <p>
 * Column indices are zero-based.
 */
public final class StoredRow {

    private final Object[] columns;

    StoredRow(Object[] columns) {
        this.columns = columns;
    }

    static StoredRow read(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Object[] columns = new Object[meta.getColumnCount()];
        for (int i = 0; i < columns.length; i++) {
            columns[i] = rs.getObject(i + 1);
        }
        return new StoredRow(columns);
    }

    public int size() {
        return columns.length;
    }

    public boolean isNull(int column) {
        return column >= columns.length || columns[column] == null;
    }

    public String text(int column) {
        if (isNull(column)) {
            return null;
        }
        Object value = columns[column];
        return value instanceof byte[] bytes ? new String(bytes, StandardCharsets.UTF_8) : value.toString();
    }

    /**
     * @return the column as raw bytes, whether stored as BLOB or TEXT, or {@code null}.
     */
    public byte[] bytes(int column) {
        if (isNull(column)) {
            return null;
        }
        Object value = columns[column];
        return value instanceof byte[] bytes ? bytes : value.toString().getBytes(StandardCharsets.UTF_8);
    }

    public long longValue(int column) {
        Object value = columns[column];
        if (value instanceof Number number) {
            return number.longValue();
        }
        return value == null ? 0L : Long.parseLong(value.toString());
    }

    public double doubleValue(int column) {
        Double value = nullableDouble(column);
        return value == null ? 0.0 : value;
    }

    public Double nullableDouble(int column) {
        if (isNull(column)) {
            return null;
        }
        Object value = columns[column];
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    public boolean flag(int column) {
        return !isNull(column) && longValue(column) != 0;
    }
}
