package org.caseview.store;

import org.caseview.codec.ValueDecoder;
import org.caseview.coordinate.SourceNames;
import org.caseview.model.Case;
import org.caseview.model.Category;
import org.caseview.model.Jacobian;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Total derivatives computed by the driver, one row per driver iteration that recorded them.
 */
public class DriverDerivativeCaseStore extends CategoryStore {

    private static final int DERIVATIVES = 6;

    public DriverDerivativeCaseStore(Connection connection, ValueDecoder decoder) {
        super(Category.DRIVER_DERIVATIVE, connection, decoder);
    }

    @Override
    protected Case decode(StoredRow row) {
        String coordinate = row.text(2);
        return Case.builder(category, coordinate)
            .source(SourceNames.DRIVER)
            .counter(row.longValue(1))
            .timestamp(row.doubleValue(3))
            .success(row.flag(4))
            .message(row.text(5))
            .jacobian(decoder.decodeJacobian(row.bytes(DERIVATIVES), coordinate))
            .catalog(decoder.catalog())
            .build();
    }

    /**
     * Reads the derivatives recorded for a driver iteration.
     *
     * @return the Jacobian, or empty when none were recorded for the coordinate.
     */
    public Optional<Jacobian> jacobianFor(String coordinate) throws SQLException {
        if (!contains(coordinate)) {
            return Optional.empty();
        }
        StoredRow row = fetch(coordinate);
        return row == null
            ? Optional.empty()
            : Optional.ofNullable(decoder.decodeJacobian(row.bytes(DERIVATIVES), coordinate));
    }
}
