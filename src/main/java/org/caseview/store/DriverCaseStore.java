package org.caseview.store;

import org.caseview.codec.ValueDecoder;
import org.caseview.coordinate.SourceNames;
import org.caseview.metadata.VariableNamespace;
import org.caseview.model.Case;
import org.caseview.model.Category;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Driver iterations. Each case carries the derivatives recorded at the same coordinate, if any.
 */
public class DriverCaseStore extends CategoryStore {

    private static final int INPUTS = 6;
    private static final int OUTPUTS = 7;

    private final DriverDerivativeCaseStore derivatives;

    public DriverCaseStore(Connection connection, ValueDecoder decoder, DriverDerivativeCaseStore derivatives) {
        super(Category.DRIVER, connection, decoder);
        this.derivatives = derivatives;
    }

    @Override
    protected Case decode(StoredRow row) throws SQLException {
        String coordinate = row.text(2);
        return Case.builder(category, coordinate)
            .source(SourceNames.DRIVER)
            .counter(row.longValue(1))
            .timestamp(row.doubleValue(3))
            .success(row.flag(4))
            .message(row.text(5))
            .inputs(decoder.decodeValues(row.bytes(INPUTS), coordinate, VariableNamespace.INPUT))
            .outputs(decoder.decodeValues(row.bytes(OUTPUTS), coordinate, VariableNamespace.OUTPUT))
            .jacobian(derivatives == null ? null : derivatives.jacobianFor(coordinate).orElse(null))
            .catalog(decoder.catalog())
            .build();
    }
}
