package org.caseview.store;

import org.caseview.codec.ValueDecoder;
import org.caseview.coordinate.IterationCoordinate;
import org.caseview.coordinate.SourceNames;
import org.caseview.metadata.VariableNamespace;
import org.caseview.model.Case;
import org.caseview.model.Category;

import java.sql.Connection;

/**
 * System iterations. Inputs, outputs and residuals are each optional.
 */
public class SystemCaseStore extends CategoryStore {

    private static final int INPUTS = 6;
    private static final int OUTPUTS = 7;
    private static final int RESIDUALS = 8;

    public SystemCaseStore(Connection connection, ValueDecoder decoder) {
        super(Category.SYSTEM, connection, decoder);
    }

    @Override
    protected Case decode(StoredRow row) {
        String coordinate = row.text(2);
        return Case.builder(category, coordinate)
            .source(SourceNames.systemSource(IterationCoordinate.of(coordinate)))
            .counter(row.longValue(1))
            .timestamp(row.doubleValue(3))
            .success(row.flag(4))
            .message(row.text(5))
            .inputs(decoder.decodeValues(row.bytes(INPUTS), coordinate, VariableNamespace.INPUT))
            .outputs(decoder.decodeValues(row.bytes(OUTPUTS), coordinate, VariableNamespace.OUTPUT))
            .residuals(decoder.decodeValues(row.bytes(RESIDUALS), coordinate, VariableNamespace.OUTPUT))
            .catalog(decoder.catalog())
            .build();
    }
}
