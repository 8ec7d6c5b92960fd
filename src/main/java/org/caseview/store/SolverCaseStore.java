package org.caseview.store;

import org.caseview.codec.ValueDecoder;
import org.caseview.coordinate.IterationCoordinate;
import org.caseview.coordinate.SourceNames;
import org.caseview.metadata.VariableNamespace;
import org.caseview.model.Case;
import org.caseview.model.Category;

import java.sql.Connection;

/**
 * Solver iterations, carrying the solver's absolute and relative errors.
 */
public class SolverCaseStore extends CategoryStore {

    private static final int ABS_ERR = 6;
    private static final int REL_ERR = 7;
    private static final int INPUTS = 8;
    private static final int OUTPUTS = 9;
    private static final int RESIDUALS = 10;

    public SolverCaseStore(Connection connection, ValueDecoder decoder) {
        super(Category.SOLVER, connection, decoder);
    }

    @Override
    protected Case decode(StoredRow row) {
        String coordinate = row.text(2);
        return Case.builder(category, coordinate)
            .source(SourceNames.solverSource(IterationCoordinate.of(coordinate)))
            .counter(row.longValue(1))
            .timestamp(row.doubleValue(3))
            .success(row.flag(4))
            .message(row.text(5))
            .absoluteError(row.nullableDouble(ABS_ERR))
            .relativeError(row.nullableDouble(REL_ERR))
            .inputs(decoder.decodeValues(row.bytes(INPUTS), coordinate, VariableNamespace.INPUT))
            .outputs(decoder.decodeValues(row.bytes(OUTPUTS), coordinate, VariableNamespace.OUTPUT))
            .residuals(decoder.decodeValues(row.bytes(RESIDUALS), coordinate, VariableNamespace.OUTPUT))
            .catalog(decoder.catalog())
            .build();
    }
}
