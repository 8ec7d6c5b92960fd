package org.caseview.store;

import org.caseview.codec.ValueDecoder;
import org.caseview.coordinate.SourceNames;
import org.caseview.metadata.VariableNamespace;
import org.caseview.model.Case;
import org.caseview.model.Category;

import java.sql.Connection;

/**
 * Problem snapshots, keyed by the user-supplied case name.
 */
public class ProblemCaseStore extends CategoryStore {

    private static final int OUTPUTS = 6;

    public ProblemCaseStore(Connection connection, ValueDecoder decoder) {
        super(Category.PROBLEM, connection, decoder);
    }

    @Override
    protected Case decode(StoredRow row) {
        String name = row.text(2);
        return Case.builder(category, name)
            .source(SourceNames.PROBLEM)
            .counter(row.longValue(1))
            .timestamp(row.doubleValue(3))
            .success(row.flag(4))
            .message(row.text(5))
            .outputs(decoder.decodeValues(row.bytes(OUTPUTS), name, VariableNamespace.OUTPUT))
            .catalog(decoder.catalog())
            .build();
    }
}
