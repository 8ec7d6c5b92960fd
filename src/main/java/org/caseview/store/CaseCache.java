package org.caseview.store;

import org.caseview.model.Case;

import java.util.HashMap;
import java.util.Map;

/**
 * Unbounded per-category cache of materialised cases, keyed by coordinate or case name.
 * <p>
 * Not thread-safe; a reader is used from one thread.
 */
final class CaseCache {

    private final Map<String, Case> cases = new HashMap<>();

    Case get(String id) {
        return cases.get(id);
    }

    void put(Case value) {
        cases.put(value.iterationCoordinate(), value);
    }

    int size() {
        return cases.size();
    }

    void clear() {
        cases.clear();
    }
}
