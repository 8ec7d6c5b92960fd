package org.caseview.model;

import java.util.Map;

/**
 * One node of a nested case listing: a value plus its direct children in execution order.
 *
 * @param value    the node's value, a coordinate or a {@link Case}
 * @param children direct children keyed by coordinate; empty for leaves
 * @param <V>      the node value type
 */
public record CaseTree<V>(V value, Map<String, CaseTree<V>> children) {

    public boolean isLeaf() {
        return children.isEmpty();
    }
}
