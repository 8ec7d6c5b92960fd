package org.caseview.reader;

import org.caseview.coordinate.CaseKey;

import java.util.List;

/**
 * A source string resolved against the store: the top-level items it names and how far to expand them.
 *
 * @param source the source as requested
 * @param items  the top-level items in execution order
 * @param depth  expansion depth, one of the {@code CoordinateHierarchy} depth constants
 */
record ResolvedSource(String source, List<CaseKey> items, int depth) {
}
