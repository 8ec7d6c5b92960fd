package org.caseview.coordinate;

import org.caseview.model.Category;

/**
 * A stored case as seen by the hierarchy: where it lives and when it was recorded.
 *
 * @param category   the category table holding the case
 * @param coordinate the parsed coordinate; for problem cases the case name
 * @param counter    the global write counter
 */
public record CaseKey(Category category, IterationCoordinate coordinate, long counter) {

    public String id() {
        return coordinate.text();
    }

    public int segmentCount() {
        return coordinate.segmentCount();
    }
}
