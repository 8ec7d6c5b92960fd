package org.caseview.metadata;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Configuration recorded for one solver.
 *
 * @param id            the solver's recorded id, e.g. {@code root.NonlinearBlockGS}
 * @param solverOptions decoded options
 * @param solverClass   the solver class name
 */
public record SolverMetadata(String id, JsonNode solverOptions, String solverClass) {
}
