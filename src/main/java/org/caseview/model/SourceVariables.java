package org.caseview.model;

import java.util.List;

/**
 * Variable names recorded by the first case of a source.
 */
public record SourceVariables(List<String> inputs, List<String> outputs) {
}
