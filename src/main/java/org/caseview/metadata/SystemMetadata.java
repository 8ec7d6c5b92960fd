package org.caseview.metadata;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Configuration recorded for one system: its scaling factors and component options.
 *
 * @param id               the system's recorded id
 * @param scalingFactors   decoded scaling factors
 * @param componentOptions decoded component options
 */
public record SystemMetadata(String id, JsonNode scalingFactors, JsonNode componentOptions) {
}
