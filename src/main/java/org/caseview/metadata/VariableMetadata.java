package org.caseview.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import org.caseview.codec.JsonArrays;
import org.caseview.model.ShapedArray;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Recorded metadata of one variable, keyed by its absolute name.
 *
 * @param absoluteName the fully qualified variable name
 * @param shape        the value shape, or {@code null} when not recorded
 * @param units        the units string, or {@code null}
 * @param explicit     whether the owning component is explicit, or {@code null} for inputs
 * @param types        kind tags such as {@code output}, {@code desvar}, {@code objective}
 * @param lower        lower bound broadcast to {@code shape}, or {@code null}
 * @param upper        upper bound broadcast to {@code shape}, or {@code null}
 * @param ref          scaling reference, or {@code null}
 * @param ref0         scaling zero reference, or {@code null}
 * @param resRef       residual scaling reference, or {@code null}
 * @param raw          the complete stored entry
 */
public record VariableMetadata(String absoluteName,
                               int[] shape,
                               String units,
                               Boolean explicit,
                               List<String> types,
                               ShapedArray lower,
                               ShapedArray upper,
                               ShapedArray ref,
                               ShapedArray ref0,
                               ShapedArray resRef,
                               JsonNode raw) {

    public static final String DESIGN_VARIABLE = "desvar";
    public static final String OBJECTIVE = "objective";
    public static final String CONSTRAINT = "constraint";

    /**
     * Builds metadata from one stored {@code abs2meta} entry.
     *
     * @throws IllegalArgumentException if a bound or reference is not numeric.
     */
    static VariableMetadata fromJson(String absoluteName, JsonNode meta) {
        int[] shape = JsonArrays.toShape(meta.get("shape"));
        if (shape == null && meta.hasNonNull("size")) {
            shape = new int[] {meta.get("size").asInt()};
        }
        JsonNode unitsNode = meta.get("units");
        String units = unitsNode == null || unitsNode.isNull() ? null : unitsNode.asText();
        JsonNode explicitNode = meta.get("explicit");
        Boolean explicit = explicitNode == null || explicitNode.isNull() ? null : explicitNode.asBoolean();

        List<String> types = new ArrayList<>();
        JsonNode typeNode = meta.get("type");
        if (typeNode != null && typeNode.isArray()) {
            typeNode.forEach(t -> types.add(t.asText()));
        } else if (typeNode != null && !typeNode.isNull()) {
            types.add(typeNode.asText());
        }

        return new VariableMetadata(
            absoluteName,
            shape,
            units,
            explicit,
            Collections.unmodifiableList(types),
            JsonArrays.toArray(meta.get("lower"), shape),
            JsonArrays.toArray(meta.get("upper"), shape),
            JsonArrays.toArray(meta.get("ref"), shape),
            JsonArrays.toArray(meta.get("ref0"), shape),
            JsonArrays.toArray(meta.get("res_ref"), shape),
            meta);
    }

    @Override
    public int[] shape() {
        return shape == null ? null : shape.clone();
    }

    public boolean hasType(String type) {
        return types.contains(type);
    }

    public boolean isDesignVariable() {
        return hasType(DESIGN_VARIABLE);
    }

    public boolean isObjective() {
        return hasType(OBJECTIVE);
    }

    public boolean isConstraint() {
        return hasType(CONSTRAINT);
    }
}
