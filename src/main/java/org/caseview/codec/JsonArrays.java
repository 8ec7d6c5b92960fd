package org.caseview.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.caseview.model.ShapedArray;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts JSON numbers and (nested) number lists into {@link ShapedArray}s.
 */
public final class JsonArrays {

    private JsonArrays() {}

    /**
     * Converts a JSON value, taking the shape from metadata when one is known.
     * <p>
     * A scalar is broadcast to {@code shape}. A list keeps its own nesting unless
     * {@code shape} holds the same number of elements, in which case the list is
     * reshaped to it.
     *
     * @param value the JSON value; {@code null} or JSON null yields {@code null}.
     * @param shape the expected shape, or {@code null} when unknown.
     * @return the array, or {@code null}.
     * @throws IllegalArgumentException if the value is not numeric or is ragged.
     */
    public static ShapedArray toArray(JsonNode value, int[] shape) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (!value.isArray()) {
            double scalar = toDouble(value);
            return shape == null ? ShapedArray.of(new double[] {scalar}, 1) : ShapedArray.filled(scalar, shape);
        }
        List<Integer> dims = new ArrayList<>();
        JsonNode level = value;
        while (level.isArray()) {
            dims.add(level.size());
            if (level.size() == 0) {
                break;
            }
            level = level.get(0);
        }
        int[] nested = dims.stream().mapToInt(Integer::intValue).toArray();
        double[] data = new double[ShapedArray.sizeOf(nested)];
        int written = flatten(value, 0, nested, data, 0);
        if (written != data.length) {
            throw new IllegalArgumentException("Ragged array value: " + value);
        }
        if (shape != null && ShapedArray.sizeOf(shape) == data.length) {
            return ShapedArray.of(data, shape);
        }
        return ShapedArray.of(data, nested);
    }

    /**
     * Reads an integer shape from a JSON list ({@code [2, 3]}) or a bare integer.
     *
     * @return the shape, or {@code null} when the node is absent or JSON null.
     */
    public static int[] toShape(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return new int[] {node.asInt()};
        }
        int[] shape = new int[node.size()];
        for (int i = 0; i < shape.length; i++) {
            shape[i] = node.get(i).asInt();
        }
        return shape;
    }

    /**
     * Renders an array as a JSON number (scalars) or nested lists following its shape.
     */
    public static JsonNode toJson(ShapedArray array) {
        int[] shape = array.shape();
        if (shape.length == 0) {
            return JsonNodeFactory.instance.numberNode(array.get(0));
        }
        return nestedLevel(array, shape, 0, 0);
    }

    private static ArrayNode nestedLevel(ShapedArray array, int[] shape, int depth, int offset) {
        ArrayNode node = JsonNodeFactory.instance.arrayNode();
        int stride = 1;
        for (int d = depth + 1; d < shape.length; d++) {
            stride *= shape[d];
        }
        for (int i = 0; i < shape[depth]; i++) {
            if (depth == shape.length - 1) {
                node.add(array.get(offset + i));
            } else {
                node.add(nestedLevel(array, shape, depth + 1, offset + i * stride));
            }
        }
        return node;
    }

    private static int flatten(JsonNode node, int depth, int[] dims, double[] out, int offset) {
        if (depth == dims.length) {
            if (node.isArray()) {
                throw new IllegalArgumentException("Ragged array value at depth " + depth);
            }
            out[offset] = toDouble(node);
            return offset + 1;
        }
        if (!node.isArray() || node.size() != dims[depth]) {
            throw new IllegalArgumentException("Ragged array value at depth " + depth);
        }
        int next = offset;
        for (JsonNode child : node) {
            next = flatten(child, depth + 1, dims, out, next);
        }
        return next;
    }

    private static double toDouble(JsonNode node) {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? 1.0 : 0.0;
        }
        if (node.isNull()) {
            return Double.NaN;
        }
        if (node.isTextual()) {
            switch (node.textValue()) {
                case "NaN", "nan":
                    return Double.NaN;
                case "Infinity", "inf":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity", "-inf":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        throw new IllegalArgumentException("Non-numeric array element: " + node);
    }
}
