package org.caseview.codec;

import com.fasterxml.jackson.databind.JsonNode;
import org.caseview.api.CaseDecodeException;
import org.caseview.metadata.MetadataCatalog;
import org.caseview.metadata.VariableNamespace;
import org.caseview.model.CaseValues;
import org.caseview.model.DerivativeKey;
import org.caseview.model.Jacobian;
import org.caseview.model.ShapedArray;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes stored case values into named arrays.
 * <p>
 * This is the only place besides {@link MetadataCatalog#build} that looks at the
 * store's value encoding. Structured-text stores hold a JSON object per column;
 * legacy stores hold a numpy structured array. Derivatives are numpy structured
 * arrays in every format. Shapes come from the catalog where it knows the variable.
 */
public final class ValueDecoder {

    private final FormatVersion version;
    private final MetadataCatalog catalog;

    public ValueDecoder(FormatVersion version, MetadataCatalog catalog) {
        this.version = version;
        this.catalog = catalog;
    }

    public FormatVersion version() {
        return version;
    }

    public MetadataCatalog catalog() {
        return catalog;
    }

    /**
     * Decodes one stored value column.
     *
     * @param raw        the column content, {@code null} when not recorded
     * @param coordinate the owning case, for error reporting
     * @param namespace  the namespace the names belong to
     * @return the values, or {@code null} when the column holds no recording.
     * @throws CaseDecodeException if the content cannot be decoded.
     */
    public CaseValues decodeValues(byte[] raw, String coordinate, VariableNamespace namespace) {
        if (raw == null || raw.length == 0) {
            return null;
        }
        Map<String, ShapedArray> values = switch (version.encoding()) {
            case STRUCTURED_TEXT -> decodeText(raw, coordinate, namespace);
            case LEGACY_BINARY -> decodeBinary(raw, coordinate, namespace);
        };
        return values == null ? null : new CaseValues(values, namespace, catalog);
    }

    /**
     * Decodes a stored derivatives column.
     *
     * @return the Jacobian, or {@code null} when the column holds no recording.
     * @throws CaseDecodeException if the content cannot be decoded.
     */
    public Jacobian decodeJacobian(byte[] raw, String coordinate) {
        if (raw == null || raw.length == 0) {
            return null;
        }
        Map<DerivativeKey, ShapedArray> blocks = new LinkedHashMap<>();
        try {
            NpyArrayReader.readRecords(raw).forEach((field, value) -> blocks.put(DerivativeKey.parse(field), value));
        } catch (IllegalArgumentException e) {
            throw new CaseDecodeException(coordinate, "invalid derivatives: " + e.getMessage(), e);
        }
        return new Jacobian(blocks, catalog);
    }

    private Map<String, ShapedArray> decodeText(byte[] raw, String coordinate, VariableNamespace namespace) {
        JsonNode tree;
        try {
            tree = Json.MAPPER.readTree(new String(raw, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CaseDecodeException(coordinate, "invalid JSON value: " + e.getMessage(), e);
        }
        if (tree == null || tree.isNull()) {
            return null;
        }
        if (!tree.isObject()) {
            throw new CaseDecodeException(coordinate, "expected a JSON object but found " + tree.getNodeType());
        }

        Map<String, ShapedArray> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tree.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                ShapedArray value = JsonArrays.toArray(field.getValue(), shapeOf(field.getKey(), namespace));
                if (value != null) {
                    values.put(field.getKey(), value);
                }
            } catch (IllegalArgumentException e) {
                throw new CaseDecodeException(coordinate,
                    "invalid value for '" + field.getKey() + "': " + e.getMessage(), e);
            }
        }
        return values;
    }

    private Map<String, ShapedArray> decodeBinary(byte[] raw, String coordinate, VariableNamespace namespace) {
        Map<String, ShapedArray> records;
        try {
            records = NpyArrayReader.readRecords(raw);
        } catch (IllegalArgumentException e) {
            throw new CaseDecodeException(coordinate, "invalid binary value: " + e.getMessage(), e);
        }
        Map<String, ShapedArray> values = new LinkedHashMap<>();
        records.forEach((name, value) -> {
            int[] shape = shapeOf(name, namespace);
            values.put(name, shape != null && ShapedArray.sizeOf(shape) == value.size() ? value.reshape(shape) : value);
        });
        return values;
    }

    private int[] shapeOf(String name, VariableNamespace namespace) {
        int[] shape = catalog.shapeOf(name);
        if (shape != null) {
            return shape;
        }
        List<String> absolute = catalog.absoluteNames(name, namespace);
        return absolute.size() == 1 ? catalog.shapeOf(absolute.get(0)) : null;
    }
}
