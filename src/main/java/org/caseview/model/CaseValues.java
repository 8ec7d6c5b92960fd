package org.caseview.model;

import org.caseview.api.UnknownVariableException;
import org.caseview.metadata.MetadataCatalog;
import org.caseview.metadata.VariableNamespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Recorded values of one case in one namespace, keyed by the names the recorder used.
 * <p>
 * Lookups accept absolute or promoted names. A promoted name resolves through the
 * catalog to the absolute names recorded in this mapping; it must match exactly one.
 */
public final class CaseValues {

    private final Map<String, ShapedArray> values;
    private final VariableNamespace namespace;
    private final MetadataCatalog catalog;

    public CaseValues(Map<String, ShapedArray> values, VariableNamespace namespace, MetadataCatalog catalog) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.namespace = namespace;
        this.catalog = catalog;
    }

    /**
     * Returns the value of a variable.
     *
     * @param name an absolute or promoted name
     * @throws UnknownVariableException if the name is not recorded or is ambiguous.
     */
    public ShapedArray get(String name) {
        return find(name).orElseThrow(() -> new UnknownVariableException(name,
            "Variable '" + name + "' is not recorded in this case's " + namespace.key() + "s"));
    }

    /**
     * Like {@link #get(String)}, but empty when the name is not recorded.
     *
     * @throws UnknownVariableException if a promoted name matches several recorded variables.
     */
    public Optional<ShapedArray> find(String name) {
        ShapedArray direct = values.get(name);
        if (direct != null) {
            return Optional.of(direct);
        }
        if (catalog == null) {
            return Optional.empty();
        }

        List<String> present = new ArrayList<>();
        for (String absolute : catalog.absoluteNames(name, namespace)) {
            if (values.containsKey(absolute)) {
                present.add(absolute);
            }
        }
        if (present.size() > 1) {
            throw new UnknownVariableException(name, "The promoted name '" + name
                + "' is ambiguous in this case; use one of the absolute names " + present);
        }
        if (present.size() == 1) {
            return Optional.of(values.get(present.get(0)));
        }

        // Stores that keyed values by promoted name
        Optional<String> promoted = catalog.promotedName(name, namespace);
        if (promoted.isPresent() && values.containsKey(promoted.get())) {
            return Optional.of(values.get(promoted.get()));
        }
        return Optional.empty();
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * @return the recorded names in recorded order.
     */
    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, ShapedArray> asMap() {
        return values;
    }

    public VariableNamespace namespace() {
        return namespace;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CaseValues other)) {
            return false;
        }
        return namespace == other.namespace && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return 31 * namespace.hashCode() + values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
