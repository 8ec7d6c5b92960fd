package org.caseview.model;

import org.caseview.api.UnknownVariableException;
import org.caseview.metadata.MetadataCatalog;
import org.caseview.metadata.VariableNamespace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recorded total derivatives keyed by (response, design variable).
 * <p>
 * Either side of a lookup may be given as a promoted or an absolute name.
 */
public final class Jacobian {

    private final Map<DerivativeKey, ShapedArray> blocks;
    private final MetadataCatalog catalog;

    public Jacobian(Map<DerivativeKey, ShapedArray> blocks, MetadataCatalog catalog) {
        this.blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
        this.catalog = catalog;
    }

    /**
     * @return the recorded (of, wrt) pairs in recorded order.
     */
    public Set<DerivativeKey> keys() {
        return blocks.keySet();
    }

    /**
     * Returns the derivative block of {@code of} with respect to {@code wrt}.
     *
     * @throws UnknownVariableException if the pair is not recorded or the names are ambiguous.
     */
    public ShapedArray get(String of, String wrt) {
        ShapedArray direct = blocks.get(new DerivativeKey(of, wrt));
        if (direct != null) {
            return direct;
        }

        List<DerivativeKey> matches = new ArrayList<>();
        for (String ofName : aliases(of)) {
            for (String wrtName : aliases(wrt)) {
                DerivativeKey key = new DerivativeKey(ofName, wrtName);
                if (blocks.containsKey(key)) {
                    matches.add(key);
                }
            }
        }
        if (matches.isEmpty()) {
            throw new UnknownVariableException(of + "," + wrt,
                "No derivative of '" + of + "' with respect to '" + wrt + "' is recorded");
        }
        if (matches.size() > 1) {
            throw new UnknownVariableException(of + "," + wrt,
                "Derivative key '" + of + "," + wrt + "' is ambiguous; candidates are " + matches);
        }
        return blocks.get(matches.get(0));
    }

    private Set<String> aliases(String name) {
        Set<String> names = new LinkedHashSet<>();
        names.add(name);
        if (catalog == null) {
            return names;
        }
        for (VariableNamespace ns : VariableNamespace.values()) {
            names.addAll(catalog.absoluteNames(name, ns));
            catalog.promotedName(name, ns).ifPresent(names::add);
        }
        return names;
    }

    public Map<DerivativeKey, ShapedArray> asMap() {
        return blocks;
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Jacobian other && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return blocks.hashCode();
    }

    @Override
    public String toString() {
        return blocks.toString();
    }
}
