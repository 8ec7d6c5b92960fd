package org.caseview.metadata;

/**
 * The two variable name spaces. The same promoted name may exist in both, so
 * name maps are kept per namespace.
 */
public enum VariableNamespace {
    INPUT("input"),
    OUTPUT("output");

    private final String key;

    VariableNamespace(String key) {
        this.key = key;
    }

    /**
     * @return the key used for this namespace inside stored name maps.
     */
    public String key() {
        return key;
    }
}
