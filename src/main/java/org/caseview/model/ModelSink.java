package org.caseview.model;

/**
 * Consumer of recorded values, such as a live model being restored from a case.
 */
@FunctionalInterface
public interface ModelSink {

    /**
     * Receives one recorded variable.
     *
     * @param name  the variable name as recorded
     * @param value the recorded value
     */
    void setValue(String name, ShapedArray value);
}
