package org.caseview.model;

/**
 * The recorded event kinds, each stored in its own table with its own key space.
 */
public enum Category {
    DRIVER("driver", "driver_iterations", "iteration_coordinate", true),
    DRIVER_DERIVATIVE("driver_derivatives", "driver_derivatives", "iteration_coordinate", false),
    SYSTEM("system", "system_iterations", "iteration_coordinate", true),
    SOLVER("solver", "solver_iterations", "iteration_coordinate", true),
    PROBLEM("problem", "problem_cases", "case_name", false);

    private final String label;
    private final String table;
    private final String keyColumn;
    private final boolean alwaysPresent;

    Category(String label, String table, String keyColumn, boolean alwaysPresent) {
        this.label = label;
        this.table = table;
        this.keyColumn = keyColumn;
        this.alwaysPresent = alwaysPresent;
    }

    public String label() {
        return label;
    }

    public String table() {
        return table;
    }

    /**
     * @return the column identifying a row: the iteration coordinate, or the case name for problem cases.
     */
    public String keyColumn() {
        return keyColumn;
    }

    /**
     * @return whether every supported store layout contains this category's table.
     */
    public boolean alwaysPresent() {
        return alwaysPresent;
    }
}
