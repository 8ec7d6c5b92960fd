package org.caseview.coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives caller-facing source names from iteration coordinates.
 * <p>
 * A system records under the dotted path of the {@code ._solve_nonlinear} or
 * {@code ._apply_nonlinear} segments of its coordinate; a solver records under
 * the path of its owning system plus {@code .nonlinear_solver}, or
 * {@code .nonlinear_solver.linesearch} for a line search nested inside that solver.
 */
public final class SourceNames {

    public static final String DRIVER = "driver";
    public static final String PROBLEM = "problem";
    public static final String ROOT_SYSTEM = "root";

    static final String SOLVE_NONLINEAR = "._solve_nonlinear";
    static final String APPLY_NONLINEAR = "._apply_nonlinear";
    static final String NONLINEAR_SOLVER = ".nonlinear_solver";
    static final String LINESEARCH = ".linesearch";

    private static final Pattern RANK_PREFIX = Pattern.compile("^rank\\d+:");

    private SourceNames() {}

    /**
     * @return the source name of a system coordinate, {@code root} when it names no system.
     */
    public static String systemSource(IterationCoordinate coordinate) {
        List<String> path = new ArrayList<>();
        for (String segment : coordinate.segments()) {
            String system = systemName(segment);
            if (system != null) {
                path.add(system);
            }
        }
        return path.isEmpty() ? ROOT_SYSTEM : String.join(".", path);
    }

    /**
     * @return the source name of a solver coordinate.
     */
    public static String solverSource(IterationCoordinate coordinate) {
        List<String> segments = coordinate.segments();
        int lastSystem = -1;
        for (int i = 0; i < segments.size(); i++) {
            if (systemName(segments.get(i)) != null) {
                lastSystem = i;
            }
        }
        int solverSegments = 0;
        for (int i = lastSystem + 1; i < segments.size(); i++) {
            if (!segments.get(i).isEmpty()) {
                solverSegments++;
            }
        }
        String name = systemSource(coordinate) + NONLINEAR_SOLVER;
        return solverSegments > 1 ? name + LINESEARCH : name;
    }

    private static String systemName(String segment) {
        String name = RANK_PREFIX.matcher(segment).replaceFirst("");
        if (name.endsWith(SOLVE_NONLINEAR)) {
            return name.substring(0, name.length() - SOLVE_NONLINEAR.length());
        }
        if (name.endsWith(APPLY_NONLINEAR)) {
            return name.substring(0, name.length() - APPLY_NONLINEAR.length());
        }
        return null;
    }
}
