package org.caseview.coordinate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * An iteration coordinate together with its parsed segment sequence.
 * <p>
 * Coordinates alternate identifier segments and numeric iteration indices, e.g.
 * {@code rank0:SLSQP|3|root._solve_nonlinear|3|NLRunOnce|0}. Splitting on
 * "pipe, digits, optional trailing pipes" keeps the identifiers plus one trailing
 * empty segment, so a driver coordinate has two segments. The empty coordinate is
 * the implicit root.
 */
public final class IterationCoordinate {

    /** Segment count of a driver coordinate and the conventional length of the root. */
    public static final int ROOT_LENGTH = 2;

    public static final IterationCoordinate ROOT = new IterationCoordinate("");

    public static final char DELIMITER = '|';

    private static final Pattern SEGMENT_SPLIT = Pattern.compile("\\|\\d+\\|*");

    private final String text;
    private final List<String> segments;

    private IterationCoordinate(String text) {
        this.text = text;
        this.segments = text.isEmpty()
            ? List.of()
            : Collections.unmodifiableList(Arrays.asList(SEGMENT_SPLIT.split(text, -1)));
    }

    /**
     * Parses a coordinate; {@code null} and the empty string denote the root.
     */
    public static IterationCoordinate of(String text) {
        return text == null || text.isEmpty() ? ROOT : new IterationCoordinate(text);
    }

    public String text() {
        return text;
    }

    /**
     * @return the split segments; the root has none.
     */
    public List<String> segments() {
        return segments;
    }

    /**
     * @return the segment count, {@link #ROOT_LENGTH} for the root.
     */
    public int segmentCount() {
        return isRoot() ? ROOT_LENGTH : segments.size();
    }

    public boolean isRoot() {
        return text.isEmpty();
    }

    /**
     * Tests the prefix half of the parent relation: {@code other} starts with this
     * coordinate and continues with the delimiter right after it.
     */
    public boolean isPrefixOf(IterationCoordinate other) {
        if (isRoot()) {
            return !other.isRoot();
        }
        String candidate = other.text;
        return candidate.length() > text.length()
            && candidate.startsWith(text)
            && candidate.charAt(text.length()) == DELIMITER;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof IterationCoordinate other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
