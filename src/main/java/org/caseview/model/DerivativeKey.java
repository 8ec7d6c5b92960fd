package org.caseview.model;

/**
 * Identifies one Jacobian block: the derivative of {@code of} with respect to {@code wrt}.
 */
public record DerivativeKey(String of, String wrt) {

    /**
     * Parses a recorded field name of the form {@code "<of>,<wrt>"}.
     *
     * @throws IllegalArgumentException if the name has no separator.
     */
    public static DerivativeKey parse(String fieldName) {
        int comma = fieldName.indexOf(',');
        if (comma < 0) {
            throw new IllegalArgumentException("Derivative field '" + fieldName + "' is not of the form 'of,wrt'");
        }
        return new DerivativeKey(fieldName.substring(0, comma), fieldName.substring(comma + 1));
    }

    @Override
    public String toString() {
        return of + "," + wrt;
    }
}
