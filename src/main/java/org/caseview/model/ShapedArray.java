package org.caseview.model;

import java.util.Arrays;

/**
 * Immutable numeric array with a row-major shape.
 * <p>
 * Every recorded value is held as doubles regardless of the stored element
 * type; integer and boolean fields are widened on decode.
 */
public final class ShapedArray {

    private static final int[] SCALAR_SHAPE = new int[0];

    private final double[] data;
    private final int[] shape;

    private ShapedArray(double[] data, int[] shape) {
        this.data = data;
        this.shape = shape;
    }

    /**
     * Creates an array from flat row-major data.
     *
     * @param data  the elements, copied.
     * @param shape the dimensions, copied; an empty shape denotes a scalar.
     * @throws IllegalArgumentException if the element count does not match the shape.
     */
    public static ShapedArray of(double[] data, int... shape) {
        int[] dims = shape == null ? SCALAR_SHAPE : shape.clone();
        int expected = sizeOf(dims);
        if (expected != data.length) {
            throw new IllegalArgumentException(String.format(
                "Shape %s holds %d elements but %d were given", Arrays.toString(dims), expected, data.length));
        }
        return new ShapedArray(data.clone(), dims);
    }

    /**
     * Creates a one-dimensional array.
     */
    public static ShapedArray vector(double... data) {
        return new ShapedArray(data.clone(), new int[] {data.length});
    }

    /**
     * Creates an array of the given shape with every element set to {@code value}.
     */
    public static ShapedArray filled(double value, int... shape) {
        int[] dims = shape == null ? SCALAR_SHAPE : shape.clone();
        double[] data = new double[sizeOf(dims)];
        Arrays.fill(data, value);
        return new ShapedArray(data, dims);
    }

    public static int sizeOf(int[] shape) {
        int size = 1;
        for (int dim : shape) {
            size *= dim;
        }
        return size;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int size() {
        return data.length;
    }

    public int rank() {
        return shape.length;
    }

    /**
     * @return a copy of the elements in row-major order.
     */
    public double[] toArray() {
        return data.clone();
    }

    /**
     * Returns the element at a flat row-major index.
     */
    public double get(int flatIndex) {
        return data[flatIndex];
    }

    /**
     * Returns the element at the given multi-dimensional index.
     */
    public double at(int... index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                "Index rank " + index.length + " does not match array rank " + shape.length);
        }
        int flat = 0;
        for (int i = 0; i < index.length; i++) {
            if (index[i] < 0 || index[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + index[i] + " out of bounds for dimension " + i + " of size " + shape[i]);
            }
            flat = flat * shape[i] + index[i];
        }
        return data[flat];
    }

    /**
     * Returns the single element of a one-element array.
     *
     * @throws IllegalStateException if the array holds more or fewer than one element.
     */
    public double scalar() {
        if (data.length != 1) {
            throw new IllegalStateException("Array of shape " + Arrays.toString(shape) + " is not a scalar");
        }
        return data[0];
    }

    /**
     * Returns the same elements under a different shape of equal size.
     */
    public ShapedArray reshape(int... newShape) {
        if (sizeOf(newShape) != data.length) {
            throw new IllegalArgumentException(String.format(
                "Cannot reshape %s into %s", Arrays.toString(shape), Arrays.toString(newShape)));
        }
        return new ShapedArray(data, newShape.clone());
    }

    /**
     * Compares element-wise within an absolute tolerance; shapes must be equal.
     */
    public boolean approximatelyEquals(ShapedArray other, double tolerance) {
        if (other == null || !Arrays.equals(shape, other.shape)) {
            return false;
        }
        for (int i = 0; i < data.length; i++) {
            double a = data[i];
            double b = other.data[i];
            if (Double.isNaN(a) && Double.isNaN(b)) {
                continue;
            }
            if (Math.abs(a - b) > tolerance) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ShapedArray other)) {
            return false;
        }
        return Arrays.equals(shape, other.shape) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        if (shape.length <= 1) {
            return Arrays.toString(data);
        }
        return Arrays.toString(data) + " shape=" + Arrays.toString(shape);
    }
}
