package org.caseview.codec;

import org.caseview.model.ShapedArray;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * A {@code numpy.ndarray} rebuilt from a pickle stream through
 * {@code numpy.core.multiarray._reconstruct} followed by {@code __setstate__}.
 */
public final class PickledNdarray {

    private ShapedArray array;
    private List<?> objects;

    PickledNdarray() {
    }

    /**
     * Receives {@code (version, shape, dtype, is_fortran, rawdata)}, or the older
     * form without the leading version. Called reflectively by the unpickler.
     */
    public void __setstate__(Object[] state) {
        int base = state.length == 5 ? 1 : 0;
        if (state.length - base != 4) {
            throw new IllegalArgumentException("Unexpected ndarray state of length " + state.length);
        }
        int[] shape = toShape(state[base]);
        Object dtype = state[base + 1];
        boolean fortran = Boolean.TRUE.equals(state[base + 2]);
        Object raw = state[base + 3];

        if (raw instanceof List<?> list) {
            objects = list;
            array = numericObjects(list, shape);
            return;
        }
        if (!(dtype instanceof PickledDtype pickledDtype)) {
            throw new IllegalArgumentException("ndarray state carries no dtype");
        }
        byte[] bytes = raw instanceof byte[] b ? b : String.valueOf(raw).getBytes(StandardCharsets.ISO_8859_1);
        NpyArrayReader.ElementType type = pickledDtype.elementType();
        int count = ShapedArray.sizeOf(shape);
        if (bytes.length < count * type.bytes()) {
            throw new IllegalArgumentException("ndarray data holds " + bytes.length + " bytes, need " + count * type.bytes());
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        double[] data = new double[count];
        for (int i = 0; i < count; i++) {
            data[i] = type.read(buffer, i * type.bytes());
        }
        if (fortran && shape.length > 1) {
            data = fortranToRowMajor(data, shape);
        }
        array = ShapedArray.of(data, shape);
    }

    /**
     * @return the numeric content, or {@code null} for object arrays holding non-numbers.
     */
    public ShapedArray array() {
        return array;
    }

    /**
     * @return the elements of an object array, or {@code null} for numeric arrays.
     */
    public List<?> objects() {
        return objects;
    }

    private static ShapedArray numericObjects(List<?> list, int[] shape) {
        double[] data = new double[list.size()];
        for (int i = 0; i < data.length; i++) {
            if (!(list.get(i) instanceof Number n)) {
                return null;
            }
            data[i] = n.doubleValue();
        }
        return ShapedArray.sizeOf(shape) == data.length ? ShapedArray.of(data, shape) : ShapedArray.vector(data);
    }

    private static double[] fortranToRowMajor(double[] data, int[] shape) {
        double[] result = new double[data.length];
        int[] index = new int[shape.length];
        for (int f = 0; f < data.length; f++) {
            int rowMajor = 0;
            for (int d = 0; d < shape.length; d++) {
                rowMajor = rowMajor * shape[d] + index[d];
            }
            result[rowMajor] = data[f];
            for (int d = 0; d < shape.length; d++) {
                if (++index[d] < shape[d]) {
                    break;
                }
                index[d] = 0;
            }
        }
        return result;
    }

    private static int[] toShape(Object value) {
        if (value instanceof Object[] dims) {
            int[] shape = new int[dims.length];
            for (int i = 0; i < dims.length; i++) {
                shape[i] = ((Number) dims[i]).intValue();
            }
            return shape;
        }
        if (value instanceof Number n) {
            return new int[] {n.intValue()};
        }
        throw new IllegalArgumentException("Malformed ndarray shape: " + value);
    }
}
