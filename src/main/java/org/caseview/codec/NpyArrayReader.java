package org.caseview.codec;

import org.caseview.model.ShapedArray;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntSupplier;

/**
 * Reads numpy {@code .npy} streams holding a structured (record) array, the
 * layout used for legacy case values and for recorded derivatives.
 * <p>
 * Every named field becomes one entry of the result. A record array of shape
 * {@code (1,)} or {@code ()} yields the field's own subarray shape; larger
 * record arrays prepend their shape to it.
 */
public final class NpyArrayReader {

    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};

    private NpyArrayReader() {}

    /**
     * Decodes a structured-array stream.
     *
     * @param bytes the complete {@code .npy} content.
     * @return field name to array, in field declaration order.
     * @throws IllegalArgumentException if the stream is malformed or uses an unsupported dtype.
     */
    public static Map<String, ShapedArray> readRecords(byte[] bytes) {
        if (bytes.length < 10 || !Arrays.equals(Arrays.copyOf(bytes, MAGIC.length), MAGIC)) {
            throw new IllegalArgumentException("Not a numpy array stream (bad magic)");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int major = bytes[6];
        int headerLength;
        int headerStart;
        if (major == 1) {
            headerLength = Short.toUnsignedInt(buffer.getShort(8));
            headerStart = 10;
        } else if (major == 2 || major == 3) {
            if (bytes.length < 12) {
                throw new IllegalArgumentException("Truncated npy preamble");
            }
            headerLength = buffer.getInt(8);
            headerStart = 12;
        } else {
            throw new IllegalArgumentException("Unsupported npy format version " + major);
        }
        if (headerLength < 0 || (long) headerStart + headerLength > bytes.length) {
            throw new IllegalArgumentException(String.format(
                "Truncated npy header: declared %d bytes, found %d",
                Integer.toUnsignedLong(headerLength), bytes.length - headerStart));
        }
        String header = new String(bytes, headerStart, headerLength,
            major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1).strip();

        if (!(PythonLiteralParser.parse(header) instanceof Map<?, ?> dict)) {
            throw new IllegalArgumentException("npy header is not a dict: " + header);
        }
        if (!(dict.get("descr") instanceof List<?> descr)) {
            throw new IllegalArgumentException("npy stream does not hold a record array: " + header);
        }
        int[] recordShape = toShape(dict.get("shape"));
        int recordCount = elementCount(recordShape);

        List<Field> fields = new ArrayList<>();
        int itemSize = 0;
        for (Object entry : descr) {
            Field field = parseField(entry, itemSize);
            itemSize = checkedSize(() -> Math.addExact(field.offset(), field.byteSize()));
            if (!field.name().isEmpty()) {
                fields.add(field);
            }
        }

        int dataStart = headerStart + headerLength;
        if ((long) dataStart + (long) recordCount * itemSize > bytes.length) {
            throw new IllegalArgumentException(String.format(
                "Truncated npy data: %d records of %d bytes need %d bytes, found %d",
                recordCount, itemSize, (long) recordCount * itemSize, bytes.length - dataStart));
        }

        Map<String, ShapedArray> result = new LinkedHashMap<>();
        for (Field field : fields) {
            int perRecord = elementCount(field.shape());
            double[] values = new double[recordCount * perRecord];
            for (int r = 0; r < recordCount; r++) {
                int base = dataStart + r * itemSize + field.offset();
                for (int k = 0; k < perRecord; k++) {
                    values[r * perRecord + k] = field.type().read(buffer, base + k * field.type().bytes());
                }
            }
            int[] shape = recordCount == 1 && recordShape.length <= 1
                ? field.shape()
                : concat(recordShape, field.shape());
            result.put(field.name(), ShapedArray.of(values, shape));
        }
        return result;
    }

    private static Field parseField(Object entry, int offset) {
        if (!(entry instanceof List<?> parts) || parts.size() < 2) {
            throw new IllegalArgumentException("Malformed dtype field: " + entry);
        }
        Object rawName = parts.get(0);
        // (title, name) pairs
        if (rawName instanceof List<?> titled && titled.size() != 2) {
            throw new IllegalArgumentException("Malformed dtype field title: " + rawName);
        }
        String name = rawName instanceof List<?> titled ? String.valueOf(titled.get(1)) : String.valueOf(rawName);
        if (!(parts.get(1) instanceof String typestr)) {
            throw new IllegalArgumentException("Nested dtype for field '" + name + "' is not supported");
        }
        int[] shape = parts.size() > 2 ? toShape(parts.get(2)) : new int[0];
        ElementType type = ElementType.parse(typestr);
        if (type.kind() == 'V' && !name.isEmpty()) {
            throw new IllegalArgumentException("Opaque field '" + name + "' cannot be decoded");
        }
        if (type.kind() == 'O') {
            throw new IllegalArgumentException("Object field '" + name + "' cannot be decoded");
        }
        return new Field(name, type, shape, offset);
    }

    private static int[] toShape(Object value) {
        if (value == null) {
            return new int[0];
        }
        if (value instanceof Number) {
            return new int[] {toDimension(value)};
        }
        if (value instanceof List<?> dims) {
            int[] shape = new int[dims.size()];
            for (int i = 0; i < shape.length; i++) {
                shape[i] = toDimension(dims.get(i));
            }
            return shape;
        }
        throw new IllegalArgumentException("Malformed shape: " + value);
    }

    private static int toDimension(Object value) {
        if (!(value instanceof Number n) || n.longValue() < 0 || n.longValue() > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Malformed shape dimension: " + value);
        }
        return n.intValue();
    }

    private static int elementCount(int[] shape) {
        return checkedSize(() -> {
            int size = 1;
            for (int dim : shape) {
                size = Math.multiplyExact(size, dim);
            }
            return size;
        });
    }

    private static int checkedSize(IntSupplier size) {
        try {
            return size.getAsInt();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("npy array is too large", e);
        }
    }

    private static int[] concat(int[] a, int[] b) {
        int[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    private record Field(String name, ElementType type, int[] shape, int offset) {
        int byteSize() {
            return checkedSize(() -> Math.multiplyExact(type.bytes(), elementCount(shape)));
        }
    }

    /**
     * A numpy scalar type string such as {@code <f8}, {@code |b1} or {@code >i4}.
     */
    record ElementType(char kind, int bytes, ByteOrder order) {

        static ElementType parse(String typestr) {
            if (typestr.length() < 2) {
                throw new IllegalArgumentException("Malformed type string '" + typestr + "'");
            }
            char orderChar = typestr.charAt(0);
            int kindIndex = "<>|=".indexOf(orderChar) >= 0 ? 1 : 0;
            ByteOrder order = orderChar == '>' ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;
            char kind = typestr.charAt(kindIndex);
            int bytes;
            try {
                bytes = kindIndex + 1 < typestr.length() ? Integer.parseInt(typestr.substring(kindIndex + 1)) : 1;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed type string '" + typestr + "'", e);
            }
            if (kind == '?') {
                kind = 'b';
            }
            boolean supported = switch (kind) {
                case 'f' -> bytes == 4 || bytes == 8;
                case 'i', 'u' -> bytes == 1 || bytes == 2 || bytes == 4 || bytes == 8;
                case 'b' -> bytes == 1;
                case 'V', 'O' -> bytes >= 0;
                default -> false;
            };
            if (!supported) {
                throw new IllegalArgumentException("Unsupported element type '" + typestr + "'");
            }
            return new ElementType(kind, bytes, order);
        }

        double read(ByteBuffer buffer, int offset) {
            ByteBuffer view = buffer.duplicate().order(order);
            return switch (kind) {
                case 'f' -> bytes == 8 ? view.getDouble(offset) : view.getFloat(offset);
                case 'b' -> view.get(offset) != 0 ? 1.0 : 0.0;
                case 'i' -> switch (bytes) {
                    case 1 -> view.get(offset);
                    case 2 -> view.getShort(offset);
                    case 4 -> view.getInt(offset);
                    default -> view.getLong(offset);
                };
                case 'u' -> switch (bytes) {
                    case 1 -> Byte.toUnsignedInt(view.get(offset));
                    case 2 -> Short.toUnsignedInt(view.getShort(offset));
                    case 4 -> Integer.toUnsignedLong(view.getInt(offset));
                    default -> unsignedLong(view.getLong(offset));
                };
                default -> throw new IllegalStateException("Cannot read element kind " + kind);
            };
        }

        private static double unsignedLong(long value) {
            double d = (double) (value >>> 1) * 2.0;
            return d + (value & 1L);
        }
    }
}
