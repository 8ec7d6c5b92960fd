package org.caseview.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.razorvine.pickle.PickleException;
import net.razorvine.pickle.Unpickler;
import org.caseview.model.ShapedArray;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;

/**
 * Decodes Python pickles written by legacy recorders and normalizes the result
 * into Jackson trees, so pickled and JSON metadata share one builder.
 * <p>
 * numpy arrays, dtypes and scalars are rebuilt through constructors registered
 * with the Razorvine unpickler; numpy arrays become nested JSON lists.
 */
public final class PythonPickleDecoder {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    static {
        for (String module : new String[] {"numpy.core.multiarray", "numpy._core.multiarray"}) {
            Unpickler.registerConstructor(module, "_reconstruct", args -> new PickledNdarray());
            Unpickler.registerConstructor(module, "scalar", PythonPickleDecoder::numpyScalar);
        }
        Unpickler.registerConstructor("numpy", "dtype", args -> new PickledDtype(String.valueOf(args[0])));
        Unpickler.registerConstructor("_codecs", "encode", PythonPickleDecoder::codecsEncode);
    }

    private PythonPickleDecoder() {}

    /**
     * Unpickles a byte stream into plain Java objects (maps, lists, arrays,
     * strings, numbers, {@link PickledNdarray}).
     *
     * @throws IOException if the stream is truncated or cannot be read.
     * @throws PickleException if the stream contains an unsupported opcode or object.
     */
    public static Object unpickle(byte[] bytes) throws IOException {
        return new Unpickler().loads(bytes);
    }

    /**
     * Unpickles a byte stream and converts the result to a Jackson tree.
     */
    public static JsonNode toJsonTree(byte[] bytes) throws IOException {
        return toJson(unpickle(bytes));
    }

    /**
     * Converts an unpickled object graph to a Jackson tree.
     */
    public static JsonNode toJson(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode object = NODES.objectNode();
            map.forEach((k, v) -> object.set(String.valueOf(k), toJson(v)));
            return object;
        }
        if (value instanceof Object[] tuple) {
            ArrayNode array = NODES.arrayNode();
            for (Object element : tuple) {
                array.add(toJson(element));
            }
            return array;
        }
        if (value instanceof Collection<?> collection) {
            ArrayNode array = NODES.arrayNode();
            collection.forEach(element -> array.add(toJson(element)));
            return array;
        }
        if (value instanceof PickledNdarray ndarray) {
            if (ndarray.array() != null) {
                return toJson(ndarray.array());
            }
            return toJson(ndarray.objects());
        }
        if (value instanceof ShapedArray shaped) {
            return JsonArrays.toJson(shaped);
        }
        if (value instanceof Boolean b) {
            return NODES.booleanNode(b);
        }
        if (value instanceof Integer i) {
            return NODES.numberNode(i);
        }
        if (value instanceof Long l) {
            return NODES.numberNode(l);
        }
        if (value instanceof BigInteger big) {
            return NODES.numberNode(big);
        }
        if (value instanceof BigDecimal decimal) {
            return NODES.numberNode(decimal);
        }
        if (value instanceof Number n) {
            return NODES.numberNode(n.doubleValue());
        }
        if (value instanceof byte[] bytes) {
            return NODES.textNode(new String(bytes, StandardCharsets.ISO_8859_1));
        }
        return NODES.textNode(String.valueOf(value));
    }

    private static Object numpyScalar(Object[] args) {
        if (args.length < 2 || !(args[0] instanceof PickledDtype dtype)) {
            throw new PickleException("Unsupported numpy scalar arguments");
        }
        byte[] bytes = args[1] instanceof byte[] b ? b : String.valueOf(args[1]).getBytes(StandardCharsets.ISO_8859_1);
        NpyArrayReader.ElementType type = dtype.elementType();
        if (bytes.length < type.bytes()) {
            throw new PickleException("Truncated numpy scalar of type " + dtype.code());
        }
        return type.read(ByteBuffer.wrap(bytes), 0);
    }

    private static Object codecsEncode(Object[] args) {
        String text = String.valueOf(args[0]);
        Charset charset = args.length > 1 ? Charset.forName(String.valueOf(args[1])) : StandardCharsets.UTF_8;
        return text.getBytes(charset);
    }
}
