package org.caseview.codec;

import com.fasterxml.jackson.databind.JsonNode;
import net.razorvine.pickle.Pickler;
import org.caseview.model.ShapedArray;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class PythonPickleDecoderTest {

    @Test
    void toJsonTree_pickledDict_shouldConvertNestedValues() throws Exception {
        // Given
        final Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("shape", List.of(2, 3));
        meta.put("units", null);
        meta.put("explicit", true);
        meta.put("ref", 1.5);
        meta.put("type", List.of("output", "desvar"));
        final byte[] pickle = new Pickler().dumps(Map.of("pz.z", meta));

        // When
        final JsonNode tree = PythonPickleDecoder.toJsonTree(pickle);

        // Then
        final JsonNode z = tree.get("pz.z");
        assertEquals(2, z.get("shape").get(0).asInt());
        assertTrue(z.get("units").isNull());
        assertTrue(z.get("explicit").asBoolean());
        assertEquals(1.5, z.get("ref").asDouble());
        assertEquals("desvar", z.get("type").get(1).asText());
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3})
    void toJsonTree_numpyMetadataPickle_shouldRebuildArraysScalarsAndSets(int protocol) throws Exception {
        // Given
        final byte[] pickle = legacyMetadata(protocol);

        // When
        final JsonNode x = PythonPickleDecoder.toJsonTree(pickle).get("x");

        // Then
        assertThat(x.get("lower").isArray()).isTrue();
        assertEquals(-10.0, x.get("lower").get(0).asDouble());
        assertEquals(0.0, x.get("lower").get(1).asDouble());
        assertEquals(10.0, x.get("upper").asDouble());
        assertEquals(2.0, x.get("ref").asDouble());
        assertEquals(2, x.get("shape").get(0).asInt());
        assertTrue(x.get("units").isNull());
        final List<String> types = new ArrayList<>();
        x.get("type").forEach(t -> types.add(t.asText()));
        assertThat(types).containsExactlyInAnyOrder("output", "desvar");
    }

    /**
     * Loads an {@code abs2meta} pickle as a legacy recorder writes it with numpy
     * present: one entry {@code x} with an ndarray lower bound, a float upper
     * bound, a numpy float64 {@code ref} and a set of type tags.
     */
    private static byte[] legacyMetadata(int protocol) throws IOException {
        try (InputStream in = PythonPickleDecoderTest.class.getResourceAsStream(
                "/pickles/abs2meta-protocol" + protocol + ".pkl")) {
            if (in == null) {
                throw new IOException("Missing pickle fixture for protocol " + protocol);
            }
            return in.readAllBytes();
        }
    }

    @Test
    void toJsonTree_truncatedStream_shouldThrow() throws Exception {
        final byte[] pickle = new Pickler().dumps(Map.of("a", List.of(1, 2, 3)));
        final byte[] truncated = Arrays.copyOf(pickle, pickle.length / 2);

        assertThatThrownBy(() -> PythonPickleDecoder.toJsonTree(truncated)).isInstanceOf(Exception.class);
    }

    @Test
    void toJson_tupleAndBytes_shouldBecomeArrayAndText() {
        final JsonNode tuple = PythonPickleDecoder.toJson(new Object[] {1, "a", null});

        assertThat(tuple.isArray()).isTrue();
        assertEquals(3, tuple.size());
        assertTrue(tuple.get(2).isNull());
        assertEquals("abc", PythonPickleDecoder.toJson("abc".getBytes()).asText());
    }

    @Test
    void ndarrayState_cOrder_shouldRebuildArray() {
        // Given
        final PickledNdarray ndarray = new PickledNdarray();
        final ByteBuffer data = ByteBuffer.allocate(48).order(ByteOrder.LITTLE_ENDIAN);
        for (int i = 1; i <= 6; i++) {
            data.putDouble(i);
        }

        // When
        ndarray.__setstate__(new Object[] {1, new Object[] {2, 3}, new PickledDtype("<f8"), false, data.array()});

        // Then
        final ShapedArray array = ndarray.array();
        assertThat(array.shape()).containsExactly(2, 3);
        assertEquals(6.0, array.at(1, 2));
        assertNull(ndarray.objects());
        assertEquals("[[1.0,2.0,3.0],[4.0,5.0,6.0]]", PythonPickleDecoder.toJson(ndarray).toString());
    }

    @Test
    void ndarrayState_fortranOrder_shouldReorderToRowMajor() {
        final PickledNdarray ndarray = new PickledNdarray();
        final ByteBuffer data = ByteBuffer.allocate(24).order(ByteOrder.LITTLE_ENDIAN);
        // column-major [[1, 2, 3], [4, 5, 6]] is stored as 1 4 2 5 3 6
        for (int v : new int[] {1, 4, 2, 5, 3, 6}) {
            data.putInt(v);
        }

        ndarray.__setstate__(new Object[] {1, new Object[] {2, 3}, new PickledDtype("<i4"), true, data.array()});

        assertEquals(ShapedArray.of(new double[] {1, 2, 3, 4, 5, 6}, 2, 3), ndarray.array());
    }

    @Test
    void ndarrayState_objectArray_shouldKeepElements() {
        final PickledNdarray ndarray = new PickledNdarray();

        ndarray.__setstate__(new Object[] {1, new Object[] {2}, new PickledDtype("O"), false, List.of("a", "b")});

        assertNull(ndarray.array());
        assertEquals(List.of("a", "b"), ndarray.objects());
        assertEquals("[\"a\",\"b\"]", PythonPickleDecoder.toJson(ndarray).toString());
    }

    @Test
    void ndarrayState_shortData_shouldThrow() {
        final PickledNdarray ndarray = new PickledNdarray();

        assertThatThrownBy(() -> ndarray.__setstate__(
            new Object[] {1, new Object[] {4}, new PickledDtype("<f8"), false, new byte[8]}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
