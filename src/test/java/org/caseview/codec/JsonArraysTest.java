package org.caseview.codec;

import com.fasterxml.jackson.databind.JsonNode;
import org.caseview.model.ShapedArray;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class JsonArraysTest {

    private static JsonNode json(String text) throws Exception {
        return Json.MAPPER.readTree(text);
    }

    @Test
    void toArray_nestedList_shouldKeepNesting() throws Exception {
        final ShapedArray array = JsonArrays.toArray(json("[[1, 2, 3], [4, 5, 6]]"), null);

        assertThat(array.shape()).containsExactly(2, 3);
        assertEquals(4.0, array.at(1, 0));
    }

    @Test
    void toArray_flatListWithKnownShape_shouldReshape() throws Exception {
        final ShapedArray array = JsonArrays.toArray(json("[1, 2, 3, 4]"), new int[] {2, 2});

        assertThat(array.shape()).containsExactly(2, 2);
        assertEquals(3.0, array.at(1, 0));
    }

    @Test
    void toArray_scalarWithShape_shouldBroadcast() throws Exception {
        final ShapedArray array = JsonArrays.toArray(json("-1.5"), new int[] {3});

        assertEquals(ShapedArray.vector(-1.5, -1.5, -1.5), array);
    }

    @Test
    void toArray_scalarWithoutShape_shouldYieldOneElementVector() throws Exception {
        final ShapedArray array = JsonArrays.toArray(json("7"), null);

        assertThat(array.shape()).containsExactly(1);
        assertEquals(7.0, array.scalar());
    }

    @Test
    void toArray_nonFiniteTokensAndBooleans_shouldConvert() throws Exception {
        final ShapedArray array = JsonArrays.toArray(json("[NaN, Infinity, -Infinity, true, \"nan\"]"), null);

        assertTrue(Double.isNaN(array.get(0)));
        assertEquals(Double.POSITIVE_INFINITY, array.get(1));
        assertEquals(Double.NEGATIVE_INFINITY, array.get(2));
        assertEquals(1.0, array.get(3));
        assertTrue(Double.isNaN(array.get(4)));
    }

    @Test
    void toArray_nullValue_shouldYieldNull() throws Exception {
        assertNull(JsonArrays.toArray(json("null"), new int[] {2}));
        assertNull(JsonArrays.toArray(null, null));
    }

    @Test
    void toArray_raggedOrNonNumeric_shouldThrow() {
        assertThatThrownBy(() -> JsonArrays.toArray(json("[[1, 2], [3]]"), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Ragged");
        assertThatThrownBy(() -> JsonArrays.toArray(json("[\"a\"]"), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Non-numeric");
    }

    @Test
    void toShape_shouldAcceptListsAndBareIntegers() throws Exception {
        assertThat(JsonArrays.toShape(json("[2, 3]"))).containsExactly(2, 3);
        assertThat(JsonArrays.toShape(json("4"))).containsExactly(4);
        assertNull(JsonArrays.toShape(json("null")));
    }

    @Test
    void toJson_shouldRenderNestedListsFollowingShape() {
        final ShapedArray matrix = ShapedArray.of(new double[] {1, 2, 3, 4, 5, 6}, 3, 2);

        assertEquals("[[1.0,2.0],[3.0,4.0],[5.0,6.0]]", JsonArrays.toJson(matrix).toString());
        assertEquals("2.5", JsonArrays.toJson(ShapedArray.of(new double[] {2.5})).toString());
    }
}
