package io.surfworks.tensordict.tensor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Indexer.
 */
@DisplayName("Indexer Unit Tests")
class IndexerTest {

    @Test
    @DisplayName("expand pads with full slices")
    void expandPads() {
        Index[] expanded = Indexer.expand(3, Index.at(1));
        assertEquals(3, expanded.length);
        assertEquals(Index.all(), expanded[1]);
        assertEquals(Index.all(), expanded[2]);
    }

    @Test
    @DisplayName("expand replaces the ellipsis in place")
    void expandEllipsis() {
        Index[] expanded = Indexer.expand(4, Index.at(0), Index.ellipsis(), Index.at(2));
        assertEquals(4, expanded.length);
        assertEquals(Index.at(0), expanded[0]);
        assertEquals(Index.at(2), expanded[3]);
    }

    @Test
    @DisplayName("expand rejects too many indices, two ellipses and two advanced components")
    void expandErrors() {
        assertThrows(IndexOutOfBoundsException.class, () -> Indexer.expand(1, Index.at(0), Index.at(0)));
        assertThrows(IllegalArgumentException.class, () -> Indexer.expand(2, Index.ellipsis(), Index.ellipsis()));
        assertThrows(UnsupportedOperationException.class,
            () -> Indexer.expand(2, Index.take(0), Index.take(1)));
    }

    @ParameterizedTest(name = "slice({0}, {1}) over 5 -> {2}")
    @CsvSource({
        "0, 5, 5",
        "1, 3, 2",
        "-2, 5, 2",
        "3, 1, 0",
        "0, 100, 5"
    })
    @DisplayName("slice bounds clamp like Python")
    void sliceLengths(long start, long stop, int expected) {
        assertArrayEquals(new int[]{expected}, Indexer.resultShape(new int[]{5}, Index.slice(start, stop)));
    }

    @Test
    @DisplayName("stepped slices round up")
    void steppedSlice() {
        assertArrayEquals(new int[]{3}, Indexer.resultShape(new int[]{5}, Index.slice(null, null, 2)));
    }

    @Test
    @DisplayName("result shape of mixed basic and advanced components")
    void mixedShape() {
        int[] shape = {4, 5, 6};
        assertArrayEquals(new int[]{5, 6}, Indexer.resultShape(shape, Index.at(1)));
        assertArrayEquals(new int[]{4, 1, 5, 6}, Indexer.resultShape(shape, Index.all(), Index.newAxis()));
        assertArrayEquals(new int[]{4, 2, 6}, Indexer.resultShape(shape, Index.all(), Index.take(0, 3)));
        Tensor mask = Tensor.fromBooleanArray(new boolean[]{true, false, true, true}, 4);
        assertArrayEquals(new int[]{3, 5, 6}, Indexer.resultShape(shape, Index.mask(mask)));
    }

    @Test
    @DisplayName("mask shape must match the indexed dims")
    void maskShapeMismatch() {
        Tensor mask = Tensor.fromBooleanArray(new boolean[]{true, false}, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> Indexer.resultShape(new int[]{4}, Index.mask(mask)));
    }

    @Test
    @DisplayName("names follow slices, drop on integers and blank out on new axes")
    void resultNames() {
        List<String> names = Arrays.asList("a", "b", "c");
        assertEquals(Arrays.asList("b", "c"), Indexer.resultNames(names, Index.at(0)));
        assertEquals(Arrays.asList("a", null, "b", "c"),
            Indexer.resultNames(names, Index.all(), Index.newAxis()));
    }

    @Test
    @DisplayName("normalizeDim wraps negatives")
    void normalizeDim() {
        assertEquals(2, Indexer.normalizeDim(-1, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> Indexer.normalizeDim(3, 3));
    }
}
