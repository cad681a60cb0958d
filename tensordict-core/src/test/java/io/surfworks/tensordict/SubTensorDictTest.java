package io.surfworks.tensordict;

import io.surfworks.tensordict.tensor.Index;
import io.surfworks.tensordict.tensor.Tensor;
import io.surfworks.tensordict.testing.TensorAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for SubTensorDict.
 */
@DisplayName("SubTensorDict Unit Tests")
class SubTensorDictTest {

    private Random random;
    private TensorDict td;

    @BeforeEach
    void setUp() {
        random = new Random(3);
        Map<Object, Object> source = new LinkedHashMap<>();
        source.put("key1", Tensor.randn(random, 4, 5, 2));
        source.put(NestedKey.of("n", "x"), Tensor.randn(random, 4, 5));
        td = new TensorDict(source, 4, 5);
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("a sub-view drops the indexed batch dim and shares keys with the parent")
        void shapeAndKeys() {
            TensorDictBase sub = td.getSubTensorDict(Index.at(2));
            assertInstanceOf(SubTensorDict.class, sub);
            assertArrayEquals(new int[]{5}, sub.batchSize());
            assertEquals(td.keys(), sub.keys());
            assertArrayEquals(new int[]{5, 2}, sub.get("key1").shape());
            td.set("late", Tensor.zeros(4, 5));
            assertTrue(sub.containsKey("late"));
        }

        @Test
        @DisplayName("basic indices read views of the parent storage")
        void basicReadsAlias() {
            TensorDictBase sub = td.getSubTensorDict(Index.at(2));
            sub.get("key1").fill(4);
            assertTrue(td.get("key1").index(Index.at(2)).allEqual(4.0));
        }

        @Test
        @DisplayName("nested containers are wrapped in sub-views of their own")
        void nested() {
            TensorDictBase sub = td.getSubTensorDict(Index.at(2));
            TensorDictBase n = sub.getTensorDict("n");
            assertInstanceOf(SubTensorDict.class, n);
            n.setInPlace("x", Tensor.full(3.0, 5));
            assertTrue(td.get("n", "x").index(Index.at(2)).allEqual(3.0));
        }

        @Test
        @DisplayName("names follow the index")
        void names() {
            td.setNames("x", "y");
            assertEquals(List.of("y"), td.getSubTensorDict(Index.at(2)).names());
        }
    }

    @Nested
    @DisplayName("Writes")
    class Writes {

        @Test
        @DisplayName("setInPlace writes into the parent at the index, plain set of an existing key fails")
        void setInPlaceAndSet() {
            TensorDictBase sub = td.getSubTensorDict(Index.at(2));
            Tensor x = Tensor.randn(random, 5, 2);
            sub.setInPlace("key1", x);
            TensorAssert.assertEquals(x, td.get("key1").index(Index.at(2)));

            Tensor y = Tensor.randn(random, 5, 2);
            assertThrows(UnsupportedOnProxyException.class, () -> sub.set("key1", y));
        }

        @Test
        @DisplayName("a new key is zero-filled in the parent outside the index")
        void newKey() {
            TensorDictBase sub = td.getSubTensorDict(Index.at(2));
            sub.set("new", Tensor.ones(5, 3));
            assertArrayEquals(new int[]{4, 5, 3}, td.get("new").shape());
            assertTrue(td.get("new").index(Index.at(2)).allEqual(1.0));
            assertTrue(td.get("new").index(Index.at(0)).allEqual(0.0));
        }

        @Test
        @DisplayName("a value that does not start with the sub-view batch size is rejected")
        void badShape() {
            TensorDictBase sub = td.getSubTensorDict(Index.at(2));
            assertThrows(ShapeMismatchException.class, () -> sub.set("bad", Tensor.ones(4, 3)));
            assertFalse(td.containsKey("bad"));
        }

        @Test
        @DisplayName("chained sub-views keep the top-most parent and compose the indices")
        void chained() {
            Tensor before = td.get("key1").index(Index.at(2), Index.at(0)).copy();
            TensorDictBase sub = td.getSubTensorDict(Index.at(2)).getSubTensorDict(Index.slice(1, 3));
            assertSame(td, ((SubTensorDict) sub).getParent());
            assertArrayEquals(new int[]{2}, sub.batchSize());

            sub.setInPlace("key1", Tensor.zeros(2, 2));
            assertTrue(td.get("key1").index(Index.at(2), Index.slice(1, 3)).allEqual(0.0));
            TensorAssert.assertEquals(before, td.get("key1").index(Index.at(2), Index.at(0)));
        }

        @Test
        @DisplayName("a mask sub-view gathers on read and scatters on write")
        void maskIndex() {
            Tensor mask = Tensor.fromBooleanArray(new boolean[]{true, false, true, false}, 4);
            TensorDictBase sub = td.getSubTensorDict(Index.mask(mask));
            assertArrayEquals(new int[]{2, 5}, sub.batchSize());

            sub.get("key1").fill(8);
            assertFalse(td.get("key1").index(Index.at(0)).allEqual(8.0));

            sub.setInPlace("key1", Tensor.ones(2, 5, 2));
            assertTrue(td.get("key1").index(Index.at(0)).allEqual(1.0));
            assertTrue(td.get("key1").index(Index.at(2)).allEqual(1.0));
            assertFalse(td.get("key1").index(Index.at(1)).allEqual(1.0));
        }

        @Test
        @DisplayName("setAt composes with the sub-view index")
        void setAt() {
            TensorDictBase sub = td.getSubTensorDict(Index.at(1));
            sub.setAt("key1", Tensor.full(6.0, 2), Index.at(4));
            assertTrue(td.get("key1").index(Index.at(1), Index.at(4)).allEqual(6.0));
        }
    }

    @Nested
    @DisplayName("Restrictions")
    class Restrictions {

        @Test
        @DisplayName("lock state is the parent's and cannot be changed through the view")
        void lockState() {
            TensorDictBase sub = td.getSubTensorDict(Index.at(0));
            assertThrows(UnsupportedOnProxyException.class, sub::lock);
            assertThrows(UnsupportedOnProxyException.class, sub::unlock);

            td.lock();
            assertTrue(sub.isLocked());
            sub.setInPlace("key1", Tensor.zeros(5, 2));
            assertThrows(LockedMutationException.class, () -> sub.set("brand_new", Tensor.zeros(5)));
            td.unlock();
            assertFalse(sub.isLocked());
        }

        @Test
        @DisplayName("batch size, names and memmap are unavailable")
        void unsupported() {
            TensorDictBase sub = td.getSubTensorDict(Index.at(0));
            assertThrows(BatchSizeImmutableException.class, () -> sub.setBatchSize(5));
            assertThrows(UnsupportedOnProxyException.class, () -> sub.setNames("z"));
            assertThrows(UnsupportedOnProxyException.class, () -> sub.memmap(Path.of("unused")));
        }

        @Test
        @DisplayName("toTensorDict detaches the view")
        void materialize() {
            TensorDict copy = td.getSubTensorDict(Index.at(0)).toTensorDict();
            copy.get("key1").fill(9);
            assertFalse(td.get("key1").index(Index.at(0)).allEqual(9.0));
        }
    }
}
