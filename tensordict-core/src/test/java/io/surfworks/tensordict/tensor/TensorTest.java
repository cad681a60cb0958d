package io.surfworks.tensordict.tensor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for Tensor.
 */
@DisplayName("Tensor Unit Tests")
class TensorTest {

    private static Tensor range(int... shape) {
        int n = (int) TensorSpec.elementCount(shape);
        float[] data = new float[n];
        for (int i = 0; i < n; i++) {
            data[i] = i;
        }
        return Tensor.fromFloatArray(data, shape);
    }

    @Nested
    @DisplayName("Factories")
    class Factories {

        @Test
        @DisplayName("zeros defaults to F32 on the CPU")
        void zerosDefaults() {
            Tensor t = Tensor.zeros(2, 3);
            assertArrayEquals(new int[]{2, 3}, t.shape());
            assertEquals(ScalarType.F32, t.dtype());
            assertEquals(Device.CPU, t.device());
            assertTrue(t.allEqual(0.0));
        }

        @Test
        @DisplayName("scalar has rank 0 and one element")
        void scalar() {
            Tensor t = Tensor.scalar(2.5, ScalarType.F64);
            assertEquals(0, t.rank());
            assertEquals(2.5, t.item());
        }

        @Test
        @DisplayName("arange produces I64 positions")
        void arange() {
            Tensor t = Tensor.arange(4);
            assertEquals(ScalarType.I64, t.dtype());
            assertArrayEquals(new long[]{0, 1, 2, 3}, t.toLongArray());
        }

        @Test
        @DisplayName("rand stays within [0, 1)")
        void randRange() {
            Tensor t = Tensor.rand(new Random(7), 16);
            for (double v : t.toDoubleArray()) {
                assertTrue(v >= 0 && v < 1);
            }
        }

        @Test
        @DisplayName("array length must match the shape")
        void lengthMismatch() {
            assertThrows(IllegalArgumentException.class, () -> Tensor.fromFloatArray(new float[5], 2, 3));
        }
    }

    @Nested
    @DisplayName("Views")
    class Views {

        @Test
        @DisplayName("select returns a view sharing storage")
        void selectIsView() {
            Tensor t = range(3, 4);
            Tensor row = t.select(0, 1);
            assertArrayEquals(new float[]{4, 5, 6, 7}, row.toFloatArray());
            row.fill(-1);
            assertEquals(-1.0, t.getDouble(1, 2));
            assertTrue(row.sharesStorage(t));
        }

        @Test
        @DisplayName("permute reorders dimensions without copying")
        void permute() {
            Tensor t = range(2, 3);
            Tensor p = t.permute(1, 0);
            assertArrayEquals(new int[]{3, 2}, p.shape());
            assertEquals(t.getDouble(1, 2), p.getDouble(2, 1));
            assertFalse(p.isContiguous());
        }

        @Test
        @DisplayName("view of a transposed tensor fails, reshape copies")
        void viewAfterTranspose() {
            Tensor t = range(2, 3).transpose(0, 1);
            assertThrows(IllegalStateException.class, () -> t.view(6));
            Tensor r = t.reshape(6);
            assertArrayEquals(new float[]{0, 3, 1, 4, 2, 5}, r.toFloatArray());
        }

        @Test
        @DisplayName("view infers a single -1 dimension")
        void viewInfers() {
            assertArrayEquals(new int[]{2, 6}, range(3, 4).view(2, -1).shape());
            assertThrows(IllegalArgumentException.class, () -> range(3, 4).view(5, -1));
        }

        @Test
        @DisplayName("squeeze and unsqueeze are inverse on a size-1 dim")
        void squeezeUnsqueeze() {
            Tensor t = range(3, 1, 2);
            Tensor s = t.squeeze(1);
            assertArrayEquals(new int[]{3, 2}, s.shape());
            assertArrayEquals(t.shape(), s.unsqueeze(1).shape());
            assertSame(t, t.squeeze(0));
        }

        @Test
        @DisplayName("expand broadcasts singleton dims with stride 0")
        void expand() {
            Tensor t = Tensor.fromFloatArray(new float[]{1, 2}, 2, 1);
            Tensor e = t.expand(3, 2, 4);
            assertArrayEquals(new int[]{3, 2, 4}, e.shape());
            assertEquals(2.0, e.getDouble(2, 1, 3));
            assertThrows(IllegalArgumentException.class, () -> t.expand(3));
        }

        @Test
        @DisplayName("unbind yields views along a dim")
        void unbind() {
            List<Tensor> parts = range(2, 3).unbind(1);
            assertEquals(3, parts.size());
            assertArrayEquals(new float[]{1, 4}, parts.get(1).toFloatArray());
        }
    }

    @Nested
    @DisplayName("Indexing")
    class Indexing {

        @Test
        @DisplayName("basic index is a view, integer array a copy")
        void basicVersusAdvanced() {
            Tensor t = range(4, 2);
            Tensor sliced = t.index(Index.slice(1, 3));
            Tensor taken = t.index(Index.take(0, 3));
            assertArrayEquals(new int[]{2, 2}, sliced.shape());
            assertArrayEquals(new float[]{0, 1, 6, 7}, taken.toFloatArray());
            assertTrue(sliced.sharesStorage(t));
            assertFalse(taken.sharesStorage(t));
        }

        @Test
        @DisplayName("indexPut scatters through an integer array")
        void indexPutTake() {
            Tensor t = Tensor.zeros(4);
            t.indexPut(new Index[]{Index.take(1, 3)}, Tensor.fromFloatArray(new float[]{5, 6}, 2));
            assertArrayEquals(new float[]{0, 5, 0, 6}, t.toFloatArray());
        }

        @Test
        @DisplayName("maskedFill writes where the mask is true")
        void maskedFill() {
            Tensor t = Tensor.zeros(3, 2);
            t.maskedFill(Tensor.fromBooleanArray(new boolean[]{true, false, true}, 3), 1);
            assertArrayEquals(new float[]{1, 1, 0, 0, 1, 1}, t.toFloatArray());
        }

        @Test
        @DisplayName("negative positions wrap")
        void negativePosition() {
            Tensor t = range(3);
            assertEquals(2.0, t.index(Index.at(-1)).item());
            assertThrows(IndexOutOfBoundsException.class, () -> t.index(Index.at(3)));
        }
    }

    @Nested
    @DisplayName("Copies and Casts")
    class CopiesAndCasts {

        @Test
        @DisplayName("copyFrom broadcasts and casts into the destination dtype")
        void copyFromCasts() {
            Tensor dst = Tensor.zeros(ScalarType.I32, 2, 3);
            dst.copyFrom(Tensor.full(2.0, ScalarType.F64, 3));
            assertArrayEquals(new int[]{2, 2, 2, 2, 2, 2}, dst.toIntArray());
        }

        @Test
        @DisplayName("copy owns fresh storage")
        void copy() {
            Tensor t = range(2, 2);
            Tensor c = t.copy();
            assertNotSame(t, c);
            assertFalse(c.sharesStorage(t));
            assertTrue(c.allEqual(t));
        }

        @Test
        @DisplayName("to(dtype) returns the same tensor when unchanged")
        void toSameDtype() {
            Tensor t = range(2);
            assertSame(t, t.to(ScalarType.F32));
            assertEquals(ScalarType.F64, t.to(ScalarType.F64).dtype());
        }

        @Test
        @DisplayName("to(device) retags a copy")
        void toDevice() {
            Tensor t = range(2);
            Tensor moved = t.to(Device.cuda(0));
            assertEquals(Device.cuda(0), moved.device());
            assertFalse(moved.sharesStorage(t));
        }
    }

    @Nested
    @DisplayName("Stack and Cat")
    class StackAndCat {

        @Test
        @DisplayName("stack inserts a new dimension")
        void stack() {
            Tensor s = Tensor.stack(List.of(range(2), range(2)), 1);
            assertArrayEquals(new int[]{2, 2}, s.shape());
            assertArrayEquals(new float[]{0, 0, 1, 1}, s.toFloatArray());
        }

        @Test
        @DisplayName("stack rejects unequal shapes")
        void stackUnequal() {
            assertThrows(IllegalArgumentException.class, () -> Tensor.stack(List.of(range(2), range(3)), 0));
        }

        @Test
        @DisplayName("cat concatenates along an existing dimension")
        void cat() {
            Tensor c = Tensor.cat(List.of(range(1, 2), range(2, 2)), 0);
            assertArrayEquals(new int[]{3, 2}, c.shape());
            assertArrayEquals(new float[]{0, 1, 0, 1, 2, 3}, c.toFloatArray());
        }
    }
}
