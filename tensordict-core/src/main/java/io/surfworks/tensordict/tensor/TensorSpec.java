package io.surfworks.tensordict.tensor;

import java.util.Arrays;

/**
 * Tensor layout: shape, dtype, element strides and the element offset into storage.
 * Immutable metadata; every view of a storage carries its own spec.
 */
public record TensorSpec(
    int[] shape,
    ScalarType dtype,
    long[] strides,
    long offset
) {
    public TensorSpec {
        if (shape.length != strides.length) {
            throw new IllegalArgumentException("Shape and strides must have same length");
        }
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be non-negative, got " + offset);
        }
    }

    /**
     * Create a TensorSpec with row-major (C-contiguous) strides.
     */
    public static TensorSpec of(ScalarType dtype, int... shape) {
        long[] strides = computeRowMajorStrides(shape);
        return new TensorSpec(shape.clone(), dtype, strides, 0);
    }

    /**
     * Create a TensorSpec with explicit strides (e.g., for column-major layout).
     */
    public static TensorSpec withStrides(ScalarType dtype, int[] shape, long[] strides) {
        return new TensorSpec(shape.clone(), dtype, strides.clone(), 0);
    }

    /**
     * Same layout viewed at a different offset, shape and strides.
     */
    public TensorSpec view(int[] newShape, long[] newStrides, long newOffset) {
        return new TensorSpec(newShape.clone(), dtype, newStrides.clone(), newOffset);
    }

    /**
     * Number of dimensions.
     */
    public int rank() {
        return shape.length;
    }

    /**
     * Total number of elements.
     */
    public long elementCount() {
        return elementCount(shape);
    }

    /**
     * Total size in bytes of the logical elements.
     */
    public long byteSize() {
        return elementCount() * dtype.byteSize();
    }

    /**
     * Compute the storage element index from multi-dimensional indices.
     */
    public long flatIndex(long... indices) {
        if (indices.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " indices, got " + indices.length);
        }
        long idx = offset;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + indices[i] + " out of bounds for dimension " + i + " with size " + shape[i]);
            }
            idx += indices[i] * strides[i];
        }
        return idx;
    }

    /**
     * Compute the storage element index from multi-dimensional int indices.
     */
    public long flatIndex(int... indices) {
        long[] longIndices = new long[indices.length];
        for (int i = 0; i < indices.length; i++) {
            longIndices[i] = indices[i];
        }
        return flatIndex(longIndices);
    }

    /**
     * Check if this tensor is contiguous in memory.
     */
    public boolean isContiguous() {
        long expectedStride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            if (shape[i] != 1 && strides[i] != expectedStride) {
                return false;
            }
            expectedStride *= shape[i];
        }
        return true;
    }

    /**
     * Check if shapes are equal.
     */
    public boolean shapeEquals(TensorSpec other) {
        return Arrays.equals(this.shape, other.shape);
    }

    /**
     * Check if shapes are broadcastable.
     */
    public boolean isBroadcastableWith(TensorSpec other) {
        return broadcastShapes(this.shape, other.shape) != null;
    }

    /**
     * Broadcast two shapes following NumPy rules.
     *
     * @return the broadcast shape, or null if the shapes are incompatible
     */
    public static int[] broadcastShapes(int[] a, int[] b) {
        int maxRank = Math.max(a.length, b.length);
        int[] result = new int[maxRank];
        for (int i = 0; i < maxRank; i++) {
            int aDim = i < a.length ? a[a.length - 1 - i] : 1;
            int bDim = i < b.length ? b[b.length - 1 - i] : 1;
            if (aDim != bDim && aDim != 1 && bDim != 1) {
                return null;
            }
            result[maxRank - 1 - i] = aDim == 1 ? bDim : aDim;
        }
        return result;
    }

    public static long elementCount(int[] shape) {
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Compute row-major (C-contiguous) strides for a shape.
     */
    public static long[] computeRowMajorStrides(int[] shape) {
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= Math.max(shape[i], 1);
        }
        return strides;
    }

    /**
     * Compute column-major (Fortran-contiguous) strides for a shape.
     */
    public static long[] computeColumnMajorStrides(int[] shape) {
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = 0; i < shape.length; i++) {
            strides[i] = stride;
            stride *= Math.max(shape[i], 1);
        }
        return strides;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorSpec that)) return false;
        return Arrays.equals(shape, that.shape) &&
               dtype == that.dtype &&
               Arrays.equals(strides, that.strides) &&
               offset == that.offset;
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(shape);
        result = 31 * result + dtype.hashCode();
        result = 31 * result + Arrays.hashCode(strides);
        result = 31 * result + Long.hashCode(offset);
        return result;
    }

    @Override
    public String toString() {
        return "TensorSpec[shape=" + Arrays.toString(shape) +
               ", dtype=" + dtype +
               ", strides=" + Arrays.toString(strides) +
               ", offset=" + offset + "]";
    }
}
