package io.surfworks.tensordict.tensor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Resolves indexing expressions against a tensor layout.
 *
 * <p>Basic components are folded into a strided view. At most one advanced component
 * (integer array or boolean mask) is supported; its selected coordinates are reported
 * separately so callers can gather or scatter along them.
 */
public final class Indexer {

    private Indexer() {} // Utility class

    /**
     * Result of planning an index against a layout.
     *
     * @param viewShape        shape after basic indexing, advanced dims still in place
     * @param viewStrides      strides matching {@code viewShape}
     * @param viewOffset       storage offset of the view
     * @param advancedPosition first view dim covered by the advanced component, or -1
     * @param advancedDims     number of view dims covered by the advanced component
     * @param coordinates      selected coordinates within the covered dims, one row per selection
     * @param resultShape      shape of the indexing result
     */
    public record Plan(
        int[] viewShape,
        long[] viewStrides,
        long viewOffset,
        int advancedPosition,
        int advancedDims,
        long[][] coordinates,
        int[] resultShape
    ) {
        public boolean hasAdvanced() {
            return advancedPosition >= 0;
        }
    }

    /**
     * Plan an index expression against a tensor layout.
     */
    public static Plan plan(TensorSpec spec, Index... index) {
        int[] shape = spec.shape();
        long[] strides = spec.strides();
        Index[] expanded = expand(shape.length, index);

        List<Integer> outShape = new ArrayList<>();
        List<Long> outStrides = new ArrayList<>();
        long offset = spec.offset();
        int advancedPosition = -1;
        int advancedDims = 0;
        long[][] coordinates = null;

        int d = 0;
        for (Index component : expanded) {
            if (component instanceof Index.At at) {
                long pos = normalizePosition(at.position(), shape[d], d);
                offset += pos * strides[d];
                d++;
            } else if (component instanceof Index.Slice slice) {
                long[] bounds = sliceBounds(slice, shape[d]);
                long count = bounds[1] > bounds[0] ? (bounds[1] - bounds[0] + slice.step() - 1) / slice.step() : 0;
                if (count > 0) {
                    offset += bounds[0] * strides[d];
                }
                outShape.add((int) count);
                outStrides.add(strides[d] * slice.step());
                d++;
            } else if (component instanceof Index.NewAxis) {
                outShape.add(1);
                outStrides.add(0L);
            } else if (component instanceof Index.Take take) {
                advancedPosition = outShape.size();
                advancedDims = 1;
                long[] positions = take.positions();
                coordinates = new long[positions.length][];
                for (int i = 0; i < positions.length; i++) {
                    coordinates[i] = new long[]{normalizePosition(positions[i], shape[d], d)};
                }
                outShape.add(shape[d]);
                outStrides.add(strides[d]);
                d++;
            } else if (component instanceof Index.Mask mask) {
                int k = mask.mask().rank();
                int[] covered = Arrays.copyOfRange(shape, d, d + k);
                if (!Arrays.equals(covered, mask.mask().shape())) {
                    throw new IndexOutOfBoundsException(
                        "The shape of the mask " + Arrays.toString(mask.mask().shape()) + " at index " + d
                        + " does not match the shape of the indexed tensor " + Arrays.toString(covered));
                }
                advancedPosition = outShape.size();
                advancedDims = k;
                coordinates = maskCoordinates(mask.mask());
                for (int j = 0; j < k; j++) {
                    outShape.add(shape[d + j]);
                    outStrides.add(strides[d + j]);
                }
                d += k;
            }
        }

        int[] viewShape = outShape.stream().mapToInt(Integer::intValue).toArray();
        long[] viewStrides = outStrides.stream().mapToLong(Long::longValue).toArray();

        int[] resultShape;
        if (advancedPosition >= 0) {
            resultShape = new int[viewShape.length - advancedDims + 1];
            System.arraycopy(viewShape, 0, resultShape, 0, advancedPosition);
            resultShape[advancedPosition] = coordinates.length;
            System.arraycopy(viewShape, advancedPosition + advancedDims, resultShape, advancedPosition + 1,
                viewShape.length - advancedPosition - advancedDims);
        } else {
            resultShape = viewShape.clone();
        }
        return new Plan(viewShape, viewStrides, offset, advancedPosition, advancedDims, coordinates, resultShape);
    }

    /**
     * Shape an index expression produces on a tensor (or batch) of the given shape.
     */
    public static int[] resultShape(int[] shape, Index... index) {
        return plan(TensorSpec.of(ScalarType.I8, shape), index).resultShape();
    }

    /**
     * Dimension names after indexing: integer-indexed dims lose their name,
     * new axes and masks produce unnamed dims, slices and integer arrays keep theirs.
     */
    public static List<String> resultNames(List<String> names, Index... index) {
        Index[] expanded = expand(names.size(), index);
        List<String> result = new ArrayList<>();
        int d = 0;
        for (Index component : expanded) {
            if (component instanceof Index.At) {
                d++;
            } else if (component instanceof Index.Slice || component instanceof Index.Take) {
                result.add(names.get(d));
                d++;
            } else if (component instanceof Index.NewAxis) {
                result.add(null);
            } else if (component instanceof Index.Mask mask) {
                result.add(null);
                d += mask.mask().rank();
            }
        }
        return result;
    }

    /**
     * Replace the ellipsis by full slices and pad with trailing full slices
     * so that every source dimension is consumed exactly once.
     */
    public static Index[] expand(int rank, Index... index) {
        int consumed = 0;
        int ellipses = 0;
        int advanced = 0;
        for (Index component : index) {
            consumed += component.consumedDims();
            if (component instanceof Index.Ellipsis) {
                ellipses++;
            }
            if (component.isAdvanced()) {
                advanced++;
            }
        }
        if (ellipses > 1) {
            throw new IllegalArgumentException("an index can only have a single ellipsis");
        }
        if (advanced > 1) {
            throw new UnsupportedOperationException(
                "Only one advanced index (integer array or mask) per indexing expression is supported");
        }
        if (consumed > rank) {
            throw new IndexOutOfBoundsException(
                "too many indices for tensor of dimension " + rank + " (got " + consumed + ")");
        }
        List<Index> result = new ArrayList<>(index.length + rank - consumed);
        boolean filled = false;
        for (Index component : index) {
            if (component instanceof Index.Ellipsis) {
                for (int i = 0; i < rank - consumed; i++) {
                    result.add(Index.all());
                }
                filled = true;
            } else {
                result.add(component);
            }
        }
        if (!filled) {
            for (int i = 0; i < rank - consumed; i++) {
                result.add(Index.all());
            }
        }
        return result.toArray(new Index[0]);
    }

    /**
     * Wrap a negative position and check it against the dimension size.
     */
    public static long normalizePosition(long position, int size, int dim) {
        long pos = position < 0 ? position + size : position;
        if (pos < 0 || pos >= size) {
            throw new IndexOutOfBoundsException(
                "index " + position + " is out of bounds for dimension " + dim + " with size " + size);
        }
        return pos;
    }

    /**
     * Wrap and validate a dimension argument against a rank.
     */
    public static int normalizeDim(int dim, int rank) {
        int d = dim < 0 ? dim + rank : dim;
        if (d < 0 || d >= rank) {
            throw new IndexOutOfBoundsException(
                "Dimension out of range (expected to be in range of [" + (-rank) + ", " + (rank - 1)
                + "], but got " + dim + ")");
        }
        return d;
    }

    private static long[] sliceBounds(Index.Slice slice, int size) {
        long start = slice.start() == null ? 0 : slice.start();
        long stop = slice.stop() == null ? size : slice.stop();
        if (start < 0) {
            start += size;
        }
        if (stop < 0) {
            stop += size;
        }
        start = Math.max(0, Math.min(start, size));
        stop = Math.max(0, Math.min(stop, size));
        return new long[]{start, stop};
    }

    private static long[][] maskCoordinates(Tensor mask) {
        int[] shape = mask.shape();
        boolean[] values = mask.toBooleanArray();
        List<long[]> selected = new ArrayList<>();
        for (int flat = 0; flat < values.length; flat++) {
            if (!values[flat]) {
                continue;
            }
            long[] coord = new long[shape.length];
            int rem = flat;
            for (int j = shape.length - 1; j >= 0; j--) {
                coord[j] = rem % shape[j];
                rem /= shape[j];
            }
            selected.add(coord);
        }
        return selected.toArray(new long[0][]);
    }
}
