package io.surfworks.tensordict;

import io.surfworks.tensordict.memmap.MemmapMetadata;
import io.surfworks.tensordict.memmap.MemmapPersistence;
import io.surfworks.tensordict.tensor.Indexer;
import io.surfworks.tensordict.tensor.Tensor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static helpers for building containers from several containers or from plain maps.
 */
public final class TensorDicts {

    private TensorDicts() {} // Utility class

    /**
     * Lazily stack containers of equal batch size along a new dimension.
     *
     * @param dim position of the new dimension, in {@code [-(n+1), n]} for children with n batch dims
     */
    public static LazyStackedTensorDict stack(List<? extends TensorDictBase> tensordicts, int dim) {
        if (tensordicts.isEmpty()) {
            throw new IllegalArgumentException("stack expects a non-empty list of tensordicts");
        }
        int n = tensordicts.get(0).batchDims();
        int d = dim < 0 ? dim + n + 1 : dim;
        if (d < 0 || d > n) {
            throw new IndexOutOfBoundsException(
                "Dimension out of range (expected to be in range of [" + (-n - 1) + ", " + n + "], but got " + dim + ")");
        }
        return new LazyStackedTensorDict(tensordicts, d);
    }

    /**
     * Stack into an existing container of the stacked batch size, writing every leaf in place.
     *
     * @return {@code out}
     */
    public static TensorDictBase stackInto(List<? extends TensorDictBase> tensordicts, int dim, TensorDictBase out) {
        LazyStackedTensorDict stacked = stack(tensordicts, dim);
        if (!Arrays.equals(out.batchSize(), stacked.batchSize())) {
            throw new BatchSizeMismatchException("out.batchSize " + Arrays.toString(out.batchSize())
                + " does not match the stacked batch size " + Arrays.toString(stacked.batchSize()));
        }
        for (NestedKey key : stacked.keys(true, true)) {
            out.setInPlace(key, stacked.get(key));
        }
        return out;
    }

    /**
     * Concatenate containers along an existing batch dimension into a new container (copies).
     *
     * @throws BatchSizeMismatchException if batch sizes differ outside {@code dim}
     * @throws KeyMissingException        if a key of the first container is missing from another
     */
    public static TensorDict cat(List<? extends TensorDictBase> tensordicts, int dim) {
        if (tensordicts.isEmpty()) {
            throw new IllegalArgumentException("cat expects a non-empty list of tensordicts");
        }
        TensorDictBase first = tensordicts.get(0);
        int d = Indexer.normalizeDim(dim, first.batchDims());
        int[] batch = first.batchSize();
        int total = 0;
        for (TensorDictBase td : tensordicts) {
            int[] other = td.batchSize();
            if (other.length != batch.length) {
                throw new BatchSizeMismatchException("cat expects tensordicts with the same number of batch dims, got "
                    + Arrays.toString(batch) + " and " + Arrays.toString(other));
            }
            for (int i = 0; i < batch.length; i++) {
                if (i != d && other[i] != batch[i]) {
                    throw new BatchSizeMismatchException("Batch sizes differ outside dim " + d + ": "
                        + Arrays.toString(batch) + " and " + Arrays.toString(other));
                }
            }
            total += other[d];
        }
        batch[d] = total;
        TensorDict result = new TensorDict(new LinkedHashMap<>(), batch, first.device(), first.names());
        for (String key : first.keys()) {
            NestedKey path = NestedKey.of(key);
            if (first.holdsContainer(key)) {
                List<TensorDictBase> parts = new ArrayList<>(tensordicts.size());
                for (TensorDictBase td : tensordicts) {
                    parts.add(td.getTensorDict(path));
                }
                result.set(key, cat(parts, d));
            } else {
                List<Tensor> parts = new ArrayList<>(tensordicts.size());
                for (TensorDictBase td : tensordicts) {
                    parts.add(td.get(path));
                }
                result.set(key, Tensor.cat(parts, d));
            }
        }
        return result;
    }

    /**
     * Build a container from a map, inferring the batch size as the longest leading shape
     * shared by every top-level value.
     */
    public static TensorDict fromMap(Map<?, ?> source) {
        Map<Object, Object> converted = new LinkedHashMap<>();
        List<int[]> shapes = new ArrayList<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof Map<?, ?> nested) {
                value = fromMap(nested);
            }
            converted.put(entry.getKey(), value);
            shapes.add(shapeOf(value));
        }
        return new TensorDict(converted, commonPrefix(shapes));
    }

    private static int[] shapeOf(Object value) {
        if (value instanceof Tensor tensor) {
            return tensor.shape();
        }
        if (value instanceof TensorDictBase td) {
            return td.batchSize();
        }
        if (value instanceof float[] data) {
            return new int[]{data.length};
        }
        if (value instanceof double[] data) {
            return new int[]{data.length};
        }
        if (value instanceof int[] data) {
            return new int[]{data.length};
        }
        if (value instanceof long[] data) {
            return new int[]{data.length};
        }
        if (value instanceof boolean[] data) {
            return new int[]{data.length};
        }
        return new int[0];
    }

    private static int[] commonPrefix(List<int[]> shapes) {
        if (shapes.isEmpty()) {
            return new int[0];
        }
        int length = Integer.MAX_VALUE;
        for (int[] shape : shapes) {
            length = Math.min(length, shape.length);
        }
        int[] first = shapes.get(0);
        int prefix = 0;
        outer:
        for (; prefix < length; prefix++) {
            for (int[] shape : shapes) {
                if (shape[prefix] != first[prefix]) {
                    break outer;
                }
            }
        }
        return Arrays.copyOf(first, prefix);
    }

    /**
     * Load a container written by {@code memmap}. Leaves are mapped, not read.
     *
     * @throws IOException if the directory has no readable metadata or a leaf file is missing
     */
    public static TensorDictBase loadMemmap(Path prefix) throws IOException {
        MemmapMetadata meta = MemmapPersistence.readMetadata(prefix);
        if (meta.isStack()) {
            return LazyStackedTensorDict.loadMemmap(prefix, meta);
        }
        return TensorDict.loadMemmap(prefix, meta);
    }
}
