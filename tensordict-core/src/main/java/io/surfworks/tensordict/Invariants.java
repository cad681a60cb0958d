package io.surfworks.tensordict;

import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.Tensor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Batch-shape, device and dimension-name rules shared by every container variant.
 */
final class Invariants {

    private Invariants() {} // Utility class

    // ==================== Batch Shape ====================

    static boolean startsWith(int[] shape, int[] prefix) {
        if (shape.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (shape[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Reject a value whose leading shape is not the batch size.
     */
    static void checkPrefix(String key, int[] shape, int[] batchSize) {
        if (!startsWith(shape, batchSize)) {
            throw new ShapeMismatchException(
                "batch dimension mismatch, got self.batchSize=" + Arrays.toString(batchSize)
                + " and value.shape=" + Arrays.toString(shape) + " for key \"" + key + "\"");
        }
    }

    static int[] shapeOf(Object value) {
        if (value instanceof Tensor tensor) {
            return tensor.shape();
        }
        return ((TensorDictBase) value).batchSize();
    }

    static int[] concat(int[] head, int[] tail) {
        int[] result = Arrays.copyOf(head, head.length + tail.length);
        System.arraycopy(tail, 0, result, head.length, tail.length);
        return result;
    }

    static int[] insert(int[] shape, int position, int size) {
        int[] result = new int[shape.length + 1];
        System.arraycopy(shape, 0, result, 0, position);
        result[position] = size;
        System.arraycopy(shape, position, result, position + 1, shape.length - position);
        return result;
    }

    static int[] remove(int[] shape, int position) {
        int[] result = new int[shape.length - 1];
        System.arraycopy(shape, 0, result, 0, position);
        System.arraycopy(shape, position + 1, result, position, shape.length - position - 1);
        return result;
    }

    static int[] trailing(int[] shape, int from) {
        return Arrays.copyOfRange(shape, from, shape.length);
    }

    static long product(int[] shape) {
        long result = 1;
        for (int dim : shape) {
            result *= dim;
        }
        return result;
    }

    // ==================== Device ====================

    /**
     * Move a leaf to the container device when one is set.
     */
    static Tensor reconcileDevice(Tensor value, Device device) {
        if (device == null || device.equals(value.device())) {
            return value;
        }
        return value.to(device);
    }

    static TensorDictBase reconcileDevice(TensorDictBase value, Device device) {
        if (device == null || device.equals(value.device())) {
            return value;
        }
        return value.to(device);
    }

    // ==================== Names ====================

    static List<String> unnamed(int dims) {
        return Collections.unmodifiableList(new ArrayList<>(Collections.nCopies(dims, (String) null)));
    }

    static boolean isUnnamed(List<String> names) {
        for (String name : names) {
            if (name != null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Validate names against a batch rank. A null list means "all unnamed".
     */
    static List<String> checkNames(List<String> names, int batchDims) {
        if (names == null) {
            return unnamed(batchDims);
        }
        if (names.size() != batchDims) {
            if (isUnnamed(names)) {
                return unnamed(batchDims);
            }
            throw new IllegalArgumentException(
                "the length of the dimension names must equate the tensordict batch_dims attribute. "
                + "Got " + names.size() + " names for " + batchDims + " batch dimensions.");
        }
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name != null && !seen.add(name)) {
                throw new IllegalArgumentException("Some dimension names are non-unique: " + names);
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(names));
    }

    /**
     * Truncate or pad (with null) to a new batch rank.
     */
    static List<String> resize(List<String> names, int batchDims) {
        List<String> result = new ArrayList<>(batchDims);
        for (int i = 0; i < batchDims; i++) {
            result.add(i < names.size() ? names.get(i) : null);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Replace the leading names of {@code childNames} with {@code parentNames}.
     */
    static List<String> withLeading(List<String> childNames, List<String> parentNames) {
        List<String> result = new ArrayList<>(childNames);
        for (int i = 0; i < parentNames.size() && i < result.size(); i++) {
            result.set(i, parentNames.get(i));
        }
        return result;
    }

    static List<String> permuted(List<String> names, int[] dims) {
        List<String> result = new ArrayList<>(dims.length);
        for (int dim : dims) {
            result.add(names.get(dim));
        }
        return Collections.unmodifiableList(result);
    }

    static List<String> inserted(List<String> names, int position, String name) {
        List<String> result = new ArrayList<>(names);
        result.add(position, name);
        return Collections.unmodifiableList(result);
    }

    static List<String> removed(List<String> names, int position) {
        List<String> result = new ArrayList<>(names);
        result.remove(position);
        return Collections.unmodifiableList(result);
    }

    static boolean sameNames(List<String> a, List<String> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!Objects.equals(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }
}
