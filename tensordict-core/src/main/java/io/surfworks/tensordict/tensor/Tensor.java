package io.surfworks.tensordict.tensor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * A multi-dimensional, strided view over a shared {@link Storage}.
 *
 * <p>Shape operations ({@link #index}, {@link #permute}, {@link #view}, ...) return
 * views that alias the same storage; writes through any view are visible through
 * all others. {@link #copy()}, {@link #to(Device)} and advanced indexing produce
 * fresh storage.
 */
public final class Tensor {
    private final Storage storage;
    private final TensorSpec spec;
    private final Device device;

    private Tensor(Storage storage, TensorSpec spec, Device device) {
        this.storage = storage;
        this.spec = spec;
        this.device = device;
    }

    // ==================== Factory Methods ====================

    /**
     * Wrap an existing storage with a layout (no copy).
     */
    public static Tensor wrap(Storage storage, TensorSpec spec, Device device) {
        Objects.requireNonNull(storage, "storage cannot be null");
        Objects.requireNonNull(device, "device cannot be null");
        if (storage.dtype() != spec.dtype()) {
            throw new IllegalArgumentException(
                "Storage dtype " + storage.dtype() + " does not match spec dtype " + spec.dtype());
        }
        if (spec.elementCount() > 0) {
            long last = spec.offset();
            for (int i = 0; i < spec.rank(); i++) {
                last += (long) (spec.shape()[i] - 1) * spec.strides()[i];
            }
            if (last >= storage.length()) {
                throw new IllegalArgumentException(
                    "Layout " + spec + " exceeds storage of length " + storage.length());
            }
        }
        return new Tensor(storage, spec, device);
    }

    /**
     * Create a zero-initialized tensor with the given shape (defaults to F32).
     */
    public static Tensor zeros(int... shape) {
        return zeros(ScalarType.F32, shape);
    }

    /**
     * Create a zero-initialized tensor with the given dtype and shape.
     */
    public static Tensor zeros(ScalarType dtype, int... shape) {
        return zeros(dtype, Device.CPU, shape);
    }

    /**
     * Create a zero-initialized tensor on a device.
     */
    public static Tensor zeros(ScalarType dtype, Device device, int... shape) {
        TensorSpec spec = TensorSpec.of(dtype, shape);
        return new Tensor(Storage.allocate(dtype, spec.elementCount()), spec, device);
    }

    public static Tensor ones(int... shape) {
        return full(1.0, ScalarType.F32, shape);
    }

    public static Tensor ones(ScalarType dtype, int... shape) {
        return full(1.0, dtype, shape);
    }

    /**
     * Create an F32 tensor filled with a constant value.
     */
    public static Tensor full(double value, int... shape) {
        return full(value, ScalarType.F32, shape);
    }

    /**
     * Create a tensor filled with a constant value.
     */
    public static Tensor full(double value, ScalarType dtype, int... shape) {
        Tensor tensor = zeros(dtype, shape);
        tensor.fill(value);
        return tensor;
    }

    /**
     * Zero-dimensional tensor holding one value.
     */
    public static Tensor scalar(double value, ScalarType dtype) {
        return full(value, dtype);
    }

    /**
     * 1-D I64 tensor holding {@code 0 .. n-1}.
     */
    public static Tensor arange(int n) {
        long[] data = new long[n];
        for (int i = 0; i < n; i++) {
            data[i] = i;
        }
        return fromLongArray(data, n);
    }

    /**
     * F32 tensor with elements drawn uniformly from [0, 1).
     */
    public static Tensor rand(Random random, int... shape) {
        Tensor tensor = zeros(ScalarType.F32, shape);
        long count = tensor.elementCount();
        for (long i = 0; i < count; i++) {
            tensor.storage.setDouble(i, random.nextFloat());
        }
        return tensor;
    }

    /**
     * F32 tensor with standard normal elements.
     */
    public static Tensor randn(Random random, int... shape) {
        Tensor tensor = zeros(ScalarType.F32, shape);
        long count = tensor.elementCount();
        for (long i = 0; i < count; i++) {
            tensor.storage.setDouble(i, random.nextGaussian());
        }
        return tensor;
    }

    /**
     * Create a tensor from a float array (1D or flattened).
     */
    public static Tensor fromFloatArray(float[] data, int... shape) {
        Tensor tensor = zeros(ScalarType.F32, checkLength(data.length, shape));
        for (int i = 0; i < data.length; i++) {
            tensor.storage.setDouble(i, data[i]);
        }
        return tensor;
    }

    /**
     * Create a tensor from a double array.
     */
    public static Tensor fromDoubleArray(double[] data, int... shape) {
        Tensor tensor = zeros(ScalarType.F64, checkLength(data.length, shape));
        for (int i = 0; i < data.length; i++) {
            tensor.storage.setDouble(i, data[i]);
        }
        return tensor;
    }

    /**
     * Create a tensor from an int array.
     */
    public static Tensor fromIntArray(int[] data, int... shape) {
        Tensor tensor = zeros(ScalarType.I32, checkLength(data.length, shape));
        for (int i = 0; i < data.length; i++) {
            tensor.storage.setLong(i, data[i]);
        }
        return tensor;
    }

    public static Tensor fromLongArray(long[] data, int... shape) {
        Tensor tensor = zeros(ScalarType.I64, checkLength(data.length, shape));
        for (int i = 0; i < data.length; i++) {
            tensor.storage.setLong(i, data[i]);
        }
        return tensor;
    }

    public static Tensor fromBooleanArray(boolean[] data, int... shape) {
        Tensor tensor = zeros(ScalarType.BOOL, checkLength(data.length, shape));
        for (int i = 0; i < data.length; i++) {
            tensor.storage.setLong(i, data[i] ? 1 : 0);
        }
        return tensor;
    }

    private static int[] checkLength(int length, int[] shape) {
        if (length != TensorSpec.elementCount(shape)) {
            throw new IllegalArgumentException(
                "Data length " + length + " doesn't match shape " + Arrays.toString(shape) +
                " (expected " + TensorSpec.elementCount(shape) + " elements)");
        }
        return shape;
    }

    // ==================== Accessors ====================

    public TensorSpec spec() {
        return spec;
    }

    public Storage storage() {
        return storage;
    }

    public int[] shape() {
        return spec.shape().clone();
    }

    public int size(int dim) {
        return spec.shape()[Indexer.normalizeDim(dim, rank())];
    }

    public long[] strides() {
        return spec.strides().clone();
    }

    public int rank() {
        return spec.rank();
    }

    public long elementCount() {
        return spec.elementCount();
    }

    public ScalarType dtype() {
        return spec.dtype();
    }

    public Device device() {
        return device;
    }

    public boolean isContiguous() {
        return spec.isContiguous();
    }

    /**
     * True when the storage is a memory-mapped file region.
     */
    public boolean isMapped() {
        return storage.isMapped();
    }

    /**
     * True when both tensors view the same storage.
     */
    public boolean sharesStorage(Tensor other) {
        return other != null && storage == other.storage;
    }

    // ==================== Element Access ====================

    public double getDouble(int... indices) {
        return storage.getDouble(spec.flatIndex(indices));
    }

    public float getFloat(int... indices) {
        return (float) getDouble(indices);
    }

    public long getLong(int... indices) {
        return storage.getLong(spec.flatIndex(indices));
    }

    public boolean getBoolean(int... indices) {
        return storage.getLong(spec.flatIndex(indices)) != 0;
    }

    public void setDouble(double value, int... indices) {
        storage.setDouble(spec.flatIndex(indices), value);
    }

    public void setFloat(float value, int... indices) {
        setDouble(value, indices);
    }

    public void setLong(long value, int... indices) {
        storage.setLong(spec.flatIndex(indices), value);
    }

    /**
     * Value of a single-element tensor.
     */
    public double item() {
        if (elementCount() != 1) {
            throw new IllegalStateException(
                "a Tensor with " + elementCount() + " elements cannot be converted to a scalar");
        }
        return storage.getDouble(offsets()[0]);
    }

    // ==================== Bulk Operations ====================

    /**
     * Copy tensor data (logical order) to a float array.
     */
    public float[] toFloatArray() {
        long[] offsets = offsets();
        float[] result = new float[offsets.length];
        for (int i = 0; i < offsets.length; i++) {
            result[i] = (float) storage.getDouble(offsets[i]);
        }
        return result;
    }

    public double[] toDoubleArray() {
        long[] offsets = offsets();
        double[] result = new double[offsets.length];
        for (int i = 0; i < offsets.length; i++) {
            result[i] = storage.getDouble(offsets[i]);
        }
        return result;
    }

    public int[] toIntArray() {
        long[] offsets = offsets();
        int[] result = new int[offsets.length];
        for (int i = 0; i < offsets.length; i++) {
            result[i] = (int) storage.getLong(offsets[i]);
        }
        return result;
    }

    public long[] toLongArray() {
        long[] offsets = offsets();
        long[] result = new long[offsets.length];
        for (int i = 0; i < offsets.length; i++) {
            result[i] = storage.getLong(offsets[i]);
        }
        return result;
    }

    public boolean[] toBooleanArray() {
        long[] offsets = offsets();
        boolean[] result = new boolean[offsets.length];
        for (int i = 0; i < offsets.length; i++) {
            result[i] = storage.getLong(offsets[i]) != 0;
        }
        return result;
    }

    /**
     * Copy data from a float array into this tensor.
     */
    public void copyFrom(float[] source) {
        long[] offsets = offsets();
        if (source.length != offsets.length) {
            throw new IllegalArgumentException(
                "Source length " + source.length + " doesn't match tensor size " + offsets.length);
        }
        for (int i = 0; i < offsets.length; i++) {
            storage.setDouble(offsets[i], source[i]);
        }
    }

    /**
     * Copy data from a double array into this tensor.
     */
    public void copyFrom(double[] source) {
        long[] offsets = offsets();
        if (source.length != offsets.length) {
            throw new IllegalArgumentException(
                "Source length " + source.length + " doesn't match tensor size " + offsets.length);
        }
        for (int i = 0; i < offsets.length; i++) {
            storage.setDouble(offsets[i], source[i]);
        }
    }

    /**
     * Copy values from another tensor, broadcasting it to this shape and casting
     * to this dtype. Writes go to this tensor's storage.
     */
    public Tensor copyFrom(Tensor source) {
        Tensor src = source.broadcastTo(spec.shape());
        if (src.storage == storage) {
            src = src.copy();
        }
        long[] dst = offsets();
        long[] from = src.offsets();
        if (dtype().isFloating() || src.dtype().isFloating()) {
            for (int i = 0; i < dst.length; i++) {
                storage.setDouble(dst[i], src.storage.getDouble(from[i]));
            }
        } else {
            for (int i = 0; i < dst.length; i++) {
                storage.setLong(dst[i], src.storage.getLong(from[i]));
            }
        }
        return this;
    }

    /**
     * Fill every element with a value.
     */
    public Tensor fill(double value) {
        for (long offset : offsets()) {
            storage.setDouble(offset, value);
        }
        return this;
    }

    public Tensor zero() {
        return fill(0.0);
    }

    /**
     * Create a deep, contiguous copy of this tensor.
     */
    public Tensor copy() {
        Tensor result = zeros(dtype(), device, spec.shape());
        result.copyFrom(this);
        return result;
    }

    /**
     * This tensor if already laid out contiguously, otherwise a contiguous copy.
     */
    public Tensor contiguous() {
        return isContiguous() ? this : copy();
    }

    /**
     * Copy to another device; returns this tensor when already there.
     */
    public Tensor to(Device target) {
        if (device.equals(target)) {
            return this;
        }
        Tensor result = zeros(dtype(), target, spec.shape());
        result.copyFrom(this);
        return result;
    }

    /**
     * Cast to another dtype; returns this tensor when already of that dtype.
     */
    public Tensor to(ScalarType target) {
        if (dtype() == target) {
            return this;
        }
        Tensor result = zeros(target, device, spec.shape());
        result.copyFrom(this);
        return result;
    }

    // ==================== Views ====================

    /**
     * Index with NumPy semantics. Basic indexing returns a view; an advanced
     * component (integer array or mask) gathers into a new tensor.
     */
    public Tensor index(Index... index) {
        Indexer.Plan plan = Indexer.plan(spec, index);
        Tensor base = new Tensor(storage, spec.view(plan.viewShape(), plan.viewStrides(), plan.viewOffset()), device);
        if (!plan.hasAdvanced()) {
            return base;
        }
        Tensor result = zeros(dtype(), device, plan.resultShape());
        long[][] coordinates = plan.coordinates();
        for (int j = 0; j < coordinates.length; j++) {
            Tensor picked = base.fixDims(plan.advancedPosition(), coordinates[j]);
            result.select(plan.advancedPosition(), j).copyFrom(picked);
        }
        return result;
    }

    /**
     * Write {@code value} (broadcast) into the elements selected by {@code index}.
     */
    public Tensor indexPut(Index[] index, Tensor value) {
        Indexer.Plan plan = Indexer.plan(spec, index);
        Tensor base = new Tensor(storage, spec.view(plan.viewShape(), plan.viewStrides(), plan.viewOffset()), device);
        if (!plan.hasAdvanced()) {
            base.copyFrom(value);
            return this;
        }
        Tensor expanded = value.broadcastTo(plan.resultShape());
        long[][] coordinates = plan.coordinates();
        for (int j = 0; j < coordinates.length; j++) {
            base.fixDims(plan.advancedPosition(), coordinates[j]).copyFrom(expanded.select(plan.advancedPosition(), j));
        }
        return this;
    }

    /**
     * Fill the elements selected by {@code index} with a value.
     */
    public Tensor indexFill(Index[] index, double value) {
        Indexer.Plan plan = Indexer.plan(spec, index);
        Tensor base = new Tensor(storage, spec.view(plan.viewShape(), plan.viewStrides(), plan.viewOffset()), device);
        if (!plan.hasAdvanced()) {
            base.fill(value);
            return this;
        }
        for (long[] coordinate : plan.coordinates()) {
            base.fixDims(plan.advancedPosition(), coordinate).fill(value);
        }
        return this;
    }

    /**
     * Fill, in place, the elements where {@code mask} is true. The mask covers the
     * leading {@code mask.rank()} dimensions.
     */
    public Tensor maskedFill(Tensor mask, double value) {
        return indexFill(new Index[]{Index.mask(mask)}, value);
    }

    /**
     * View with one dimension removed at the given position.
     */
    public Tensor select(int dim, long position) {
        int d = Indexer.normalizeDim(dim, rank());
        long pos = Indexer.normalizePosition(position, spec.shape()[d], d);
        return fixDims(d, new long[]{pos});
    }

    /**
     * View of {@code length} elements along {@code dim} starting at {@code start}.
     */
    public Tensor narrow(int dim, int start, int length) {
        int d = Indexer.normalizeDim(dim, rank());
        if (start < 0 || length < 0 || start + length > spec.shape()[d]) {
            throw new IndexOutOfBoundsException(
                "narrow(" + dim + ", " + start + ", " + length + ") out of range for size " + spec.shape()[d]);
        }
        int[] newShape = spec.shape().clone();
        newShape[d] = length;
        long newOffset = length == 0 ? spec.offset() : spec.offset() + start * spec.strides()[d];
        return new Tensor(storage, spec.view(newShape, spec.strides(), newOffset), device);
    }

    public Tensor permute(int... dims) {
        int rank = rank();
        if (dims.length != rank) {
            throw new IllegalArgumentException(
                "number of dims don't match in permute: got " + dims.length + " for a tensor of rank " + rank);
        }
        int[] newShape = new int[rank];
        long[] newStrides = new long[rank];
        boolean[] seen = new boolean[rank];
        for (int i = 0; i < rank; i++) {
            int d = Indexer.normalizeDim(dims[i], rank);
            if (seen[d]) {
                throw new IllegalArgumentException("repeated dim in permute: " + Arrays.toString(dims));
            }
            seen[d] = true;
            newShape[i] = spec.shape()[d];
            newStrides[i] = spec.strides()[d];
        }
        return new Tensor(storage, spec.view(newShape, newStrides, spec.offset()), device);
    }

    public Tensor transpose(int dim0, int dim1) {
        int a = Indexer.normalizeDim(dim0, rank());
        int b = Indexer.normalizeDim(dim1, rank());
        int[] dims = new int[rank()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = i;
        }
        dims[a] = b;
        dims[b] = a;
        return permute(dims);
    }

    /**
     * Remove {@code dim} if it has size 1; otherwise return this tensor.
     */
    public Tensor squeeze(int dim) {
        int d = Indexer.normalizeDim(dim, rank());
        if (spec.shape()[d] != 1) {
            return this;
        }
        return fixDims(d, new long[]{0});
    }

    /**
     * Remove every dimension of size 1.
     */
    public Tensor squeeze() {
        Tensor result = this;
        for (int d = rank() - 1; d >= 0; d--) {
            result = result.squeeze(d);
        }
        return result;
    }

    public Tensor unsqueeze(int dim) {
        int rank = rank();
        int d = dim < 0 ? dim + rank + 1 : dim;
        if (d < 0 || d > rank) {
            throw new IndexOutOfBoundsException(
                "Dimension out of range (expected to be in range of [" + (-rank - 1) + ", " + rank
                + "], but got " + dim + ")");
        }
        int[] newShape = new int[rank + 1];
        long[] newStrides = new long[rank + 1];
        for (int i = 0, j = 0; i <= rank; i++) {
            if (i == d) {
                newShape[i] = 1;
                newStrides[i] = d < rank ? spec.strides()[d] * spec.shape()[d] : 1;
            } else {
                newShape[i] = spec.shape()[j];
                newStrides[i] = spec.strides()[j];
                j++;
            }
        }
        return new Tensor(storage, spec.view(newShape, newStrides, spec.offset()), device);
    }

    /**
     * Reinterpret with a new shape without copying. One dimension may be -1.
     *
     * @throws IllegalStateException if the layout cannot be expressed as a view
     */
    public Tensor view(int... shape) {
        int[] target = inferShape(shape, elementCount());
        long[] newStrides = computeViewStrides(spec.shape(), spec.strides(), target);
        if (newStrides == null) {
            throw new IllegalStateException(
                "view size is not compatible with input tensor's size and stride (at least one dimension "
                + "spans across two contiguous subspaces). Use reshape(...) instead.");
        }
        return new Tensor(storage, spec.view(target, newStrides, spec.offset()), device);
    }

    /**
     * View when possible, otherwise a reshaped copy.
     */
    public Tensor reshape(int... shape) {
        int[] target = inferShape(shape, elementCount());
        long[] newStrides = computeViewStrides(spec.shape(), spec.strides(), target);
        if (newStrides != null) {
            return new Tensor(storage, spec.view(target, newStrides, spec.offset()), device);
        }
        return copy().view(target);
    }

    /**
     * Merge dimensions {@code start..end} (inclusive) into one.
     */
    public Tensor flatten(int start, int end) {
        int s = Indexer.normalizeDim(start, rank());
        int e = Indexer.normalizeDim(end, rank());
        if (s > e) {
            throw new IllegalArgumentException("flatten() has invalid args: start_dim cannot come after end_dim");
        }
        int[] shape = spec.shape();
        int[] target = new int[shape.length - (e - s)];
        int merged = 1;
        for (int i = s; i <= e; i++) {
            merged *= shape[i];
        }
        System.arraycopy(shape, 0, target, 0, s);
        target[s] = merged;
        System.arraycopy(shape, e + 1, target, s + 1, shape.length - e - 1);
        return reshape(target);
    }

    /**
     * Split dimension {@code dim} into {@code sizes}.
     */
    public Tensor unflatten(int dim, int... sizes) {
        int d = Indexer.normalizeDim(dim, rank());
        int[] shape = spec.shape();
        int[] inner = inferShape(sizes, shape[d]);
        int[] target = new int[shape.length - 1 + inner.length];
        System.arraycopy(shape, 0, target, 0, d);
        System.arraycopy(inner, 0, target, d, inner.length);
        System.arraycopy(shape, d + 1, target, d + inner.length, shape.length - d - 1);
        return reshape(target);
    }

    /**
     * Expand singleton dimensions (and prepend new ones) without copying.
     * A size of -1 keeps the existing size.
     */
    public Tensor expand(int... sizes) {
        int[] target = sizes.clone();
        int lead = sizes.length - rank();
        if (lead < 0) {
            throw new IllegalArgumentException(
                "the number of sizes provided (" + sizes.length + ") must be greater or equal to the number"
                + " of dimensions in the tensor (" + rank() + ")");
        }
        for (int i = 0; i < target.length; i++) {
            if (target[i] == -1) {
                if (i < lead) {
                    throw new IllegalArgumentException("expand: -1 not allowed in a leading, non-existing dimension");
                }
                target[i] = spec.shape()[i - lead];
            }
        }
        return broadcastTo(target);
    }

    /**
     * Broadcast to {@code target} following NumPy rules (stride 0 on expanded dims).
     */
    public Tensor broadcastTo(int... target) {
        int[] shape = spec.shape();
        if (Arrays.equals(shape, target)) {
            return this;
        }
        int lead = target.length - shape.length;
        if (lead < 0) {
            throw new IllegalArgumentException(
                "shape mismatch: tensor of shape " + Arrays.toString(shape)
                + " cannot be broadcast to shape " + Arrays.toString(target));
        }
        long[] newStrides = new long[target.length];
        for (int i = 0; i < target.length; i++) {
            if (i < lead) {
                newStrides[i] = 0;
                continue;
            }
            int own = shape[i - lead];
            if (own == target[i]) {
                newStrides[i] = spec.strides()[i - lead];
            } else if (own == 1) {
                newStrides[i] = 0;
            } else {
                throw new IllegalArgumentException(
                    "shape mismatch: tensor of shape " + Arrays.toString(shape)
                    + " cannot be broadcast to shape " + Arrays.toString(target));
            }
        }
        return new Tensor(storage, spec.view(target, newStrides, spec.offset()), device);
    }

    /**
     * Views of every slice along {@code dim}.
     */
    public List<Tensor> unbind(int dim) {
        int d = Indexer.normalizeDim(dim, rank());
        List<Tensor> result = new ArrayList<>(spec.shape()[d]);
        for (int i = 0; i < spec.shape()[d]; i++) {
            result.add(select(d, i));
        }
        return result;
    }

    // ==================== Comparison ====================

    /**
     * True if every element equals the corresponding element of {@code other}
     * after broadcasting both to a common shape.
     */
    public boolean allEqual(Tensor other) {
        int[] common = TensorSpec.broadcastShapes(spec.shape(), other.spec.shape());
        if (common == null) {
            return false;
        }
        double[] a = broadcastTo(common).toDoubleArray();
        double[] b = other.broadcastTo(common).toDoubleArray();
        return Arrays.equals(a, b);
    }

    /**
     * True if every element equals {@code value}.
     */
    public boolean allEqual(double value) {
        for (long offset : offsets()) {
            if (storage.getDouble(offset) != value) {
                return false;
            }
        }
        return true;
    }

    /**
     * Element-wise closeness: {@code |a - b| <= atol + rtol * |b|}.
     */
    public boolean allClose(Tensor other, double rtol, double atol) {
        int[] common = TensorSpec.broadcastShapes(spec.shape(), other.spec.shape());
        if (common == null) {
            return false;
        }
        double[] a = broadcastTo(common).toDoubleArray();
        double[] b = other.broadcastTo(common).toDoubleArray();
        for (int i = 0; i < a.length; i++) {
            if (Math.abs(a[i] - b[i]) > atol + rtol * Math.abs(b[i])) {
                return false;
            }
        }
        return true;
    }

    // ==================== Stacking ====================

    /**
     * Stack equally shaped tensors along a new dimension (copies).
     */
    public static Tensor stack(List<Tensor> tensors, int dim) {
        if (tensors.isEmpty()) {
            throw new IllegalArgumentException("stack expects a non-empty list of tensors");
        }
        int[] shape = tensors.get(0).spec.shape();
        ScalarType dtype = tensors.get(0).dtype();
        for (Tensor t : tensors) {
            if (!Arrays.equals(shape, t.spec.shape())) {
                throw new IllegalArgumentException(
                    "stack expects each tensor to be equal size, but got " + Arrays.toString(shape)
                    + " and " + Arrays.toString(t.spec.shape()));
            }
            dtype = ScalarType.promote(dtype, t.dtype());
        }
        int d = dim < 0 ? dim + shape.length + 1 : dim;
        if (d < 0 || d > shape.length) {
            throw new IndexOutOfBoundsException("Dimension out of range for stack: " + dim);
        }
        int[] outShape = new int[shape.length + 1];
        System.arraycopy(shape, 0, outShape, 0, d);
        outShape[d] = tensors.size();
        System.arraycopy(shape, d, outShape, d + 1, shape.length - d);
        Tensor out = zeros(dtype, tensors.get(0).device, outShape);
        for (int i = 0; i < tensors.size(); i++) {
            out.select(d, i).copyFrom(tensors.get(i));
        }
        return out;
    }

    /**
     * Concatenate tensors along an existing dimension (copies).
     */
    public static Tensor cat(List<Tensor> tensors, int dim) {
        if (tensors.isEmpty()) {
            throw new IllegalArgumentException("cat expects a non-empty list of tensors");
        }
        Tensor first = tensors.get(0);
        int d = Indexer.normalizeDim(dim, first.rank());
        int[] outShape = first.spec.shape().clone();
        ScalarType dtype = first.dtype();
        int total = 0;
        for (Tensor t : tensors) {
            int[] s = t.spec.shape();
            if (s.length != outShape.length) {
                throw new IllegalArgumentException("cat expects tensors of equal rank");
            }
            for (int i = 0; i < s.length; i++) {
                if (i != d && s[i] != outShape[i]) {
                    throw new IllegalArgumentException(
                        "Sizes of tensors must match except in dimension " + d + ": got "
                        + Arrays.toString(outShape) + " and " + Arrays.toString(s));
                }
            }
            total += s[d];
            dtype = ScalarType.promote(dtype, t.dtype());
        }
        outShape[d] = total;
        Tensor out = zeros(dtype, first.device, outShape);
        int start = 0;
        for (Tensor t : tensors) {
            int len = t.spec.shape()[d];
            out.narrow(d, start, len).copyFrom(t);
            start += len;
        }
        return out;
    }

    // ==================== Internals ====================

    /**
     * Drop {@code coordinate.length} dims starting at {@code position}, fixing each at the given coordinate.
     */
    private Tensor fixDims(int position, long[] coordinate) {
        int[] shape = spec.shape();
        long[] strides = spec.strides();
        int k = coordinate.length;
        long newOffset = spec.offset();
        for (int j = 0; j < k; j++) {
            newOffset += coordinate[j] * strides[position + j];
        }
        int[] newShape = new int[shape.length - k];
        long[] newStrides = new long[shape.length - k];
        System.arraycopy(shape, 0, newShape, 0, position);
        System.arraycopy(strides, 0, newStrides, 0, position);
        System.arraycopy(shape, position + k, newShape, position, shape.length - position - k);
        System.arraycopy(strides, position + k, newStrides, position, shape.length - position - k);
        return new Tensor(storage, spec.view(newShape, newStrides, newOffset), device);
    }

    /**
     * Storage element index of every logical element, in row-major order.
     */
    private long[] offsets() {
        int[] shape = spec.shape();
        long[] strides = spec.strides();
        long count = spec.elementCount();
        long[] result = new long[(int) count];
        if (count == 0) {
            return result;
        }
        int[] counter = new int[shape.length];
        long offset = spec.offset();
        for (int i = 0; i < count; i++) {
            result[i] = offset;
            for (int d = shape.length - 1; d >= 0; d--) {
                counter[d]++;
                offset += strides[d];
                if (counter[d] < shape[d]) {
                    break;
                }
                offset -= strides[d] * counter[d];
                counter[d] = 0;
            }
        }
        return result;
    }

    /**
     * Resolve a single -1 entry against {@code elementCount} and validate the product.
     */
    public static int[] inferShape(int[] shape, long elementCount) {
        int[] target = shape.clone();
        int inferred = -1;
        long known = 1;
        for (int i = 0; i < target.length; i++) {
            if (target[i] == -1) {
                if (inferred >= 0) {
                    throw new IllegalArgumentException("only one dimension can be inferred");
                }
                inferred = i;
            } else if (target[i] < 0) {
                throw new IllegalArgumentException("invalid shape dimension " + target[i]);
            } else {
                known *= target[i];
            }
        }
        if (inferred >= 0) {
            if (known == 0 || elementCount % known != 0) {
                throw new IllegalArgumentException(
                    "shape '" + Arrays.toString(shape) + "' is invalid for input of size " + elementCount);
            }
            target[inferred] = (int) (elementCount / known);
        } else if (known != elementCount) {
            throw new IllegalArgumentException(
                "shape '" + Arrays.toString(shape) + "' is invalid for input of size " + elementCount);
        }
        return target;
    }

    /**
     * Strides that let {@code newShape} alias the layout, or null when a copy is required.
     */
    private static long[] computeViewStrides(int[] oldShape, long[] oldStrides, int[] newShape) {
        long[] newStrides = new long[newShape.length];
        if (oldShape.length == 0) {
            Arrays.fill(newStrides, 1);
            return newStrides;
        }
        if (TensorSpec.elementCount(oldShape) == 0) {
            return TensorSpec.computeRowMajorStrides(newShape);
        }
        int viewD = newShape.length - 1;
        long chunkBaseStride = oldStrides[oldStrides.length - 1];
        long tensorNumel = 1;
        long viewNumel = 1;
        for (int tensorD = oldShape.length - 1; tensorD >= 0; tensorD--) {
            tensorNumel *= oldShape[tensorD];
            if (tensorD == 0
                    || (oldShape[tensorD - 1] != 1 && oldStrides[tensorD - 1] != tensorNumel * chunkBaseStride)) {
                while (viewD >= 0 && (viewNumel < tensorNumel || newShape[viewD] == 1)) {
                    newStrides[viewD] = viewNumel * chunkBaseStride;
                    viewNumel *= newShape[viewD];
                    viewD--;
                }
                if (viewNumel != tensorNumel) {
                    return null;
                }
                if (tensorD > 0) {
                    chunkBaseStride = oldStrides[tensorD - 1];
                    tensorNumel = 1;
                    viewNumel = 1;
                }
            }
        }
        if (viewD != -1) {
            return null;
        }
        return newStrides;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Tensor[shape=").append(Arrays.toString(spec.shape()));
        sb.append(", dtype=").append(spec.dtype());
        sb.append(", device=").append(device);
        sb.append(", elements=").append(elementCount());
        if (elementCount() <= 10) {
            sb.append(", data=").append(Arrays.toString(toDoubleArray()));
        }
        if (storage.isMapped()) {
            sb.append(", file=").append(storage.file());
        }
        sb.append("]");
        return sb.toString();
    }
}
