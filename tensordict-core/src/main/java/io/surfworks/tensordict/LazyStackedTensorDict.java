package io.surfworks.tensordict;

import io.surfworks.tensordict.config.TensorDictConfig;
import io.surfworks.tensordict.lock.LockGraph;
import io.surfworks.tensordict.lock.LockNode;
import io.surfworks.tensordict.memmap.MemmapMetadata;
import io.surfworks.tensordict.memmap.MemmapPersistence;
import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.Index;
import io.surfworks.tensordict.tensor.Indexer;
import io.surfworks.tensordict.tensor.Tensor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.ref.Cleaner;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Lazy stack of containers sharing a batch size, along a new batch dimension.
 *
 * <p>Nothing is stacked up front. Reading a leaf stacks the children's leaves into a new
 * tensor; reading a nested container returns a stack of the children's nested containers.
 * Writes are split along the stack dimension and stored in each child.
 *
 * <p>The visible keys are those present in every child. When a key is read that is not
 * visible, the key set is derived again, so a key added to every child directly becomes
 * visible (and stays visible) on first access.
 */
public final class LazyStackedTensorDict extends TensorDictBase {

    private static final Logger LOG = Logger.getLogger(LazyStackedTensorDict.class.getName());

    private final List<TensorDictBase> children;
    private final int stackDim;
    private String stackDimName;
    private final List<String> validKeys = new ArrayList<>();

    private final LockNode node = new LockNode();
    // null until lock() or unlock() is called on the stack itself
    private Boolean lockedFlag;
    private final Cleaner.Cleanable cleanable;
    private Path memmapPrefix;

    /**
     * @param children  containers of identical batch size and device
     * @param stackDim  position of the new dimension, in {@code [0, childBatchDims]}
     * @throws BatchSizeMismatchException if batch sizes differ
     * @throws DeviceMismatchException    if devices differ
     */
    LazyStackedTensorDict(List<? extends TensorDictBase> children, int stackDim) {
        if (children.isEmpty()) {
            throw new IllegalArgumentException("LazyStackedTensorDict needs at least one tensordict to stack");
        }
        TensorDictBase first = children.get(0);
        for (int i = 1; i < children.size(); i++) {
            checkCompatible(first, children.get(i));
        }
        if (stackDim < 0 || stackDim > first.batchDims()) {
            throw new IndexOutOfBoundsException("Stack dim " + stackDim + " is out of range for tensordicts with "
                + first.batchDims() + " batch dimensions");
        }
        this.children = new ArrayList<>(children);
        this.stackDim = stackDim;
        this.validKeys.addAll(sharedKeys());
        this.cleanable = LockGraph.register(this, node);
    }

    private static void checkCompatible(TensorDictBase first, TensorDictBase other) {
        if (!Arrays.equals(first.batchSize(), other.batchSize())) {
            throw new BatchSizeMismatchException("Batch sizes in tensordicts differs, LazyStackedTensorDict cannot be "
                + "created. Got td[0].batchSize=" + Arrays.toString(first.batchSize())
                + " and td[i].batchSize=" + Arrays.toString(other.batchSize()));
        }
        if (!Objects.equals(first.device(), other.device())) {
            throw new DeviceMismatchException("Devices differ, got " + first.device() + " and " + other.device());
        }
    }

    public int stackDim() {
        return stackDim;
    }

    /**
     * The stacked containers, in order.
     */
    public List<TensorDictBase> children() {
        return Collections.unmodifiableList(children);
    }

    // ==================== Shape, Device, Names ====================

    @Override
    public int[] batchSize() {
        return Invariants.insert(children.get(0).batchSize(), stackDim, children.size());
    }

    @Override
    public Device device() {
        return children.get(0).device();
    }

    @Override
    public List<String> names() {
        return Invariants.inserted(children.get(0).names(), stackDim, stackDimName);
    }

    /**
     * Store the stack dimension's name and hand the others to every child.
     */
    @Override
    public LazyStackedTensorDict setNames(List<String> names) {
        List<String> checked = Invariants.checkNames(names, batchDims());
        List<String> childNames = Invariants.removed(checked, stackDim);
        for (TensorDictBase child : children) {
            child.setNames(childNames);
        }
        stackDimName = checked.get(stackDim);
        return this;
    }

    @Override
    void adoptLeadingNames(List<String> parentNames) {
        setNames(Invariants.withLeading(names(), parentNames));
    }

    @Override
    public TensorDictBase setBatchSize(int... batchSize) {
        throw new BatchSizeImmutableException(
            "modifying the batch size of a lazy representation of a tensordict is not permitted. "
            + "Consider instantiating the tensordict first by calling `toTensorDict()` before resetting the batch size.");
    }

    // ==================== Keys ====================

    private List<String> sharedKeys() {
        List<String> shared = new ArrayList<>(children.get(0).rootKeys());
        for (int i = 1; i < children.size(); i++) {
            shared.retainAll(new HashSet<>(children.get(i).rootKeys()));
        }
        return shared;
    }

    private void refreshKeys() {
        List<String> shared = sharedKeys();
        LOG.fine(() -> "Re-deriving keys of LazyStackedTensorDict: " + validKeys + " -> " + shared);
        validKeys.clear();
        validKeys.addAll(shared);
        cache.clear();
    }

    @Override
    List<String> rootKeys() {
        return new ArrayList<>(validKeys);
    }

    @Override
    boolean holdsContainer(String key) {
        return validKeys.contains(key) && children.get(0).holdsContainer(key);
    }

    // ==================== Entries ====================

    @Override
    Object rawGet(String key) {
        if (!validKeys.contains(key)) {
            if (!TensorDictConfig.global().stackKeyDiscovery()) {
                return null;
            }
            refreshKeys();
            if (!validKeys.contains(key)) {
                return null;
            }
        }
        List<Tensor> leaves = new ArrayList<>();
        List<TensorDictBase> nested = new ArrayList<>();
        for (TensorDictBase child : children) {
            Object value = child.rawGet(key);
            if (value == null) {
                // removed from a child behind the stack's back
                refreshKeys();
                return null;
            }
            if (value instanceof Tensor leaf) {
                leaves.add(leaf);
            } else {
                nested.add((TensorDictBase) value);
            }
        }
        if (!leaves.isEmpty() && !nested.isEmpty()) {
            throw new TypeMismatchException("Key \"" + key + "\" holds a Tensor in some stacked tensordicts "
                + "and a TensorDictBase in others");
        }
        if (!nested.isEmpty()) {
            return new LazyStackedTensorDict(nested, stackDim);
        }
        checkUniformShapes(key, leaves);
        return Tensor.stack(leaves, stackDim);
    }

    private static void checkUniformShapes(String key, List<Tensor> leaves) {
        int[] shape = leaves.get(0).shape();
        for (Tensor leaf : leaves) {
            if (!Arrays.equals(shape, leaf.shape())) {
                List<String> shapes = new ArrayList<>();
                for (Tensor t : leaves) {
                    shapes.add(Arrays.toString(t.shape()));
                }
                throw new ShapeMismatchException("Found more than one unique shape in the tensors to be stacked "
                    + shapes + " for key \"" + key + "\". This is likely due to a modification of one of the "
                    + "stacked TensorDicts, where a key has been updated/created with an incompatible shape. "
                    + "If the entries are intended to have a different shape, use getNestedTensor.");
            }
        }
    }

    /**
     * Per-child leaves of a key, whatever their shapes.
     *
     * @throws UnsupportedOnProxyException unless the stack dimension is 0
     */
    public List<Tensor> getNestedTensor(String key) {
        if (stackDim != 0) {
            throw new UnsupportedOnProxyException(
                "LazyStackedTensorDict.getNestedTensor can only be called when the stack_dim is 0.");
        }
        List<Tensor> result = new ArrayList<>(children.size());
        for (TensorDictBase child : children) {
            result.add(child.get(key));
        }
        return result;
    }

    @Override
    void rawSet(String key, Object value, boolean inplace) {
        Invariants.checkPrefix(key, Invariants.shapeOf(value), batchSize());
        boolean present = validKeys.contains(key);
        if (!(inplace && present)) {
            checkUnlocked();
        }
        List<?> parts = value instanceof Tensor tensor
            ? tensor.unbind(stackDim)
            : ((TensorDictBase) value).unbind(stackDim);
        checkChildWrites(key, parts, inplace && present);
        for (int i = 0; i < children.size(); i++) {
            children.get(i).rawSet(key, parts.get(i), inplace && present);
        }
        if (!present) {
            validKeys.add(key);
        }
    }

    /**
     * Reject a write that some child would refuse before any child is modified.
     */
    private void checkChildWrites(String key, List<?> parts, boolean inplace) {
        for (int i = 0; i < children.size(); i++) {
            TensorDictBase child = children.get(i);
            Object existing = inplace ? child.rawGet(key) : null;
            if (existing == null) {
                child.checkUnlocked();
                continue;
            }
            Object part = parts.get(i);
            if (existing instanceof Tensor leaf) {
                if (!(part instanceof Tensor tensor)) {
                    throw new TypeMismatchException(
                        "Cannot write a TensorDictBase in place of the Tensor at key \"" + key + "\" of child " + i);
                }
                try {
                    tensor.broadcastTo(leaf.shape());
                } catch (IllegalArgumentException e) {
                    throw new ShapeMismatchException("Cannot write a value of shape " + Arrays.toString(tensor.shape())
                        + " in place of key \"" + key + "\" of child " + i + " with shape "
                        + Arrays.toString(leaf.shape()), e);
                }
            } else if (!(part instanceof TensorDictBase)) {
                throw new TypeMismatchException(
                    "Cannot write a Tensor in place of the TensorDictBase at key \"" + key + "\" of child " + i);
            }
        }
    }

    @Override
    void rawSetAt(String key, Object value, Index[] index) {
        if (!(value instanceof Tensor tensor) || holdsContainer(key)) {
            super.rawSetAt(key, value, index);
            return;
        }
        int k = stackComponent(index);
        Index component = index[k];
        Index[] rest = without(index, k);
        if (component instanceof Index.At at) {
            int position = (int) Indexer.normalizePosition(at.position(), children.size(), stackDim);
            children.get(position).rawSetAt(key, tensor, rest);
            return;
        }
        long[] positions = stackPositions(component);
        if (positions == null) {
            super.rawSetAt(key, value, index);
            return;
        }
        int resultDim = resultDimsBefore(index, k);
        for (int j = 0; j < positions.length; j++) {
            TensorDictBase child = children.get((int) positions[j]);
            int[] childResult = Indexer.resultShape(child.get(key).shape(), rest);
            Tensor part = tensor.broadcastTo(Invariants.insert(childResult, resultDim, positions.length))
                .select(resultDim, j);
            child.rawSetAt(key, part, rest);
        }
    }

    @Override
    void rawDelete(String key) {
        checkUnlocked();
        if (!validKeys.contains(key)) {
            refreshKeys();
            if (!validKeys.contains(key)) {
                throw KeyMissingException.notFound(NestedKey.of(key), validKeys);
            }
        }
        for (TensorDictBase child : children) {
            child.rawDelete(key);
        }
        validKeys.remove(key);
    }

    // ==================== Indexing ====================

    /**
     * Integers on the stack dimension return a child, slices and integer arrays return a stack
     * of the selected children; anything else is materialized.
     */
    @Override
    public TensorDictBase index(Index... index) {
        Index[] expanded = expandIndex(index);
        int k = stackComponent(expanded);
        Index component = expanded[k];
        Index[] rest = without(expanded, k);
        if (component instanceof Index.At at) {
            int position = (int) Indexer.normalizePosition(at.position(), children.size(), stackDim);
            TensorDictBase child = children.get(position);
            return isFullSelection(rest) ? child : child.index(rest);
        }
        long[] positions = stackPositions(component);
        if (positions == null || positions.length == 0) {
            return super.index(expanded);
        }
        List<TensorDictBase> selected = new ArrayList<>(positions.length);
        for (long position : positions) {
            TensorDictBase child = children.get((int) position);
            selected.add(isFullSelection(rest) ? child : child.index(rest));
        }
        LazyStackedTensorDict result = new LazyStackedTensorDict(selected, resultDimsBefore(expanded, k));
        result.stackDimName = component instanceof Index.Slice || component instanceof Index.Take ? stackDimName : null;
        return result;
    }

    @Override
    public List<TensorDictBase> unbind(int dim) {
        if (Indexer.normalizeDim(dim, batchDims()) == stackDim) {
            return new ArrayList<>(children);
        }
        return super.unbind(dim);
    }

    /**
     * Position in an expanded index of the component covering the stack dimension.
     */
    private int stackComponent(Index[] expanded) {
        int consumed = 0;
        for (int k = 0; k < expanded.length; k++) {
            int span = expanded[k].consumedDims();
            if (span > 0 && consumed <= stackDim && stackDim < consumed + span) {
                return k;
            }
            consumed += span;
        }
        throw new IllegalStateException("index " + Arrays.toString(expanded) + " does not cover the stack dimension");
    }

    /**
     * Children selected by a slice, integer array or 1-d mask; null for other components.
     */
    private long[] stackPositions(Index component) {
        if (component instanceof Index.Slice || component instanceof Index.Take
            || (component instanceof Index.Mask mask && mask.mask().rank() == 1)) {
            return Tensor.arange(children.size()).index(component).toLongArray();
        }
        return null;
    }

    private static int resultDimsBefore(Index[] expanded, int k) {
        int dims = 0;
        for (int i = 0; i < k; i++) {
            if (!(expanded[i] instanceof Index.At)) {
                dims++;
            }
        }
        return dims;
    }

    private static Index[] without(Index[] index, int k) {
        Index[] rest = new Index[index.length - 1];
        System.arraycopy(index, 0, rest, 0, k);
        System.arraycopy(index, k + 1, rest, k, index.length - k - 1);
        return rest;
    }

    private static boolean isFullSelection(Index[] index) {
        for (Index component : index) {
            if (!(component instanceof Index.Slice slice)
                || slice.start() != null || slice.stop() != null || slice.step() != 1) {
                return false;
            }
        }
        return true;
    }

    // ==================== Insert / Append ====================

    /**
     * Insert a container at {@code index} along the stack dimension.
     *
     * @throws TypeMismatchException      if {@code item} is not a container
     * @throws LockedMutationException    if the stack is locked
     * @throws BatchSizeMismatchException if the batch size differs from the other children
     * @throws DeviceMismatchException    if the device differs from the other children
     */
    public LazyStackedTensorDict insert(int index, Object item) {
        if (!(item instanceof TensorDictBase td)) {
            throw new TypeMismatchException("Expected new value to be TensorDictBase instance but got "
                + (item == null ? "null" : item.getClass().getName()));
        }
        checkUnlocked();
        if (!Arrays.equals(td.batchSize(), children.get(0).batchSize())) {
            throw new BatchSizeMismatchException("Batch sizes in tensordicts differs, expected "
                + Arrays.toString(children.get(0).batchSize()) + " but got " + Arrays.toString(td.batchSize()));
        }
        if (!Objects.equals(td.device(), device())) {
            throw new DeviceMismatchException("Devices differ, expected " + device() + " but got " + td.device());
        }
        children.add(index, td);
        refreshKeys();
        return this;
    }

    public LazyStackedTensorDict append(Object item) {
        return insert(children.size(), item);
    }

    // ==================== Lock Graph ====================

    /**
     * The explicit lock flag if {@link #lock()} or {@link #unlock()} was called, else whether every child is locked.
     */
    @Override
    public boolean isLocked() {
        if (lockedFlag != null) {
            return lockedFlag;
        }
        for (TensorDictBase child : children) {
            if (!child.isLocked()) {
                return false;
            }
        }
        return true;
    }

    Boolean explicitLockFlag() {
        return lockedFlag;
    }

    @Override
    public Set<Long> lockOwners() {
        Set<Long> owners = new HashSet<>();
        for (TensorDictBase child : children) {
            owners.addAll(child.lockOwners());
        }
        owners.remove(node.id());
        return Collections.unmodifiableSet(owners);
    }

    @Override
    public LazyStackedTensorDict lock() {
        if (isLocked()) {
            return this;
        }
        LockGraph.atomically(() -> {
            propagateLock(Set.of());
        });
        LOG.fine(() -> "Locked LazyStackedTensorDict " + node.id() + " of " + children.size() + " tensordicts");
        return this;
    }

    @Override
    public LazyStackedTensorDict unlock() {
        LockGraph.atomically(() -> {
            List<LockNode> visited = new ArrayList<>();
            propagateUnlock(new HashSet<>(), visited);
            for (LockNode n : visited) {
                if (n.hasOwners()) {
                    propagateLock(Set.of());
                    throw LockedMutationException.partOfLockedGraph();
                }
            }
        });
        return this;
    }

    @Override
    public void release() {
        cleanable.clean();
    }

    @Override
    LockNode propagateLock(Set<Long> ids) {
        node.addOwners(ids);
        node.setLocked(true);
        lockedFlag = Boolean.TRUE;
        Set<Long> childIds = node.withSelf(ids);
        for (TensorDictBase child : children) {
            LockNode childNode = child.propagateLock(childIds);
            if (childNode != null) {
                node.addLockedChild(childNode);
            }
        }
        return node;
    }

    @Override
    void propagateUnlock(Set<Long> ids, List<LockNode> visited) {
        node.removeOwners(ids);
        node.setLocked(false);
        lockedFlag = null;
        node.clearLockedChildren();
        node.bumpGeneration();
        cache.clear();
        visited.add(node);
        ids.add(node.id());
        for (TensorDictBase child : children) {
            child.propagateUnlock(ids, visited);
        }
    }

    // leaves are stacked afresh on every read
    @Override
    boolean cachesValues() {
        return false;
    }

    @Override
    long cacheStamp() {
        long stamp = node.generation();
        for (TensorDictBase child : children) {
            stamp += child.cacheStamp();
        }
        return stamp;
    }

    // ==================== Copies ====================

    /**
     * Stack of cloned children.
     */
    @Override
    public LazyStackedTensorDict clone() {
        List<TensorDictBase> clones = new ArrayList<>(children.size());
        for (TensorDictBase child : children) {
            clones.add(child.clone());
        }
        LazyStackedTensorDict result = new LazyStackedTensorDict(clones, stackDim);
        result.stackDimName = stackDimName;
        return result;
    }

    @Override
    public TensorDictBase to(Device target) {
        Objects.requireNonNull(target, "device cannot be null");
        if (target.equals(device())) {
            return this;
        }
        List<TensorDictBase> moved = new ArrayList<>(children.size());
        for (TensorDictBase child : children) {
            moved.add(child.to(target));
        }
        LazyStackedTensorDict result = new LazyStackedTensorDict(moved, stackDim);
        result.stackDimName = stackDimName;
        return result;
    }

    // ==================== Memmap ====================

    @Override
    public Path memmapPrefix() {
        return memmapPrefix;
    }

    @Override
    public boolean isMemmap() {
        for (TensorDictBase child : children) {
            if (!child.isMemmap()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Memmap every child to {@code prefix/i} and write a stack descriptor to {@code prefix}.
     */
    @Override
    public LazyStackedTensorDict memmap(Path prefix, boolean copyExisting) {
        Path target;
        if (prefix != null) {
            target = prefix.toAbsolutePath().normalize();
        } else if (memmapPrefix != null) {
            target = memmapPrefix;
        } else {
            target = TensorDict.createTempPrefix();
        }
        if (memmapPrefix != null && isMemmap()) {
            if (memmapPrefix.equals(target)) {
                return this;
            }
            if (!copyExisting) {
                throw TensorDictException.memmapLocation(memmapPrefix, target);
            }
        }
        LOG.fine(() -> "Writing memmap LazyStackedTensorDict to " + target);
        for (int i = 0; i < children.size(); i++) {
            children.set(i, children.get(i).memmap(target.resolve(String.valueOf(i)), copyExisting));
        }
        try {
            MemmapPersistence.writeMetadata(target, MemmapMetadata.forStack(batchSize(),
                MemmapPersistence.deviceString(device()), names(), stackDim, children.size()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write memmap metadata to " + target, e);
        }
        memmapPrefix = target;
        lock();
        return this;
    }

    /**
     * Zero-filled memmapped stack with the same children structure.
     */
    @Override
    public LazyStackedTensorDict memmapLike(Path prefix) {
        List<TensorDictBase> zeros = new ArrayList<>(children.size());
        for (TensorDictBase child : children) {
            zeros.add(child.zerosLike());
        }
        LazyStackedTensorDict like = new LazyStackedTensorDict(zeros, stackDim);
        like.stackDimName = stackDimName;
        return like.memmap(prefix, false);
    }

    static LazyStackedTensorDict loadMemmap(Path dir, MemmapMetadata meta) throws IOException {
        Path prefix = dir.toAbsolutePath().normalize();
        List<TensorDictBase> children = new ArrayList<>(meta.count());
        for (int i = 0; i < meta.count(); i++) {
            children.add(TensorDicts.loadMemmap(prefix.resolve(String.valueOf(i))));
        }
        LazyStackedTensorDict stack = new LazyStackedTensorDict(children, meta.stackDim());
        if (meta.names().size() == stack.batchDims()) {
            stack.stackDimName = meta.names().get(meta.stackDim());
        }
        stack.memmapPrefix = prefix;
        stack.lock();
        LOG.fine(() -> "Loaded memmap LazyStackedTensorDict from " + prefix);
        return stack;
    }

    @Override
    public String toString() {
        return "LazyStackedTensorDict(keys=" + validKeys + ", batchSize=" + Arrays.toString(batchSize())
            + ", stackDim=" + stackDim + ", count=" + children.size() + ", locked=" + isLocked() + ")";
    }
}
