package io.surfworks.tensordict;

import io.surfworks.tensordict.lock.LockNode;
import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.Index;
import io.surfworks.tensordict.tensor.Tensor;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Lazy view of a source container through an invertible batch transform.
 *
 * <p>Reads apply the transform to the source's entries; writes are checked against the
 * view's batch size, mapped back with the inverse and stored in the source. Nothing is
 * copied: leaves are strided views of the source's storage. Lock state belongs to the source.
 *
 * <p>Applying the exact inverse of the transform returns the source itself.
 */
public abstract sealed class TransformedTensorDict extends TensorDictBase
        permits PermutedTensorDict, TransposedTensorDict, SqueezedTensorDict, UnsqueezedTensorDict, ViewedTensorDict {

    private final TensorDictBase source;
    private final ViewTransform transform;

    TransformedTensorDict(TensorDictBase source, ViewTransform transform) {
        this.source = source;
        this.transform = transform;
    }

    /**
     * The container this view reads from and writes to.
     */
    public TensorDictBase getSource() {
        return source;
    }

    ViewTransform transform() {
        return transform;
    }

    @Override
    public int[] batchSize() {
        return transform.forwardShape(source.batchSize());
    }

    @Override
    public Device device() {
        return source.device();
    }

    @Override
    public List<String> names() {
        return transform.forwardNames(source.names());
    }

    @Override
    public TensorDictBase setNames(List<String> names) {
        throw new UnsupportedOnProxyException("Names of a lazy tensordict cannot be modified. Call toTensorDict() first.");
    }

    @Override
    public TensorDictBase setBatchSize(int... batchSize) {
        throw new BatchSizeImmutableException(
            "modifying the batch size of a lazy representation of a tensordict is not permitted. "
            + "Consider instantiating the tensordict first by calling `toTensorDict()` before resetting the batch size.");
    }

    // ==================== Entries ====================

    @Override
    List<String> rootKeys() {
        return source.rootKeys();
    }

    @Override
    Object rawGet(String key) {
        Object value = source.rawGet(key);
        if (value instanceof Tensor leaf) {
            return transform.forward(leaf);
        }
        if (value instanceof TensorDictBase nested) {
            return transform.forward(nested);
        }
        return null;
    }

    @Override
    boolean holdsContainer(String key) {
        return source.holdsContainer(key);
    }

    @Override
    void rawSet(String key, Object value, boolean inplace) {
        Invariants.checkPrefix(key, Invariants.shapeOf(value), batchSize());
        Object inverted = value instanceof Tensor tensor
            ? transform.inverse(tensor)
            : transform.inverse((TensorDictBase) value);
        source.rawSet(key, inverted, inplace);
    }

    @Override
    void rawDelete(String key) {
        source.rawDelete(key);
    }

    @Override
    void rawSetAt(String key, Object value, Index[] index) {
        Object existing = rawGet(key);
        if (existing instanceof Tensor leaf && value instanceof Tensor tensor) {
            // forward leaves alias the source storage
            try {
                leaf.indexPut(index, tensor);
            } catch (IllegalArgumentException e) {
                throw new ShapeMismatchException("Cannot write a value of shape " + Arrays.toString(tensor.shape())
                    + " at the index into key \"" + key + "\"", e);
            }
            return;
        }
        super.rawSetAt(key, value, index);
    }

    @Override
    TensorDictBase applyTransform(ViewTransform next) {
        if (next.isInverseOf(transform)) {
            return source;
        }
        return next.wrap(this);
    }

    // ==================== Lock Graph ====================

    @Override
    public boolean isLocked() {
        return source.isLocked();
    }

    @Override
    public Set<Long> lockOwners() {
        return source.lockOwners();
    }

    @Override
    public TensorDictBase lock() {
        source.lock();
        return this;
    }

    @Override
    public TensorDictBase unlock() {
        source.unlock();
        return this;
    }

    @Override
    LockNode propagateLock(Set<Long> ids) {
        return source.propagateLock(ids);
    }

    @Override
    void propagateUnlock(Set<Long> ids, List<LockNode> visited) {
        source.propagateUnlock(ids, visited);
    }

    // reshaped leaves may be copies
    @Override
    boolean cachesValues() {
        return false;
    }

    @Override
    long cacheStamp() {
        return source.cacheStamp();
    }

    // ==================== Memmap ====================

    @Override
    public TensorDictBase memmap(Path prefix, boolean copyExisting) {
        throw new UnsupportedOnProxyException(
            "Cannot build a memmap of a lazy " + getClass().getSimpleName() + ". Call toTensorDict() first.");
    }

    @Override
    public Path memmapPrefix() {
        return source.memmapPrefix();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(transform=" + transform + ", batchSize=" + Arrays.toString(batchSize())
            + ", source=" + source + ")";
    }
}
