package io.surfworks.tensordict;

import io.surfworks.tensordict.lock.LockNode;
import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.Index;
import io.surfworks.tensordict.tensor.Indexer;
import io.surfworks.tensordict.tensor.Tensor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Write-through view of a parent container at a fixed index.
 *
 * <p>Reads return {@code parent.get(key)} indexed by the stored index: with basic components
 * this is a zero-copy view, with an advanced component a gathered copy. In-place writes
 * ({@code setInPlace}, {@code setAt}, {@code fill}, {@code updateInPlace}) scatter into the
 * parent's storage. Setting a new key allocates a zero-filled entry in the parent and
 * writes the value at the index.
 *
 * <p>Sub-views of sub-views keep the top-most parent and compose the indices.
 */
public final class SubTensorDict extends TensorDictBase {

    private final TensorDictBase source;
    // one stage per getSubTensorDict call, each expanded against the batch rank it applies to
    private final List<Index[]> chain;

    SubTensorDict(TensorDictBase source, List<Index[]> chain) {
        this.source = source;
        this.chain = List.copyOf(chain);
    }

    /**
     * The top-most container this view writes into.
     */
    public TensorDictBase getParent() {
        return source;
    }

    @Override
    public TensorDictBase getSubTensorDict(Index... index) {
        List<Index[]> extended = new ArrayList<>(chain);
        extended.add(expandIndex(index));
        return new SubTensorDict(source, extended);
    }

    // ==================== Shape, Device, Names ====================

    @Override
    public int[] batchSize() {
        int[] shape = source.batchSize();
        for (Index[] stage : chain) {
            shape = Indexer.resultShape(shape, stage);
        }
        return shape;
    }

    @Override
    public Device device() {
        return source.device();
    }

    @Override
    public List<String> names() {
        List<String> names = source.names();
        for (Index[] stage : chain) {
            names = Indexer.resultNames(names, stage);
        }
        return names;
    }

    @Override
    public TensorDictBase setNames(List<String> names) {
        throw new UnsupportedOnProxyException(
            "Names of a subtensordict cannot be modified. Instantiate it as a TensorDict first.");
    }

    @Override
    public TensorDictBase setBatchSize(int... batchSize) {
        throw new BatchSizeImmutableException(
            "Modifying the batch size of a SubTensorDict is not permitted. "
            + "Consider instantiating the SubTensorDict first by calling `toTensorDict()`.");
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
            for (Index[] stage : chain) {
                leaf = leaf.index(stage);
            }
            return leaf;
        }
        if (value instanceof TensorDictBase nested) {
            return new SubTensorDict(nested, chain);
        }
        return null;
    }

    @Override
    boolean holdsContainer(String key) {
        return source.holdsContainer(key);
    }

    @Override
    void rawSet(String key, Object value, boolean inplace) {
        boolean present = source.rawGet(key) != null;
        if (present && !inplace) {
            throw new UnsupportedOnProxyException(
                "Calling `SubTensorDict.set(key, value, inplace=false)` is prohibited for existing tensors. "
                + "Consider calling setInPlace(...) or cloning your tensordict first.");
        }
        Invariants.checkPrefix(key, Invariants.shapeOf(value), batchSize());
        if (!present) {
            source.set(key, zerosFor(value, batchDims(), source.batchSize(), source.device()));
        }
        Object existing = source.rawGet(key);
        if (value instanceof TensorDictBase nested) {
            if (!(existing instanceof TensorDictBase target)) {
                throw new TypeMismatchException("Cannot write a TensorDictBase in place of the Tensor at key \"" + key + "\"");
            }
            new SubTensorDict(target, chain).update(nested, true);
            return;
        }
        if (!(existing instanceof Tensor)) {
            throw new TypeMismatchException("Cannot write a Tensor in place of the TensorDictBase at key \"" + key + "\"");
        }
        writeThrough(key, (Tensor) value, chain);
    }

    @Override
    void rawSetAt(String key, Object value, Index[] index) {
        Object existing = source.rawGet(key);
        if (existing == null) {
            throw KeyMissingException.notFound(NestedKey.of(key), keys());
        }
        if (existing instanceof Tensor && value instanceof Tensor tensor) {
            List<Index[]> stages = new ArrayList<>(chain);
            stages.add(index);
            writeThrough(key, tensor, stages);
            return;
        }
        super.rawSetAt(key, value, index);
    }

    /**
     * Scatter {@code value} into the parent entry through every stage. The first stage goes
     * through the parent's own scatter; later stages write into a temporary that is then
     * written back.
     */
    private void writeThrough(String key, Tensor value, List<Index[]> stages) {
        if (stages.size() == 1) {
            source.rawSetAt(key, value, stages.get(0));
            return;
        }
        Tensor selected = ((Tensor) source.rawGet(key)).index(stages.get(0));
        writeStages(selected, stages, 1, value);
        source.rawSetAt(key, selected, stages.get(0));
    }

    private static void writeStages(Tensor target, List<Index[]> stages, int stage, Tensor value) {
        Index[] index = stages.get(stage);
        try {
            if (stage == stages.size() - 1) {
                target.indexPut(index, value);
                return;
            }
            Tensor selected = target.index(index);
            writeStages(selected, stages, stage + 1, value);
            if (isAdvanced(index)) {
                // gathered copies must be scattered back
                target.indexPut(index, selected);
            }
        } catch (IllegalArgumentException e) {
            throw new ShapeMismatchException("Cannot write a value of shape " + Arrays.toString(value.shape())
                + " through the sub-tensordict index", e);
        }
    }

    private static boolean isAdvanced(Index[] index) {
        for (Index component : index) {
            if (component.isAdvanced()) {
                return true;
            }
        }
        return false;
    }

    @Override
    void rawDelete(String key) {
        source.rawDelete(key);
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
        throw new UnsupportedOnProxyException("Cannot lock a SubTensorDict. Lock the parent tensordict instead.");
    }

    @Override
    public TensorDictBase unlock() {
        throw new UnsupportedOnProxyException("Cannot unlock a SubTensorDict. Unlock the parent tensordict instead.");
    }

    @Override
    LockNode propagateLock(Set<Long> ids) {
        return null;
    }

    @Override
    void propagateUnlock(Set<Long> ids, List<LockNode> visited) {
    }

    // mask and take indices gather copies
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
        throw new UnsupportedOnProxyException("Converting a sub-tensordict values to memmap cannot be done.");
    }

    @Override
    public String toString() {
        return "SubTensorDict(batchSize=" + Arrays.toString(batchSize()) + ", source=" + source + ")";
    }
}
