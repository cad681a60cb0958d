package io.surfworks.tensordict;

import io.surfworks.tensordict.config.TensorDictConfig;
import io.surfworks.tensordict.lock.LockGraph;
import io.surfworks.tensordict.lock.LockNode;
import io.surfworks.tensordict.memmap.MemmapMetadata;
import io.surfworks.tensordict.memmap.MemmapPersistence;
import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.Index;
import io.surfworks.tensordict.tensor.Tensor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.ref.Cleaner;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Container that stores its entries.
 *
 * <pre>{@code
 * TensorDict td = new TensorDict(Map.of(
 *     "obs", Tensor.zeros(4, 3, 84),
 *     "next", Map.of("reward", Tensor.zeros(4, 3))), 4, 3);
 * td.get("next", "reward");            // shape [4, 3]
 * td.index(Index.at(0)).batchSize();   // [3]
 * }</pre>
 */
public final class TensorDict extends TensorDictBase {

    private static final Logger LOG = Logger.getLogger(TensorDict.class.getName());

    private final Map<String, Object> entries = new LinkedHashMap<>();
    private int[] batchSize;
    private final Device device;
    private List<String> names;

    private final LockNode node = new LockNode();
    private final Cleaner.Cleanable cleanable;
    private Path memmapPrefix;

    /**
     * Build a container on the configured default device.
     *
     * @param source    map from {@code String} or {@code NestedKey} to values (see {@link TensorDictBase})
     * @param batchSize leading shape shared by every entry
     */
    public TensorDict(Map<?, ?> source, int... batchSize) {
        this(source, batchSize, TensorDictConfig.global().defaultDevice(), null);
    }

    /**
     * @param device device of every leaf, or null to leave leaves where they are
     */
    public TensorDict(Map<?, ?> source, int[] batchSize, Device device) {
        this(source, batchSize, device, null);
    }

    public TensorDict(Map<?, ?> source, int[] batchSize, Device device, List<String> names) {
        for (int size : batchSize) {
            if (size < 0) {
                throw new IllegalArgumentException("batch sizes must be non-negative, got " + Arrays.toString(batchSize));
            }
        }
        this.batchSize = batchSize.clone();
        this.device = device;
        this.names = Invariants.checkNames(names, batchSize.length);
        this.cleanable = LockGraph.register(this, node);
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            set(NestedKey.from(entry.getKey()), entry.getValue(), false);
        }
    }

    /**
     * Empty container with no batch dimensions.
     */
    public TensorDict() {
        this(Map.of());
    }

    // ==================== Shape, Device, Names ====================

    @Override
    public int[] batchSize() {
        return batchSize.clone();
    }

    @Override
    public int batchDims() {
        return batchSize.length;
    }

    @Override
    public Device device() {
        return device;
    }

    @Override
    public List<String> names() {
        return names;
    }

    /**
     * Assign names and propagate them to the leading dims of nested containers.
     * Allowed while locked.
     */
    @Override
    public TensorDict setNames(List<String> names) {
        this.names = Invariants.checkNames(names, batchSize.length);
        for (Object value : entries.values()) {
            if (value instanceof TensorDictBase nested) {
                nested.adoptLeadingNames(this.names);
            }
        }
        return this;
    }

    @Override
    void adoptLeadingNames(List<String> parentNames) {
        setNames(Invariants.withLeading(names, parentNames));
    }

    @Override
    public TensorDict setBatchSize(int... newSize) {
        checkUnlocked();
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            Invariants.checkPrefix(entry.getKey(), Invariants.shapeOf(entry.getValue()), newSize);
        }
        batchSize = newSize.clone();
        names = Invariants.resize(names, newSize.length);
        return this;
    }

    // ==================== Entries ====================

    @Override
    List<String> rootKeys() {
        return new ArrayList<>(entries.keySet());
    }

    @Override
    Object rawGet(String key) {
        return entries.get(key);
    }

    @Override
    void rawSet(String key, Object value, boolean inplace) {
        NestedKey.checkAtom(key);
        Object existing = entries.get(key);
        if (inplace && existing != null) {
            writeInPlace(key, existing, value);
            return;
        }
        checkUnlocked();
        entries.put(key, prepare(key, value));
    }

    @Override
    void rawDelete(String key) {
        checkUnlocked();
        if (entries.remove(key) == null) {
            throw KeyMissingException.notFound(NestedKey.of(key), entries.keySet());
        }
    }

    @Override
    void rawSetAt(String key, Object value, Index[] index) {
        Object existing = entries.get(key);
        if (existing instanceof Tensor leaf && value instanceof Tensor tensor) {
            try {
                leaf.indexPut(index, tensor);
            } catch (IllegalArgumentException e) {
                throw new ShapeMismatchException("Cannot write a value of shape " + Arrays.toString(tensor.shape())
                    + " at the index into key \"" + key + "\" of shape " + Arrays.toString(leaf.shape()), e);
            }
            return;
        }
        super.rawSetAt(key, value, index);
    }

    /**
     * Store a value without validation; the caller guarantees the batch prefix.
     */
    void putEntry(String key, Object value) {
        entries.put(key, value);
    }

    private Object prepare(String key, Object value) {
        if (value instanceof Tensor tensor) {
            Invariants.checkPrefix(key, tensor.shape(), batchSize);
            return Invariants.reconcileDevice(tensor, device);
        }
        TensorDictBase nested = (TensorDictBase) value;
        Invariants.checkPrefix(key, nested.batchSize(), batchSize);
        nested = Invariants.reconcileDevice(nested, device);
        reconcileNames(nested);
        return nested;
    }

    private void reconcileNames(TensorDictBase nested) {
        if (batchSize.length == 0) {
            return;
        }
        if (Invariants.isUnnamed(names)) {
            List<String> leading = nested.names().subList(0, batchSize.length);
            if (!Invariants.isUnnamed(leading)) {
                names = Invariants.checkNames(leading, batchSize.length);
            }
        } else if (!Invariants.sameNames(names, nested.names().subList(0, batchSize.length))) {
            nested.adoptLeadingNames(names);
        }
    }

    private void writeInPlace(String key, Object existing, Object value) {
        if (existing instanceof Tensor leaf) {
            if (!(value instanceof Tensor tensor)) {
                throw new TypeMismatchException("Cannot write a TensorDictBase in place of the Tensor at key \"" + key + "\"");
            }
            try {
                leaf.copyFrom(tensor);
            } catch (IllegalArgumentException e) {
                throw new ShapeMismatchException("Cannot write a value of shape " + Arrays.toString(tensor.shape())
                    + " in place of key \"" + key + "\" of shape " + Arrays.toString(leaf.shape()), e);
            }
            return;
        }
        if (!(value instanceof TensorDictBase source)) {
            throw new TypeMismatchException("Cannot write a Tensor in place of the TensorDictBase at key \"" + key + "\"");
        }
        ((TensorDictBase) existing).updateInPlace(source);
    }

    // ==================== Lock Graph ====================

    @Override
    public boolean isLocked() {
        return node.isLocked();
    }

    @Override
    public Set<Long> lockOwners() {
        return node.owners();
    }

    @Override
    public TensorDict lock() {
        if (isLocked()) {
            return this;
        }
        LockGraph.atomically(() -> {
            propagateLock(Set.of());
        });
        LOG.fine(() -> "Locked TensorDict " + node.id() + " with keys " + entries.keySet());
        return this;
    }

    @Override
    public TensorDict unlock() {
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
        Set<Long> childIds = node.withSelf(ids);
        for (Object value : entries.values()) {
            if (value instanceof TensorDictBase nested) {
                LockNode child = nested.propagateLock(childIds);
                if (child != null) {
                    node.addLockedChild(child);
                }
            }
        }
        return node;
    }

    @Override
    void propagateUnlock(Set<Long> ids, List<LockNode> visited) {
        node.removeOwners(ids);
        node.setLocked(false);
        node.clearLockedChildren();
        node.bumpGeneration();
        cache.clear();
        visited.add(node);
        ids.add(node.id());
        for (Object value : entries.values()) {
            if (value instanceof TensorDictBase nested) {
                nested.propagateUnlock(ids, visited);
            }
        }
    }

    @Override
    long cacheStamp() {
        return node.generation();
    }

    LockNode lockNode() {
        return node;
    }

    // ==================== Memmap ====================

    @Override
    public Path memmapPrefix() {
        return memmapPrefix;
    }

    @Override
    public boolean isMemmap() {
        if (memmapPrefix == null) {
            return false;
        }
        for (Object value : entries.values()) {
            boolean mapped = value instanceof Tensor leaf ? leaf.isMapped() : ((TensorDictBase) value).isMemmap();
            if (!mapped) {
                return false;
            }
        }
        return true;
    }

    @Override
    public TensorDict memmap(Path prefix, boolean copyExisting) {
        Path target;
        if (prefix != null) {
            target = prefix.toAbsolutePath().normalize();
        } else if (memmapPrefix != null) {
            target = memmapPrefix;
        } else {
            target = createTempPrefix();
        }
        if (memmapPrefix != null && isMemmap()) {
            if (memmapPrefix.equals(target)) {
                return this;
            }
            if (!copyExisting) {
                throw TensorDictException.memmapLocation(memmapPrefix, target);
            }
        }
        for (NestedKey key : keys(true, false)) {
            key.atoms().forEach(MemmapPersistence::checkFileKey);
        }
        try {
            writeMemmap(target, copyExisting);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to memmap TensorDict to " + target, e);
        }
        lock();
        return this;
    }

    private void writeMemmap(Path dir, boolean copyExisting) throws IOException {
        LOG.fine(() -> "Writing memmap TensorDict to " + dir);
        MemmapMetadata.Builder meta = MemmapMetadata.builder(batchSize, MemmapPersistence.deviceString(device), names);
        for (Map.Entry<String, Object> entry : entries.entrySet()) {
            String key = entry.getKey();
            if (entry.getValue() instanceof Tensor leaf) {
                Tensor mapped = MemmapPersistence.writeLeaf(dir, key, leaf);
                entry.setValue(mapped);
                meta.tensor(key, leaf.shape(), leaf.dtype().toNpyDtype(), MemmapPersistence.deviceString(leaf.device()));
            } else {
                TensorDictBase nested = (TensorDictBase) entry.getValue();
                TensorDictBase mapped = nested.memmap(MemmapPersistence.nestedPath(dir, key), copyExisting);
                entry.setValue(mapped);
                meta.nested(key, mapped instanceof LazyStackedTensorDict
                    ? MemmapMetadata.LAZY_STACKED : MemmapMetadata.TENSORDICT);
            }
        }
        MemmapPersistence.writeMetadata(dir, meta.build());
        memmapPrefix = dir;
    }

    static Path createTempPrefix() {
        Path parent = TensorDictConfig.global().memmapTempDir();
        try {
            Files.createDirectories(parent);
            return Files.createTempDirectory(parent, "tensordict-").toAbsolutePath().normalize();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create a memmap directory under " + parent, e);
        }
    }

    /**
     * Rebuild a memmapped container from its directory. Leaves are mapped, not read.
     */
    static TensorDict loadMemmap(Path dir, MemmapMetadata meta) throws IOException {
        Path prefix = dir.toAbsolutePath().normalize();
        TensorDict td = new TensorDict(new LinkedHashMap<>(), meta.batchSize(),
            MemmapPersistence.parseDevice(meta.device()), meta.names());
        for (Map.Entry<String, MemmapMetadata.Entry> entry : meta.entries().entrySet()) {
            String key = entry.getKey();
            MemmapMetadata.Entry info = entry.getValue();
            if (info.isTensor()) {
                td.putEntry(key, MemmapPersistence.mapLeaf(prefix, key, MemmapPersistence.parseDevice(info.device())));
            } else {
                td.putEntry(key, TensorDicts.loadMemmap(MemmapPersistence.nestedPath(prefix, key)));
            }
        }
        td.memmapPrefix = prefix;
        td.lock();
        LOG.fine(() -> "Loaded memmap TensorDict from " + prefix);
        return td;
    }
}
