package io.surfworks.tensordict;

import io.surfworks.tensordict.lock.LockNode;
import io.surfworks.tensordict.memmap.MemmapMetadata;
import io.surfworks.tensordict.memmap.MemmapPersistence;
import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.Tensor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Container backed by a directory in the memmap layout.
 *
 * <p>The directory is the source of truth: leaves are mapped from their {@code .npy} files on
 * first access, new entries and metadata are written immediately, and in-place writes go
 * straight to the mapped files. Directories written by {@code memmap} can be opened, and
 * directories written here can be read back with {@link TensorDicts#loadMemmap(Path)}.
 *
 * <p>The store has no lock state and cannot be restricted with {@code select}/{@code exclude}.
 */
public final class PersistentTensorDict extends TensorDictBase {

    private static final Logger LOG = Logger.getLogger(PersistentTensorDict.class.getName());

    private final Path directory;
    private int[] batchSize;
    private final Device device;
    private List<String> names;
    private final Map<String, MemmapMetadata.Entry> entries;
    // leaves and nested stores opened so far
    private final Map<String, Object> opened = new HashMap<>();

    private PersistentTensorDict(Path directory, MemmapMetadata meta) {
        this.directory = directory.toAbsolutePath().normalize();
        this.batchSize = meta.batchSize();
        this.device = MemmapPersistence.parseDevice(meta.device());
        this.names = Invariants.checkNames(meta.names(), batchSize.length);
        this.entries = new LinkedHashMap<>(meta.entries());
    }

    /**
     * Open an existing store.
     *
     * @throws IOException if the directory has no container metadata
     */
    public static PersistentTensorDict open(Path directory) throws IOException {
        MemmapMetadata meta = MemmapPersistence.readMetadata(directory);
        if (meta.isStack()) {
            throw new IOException(directory + " holds a LazyStackedTensorDict; load it with TensorDicts.loadMemmap");
        }
        return new PersistentTensorDict(directory, meta);
    }

    public static PersistentTensorDict create(Path directory, int... batchSize) throws IOException {
        return create(directory, batchSize, null);
    }

    /**
     * Create an empty store.
     *
     * @throws IOException if the directory already holds a store
     */
    public static PersistentTensorDict create(Path directory, int[] batchSize, Device device) throws IOException {
        if (MemmapPersistence.hasMetadata(directory)) {
            throw new IOException("A tensordict store already exists at " + directory);
        }
        MemmapMetadata meta = MemmapMetadata.builder(batchSize, MemmapPersistence.deviceString(device),
            Invariants.unnamed(batchSize.length)).build();
        MemmapPersistence.writeMetadata(directory, meta);
        LOG.fine(() -> "Created tensordict store at " + directory);
        return new PersistentTensorDict(directory, meta);
    }

    /**
     * Write the contents of a container to a new store.
     */
    public static PersistentTensorDict fromTensorDict(TensorDictBase source, Path directory) throws IOException {
        PersistentTensorDict store = create(directory, source.batchSize(), source.device());
        for (String key : source.keys()) {
            store.set(key, source.getEntry(NestedKey.of(key)));
        }
        store.setNames(source.names());
        return store;
    }

    public Path directory() {
        return directory;
    }

    // ==================== Shape, Device, Names ====================

    @Override
    public int[] batchSize() {
        return batchSize.clone();
    }

    @Override
    public Device device() {
        return device;
    }

    @Override
    public List<String> names() {
        return names;
    }

    @Override
    public PersistentTensorDict setNames(List<String> names) {
        this.names = Invariants.checkNames(names, batchSize.length);
        for (String key : entries.keySet()) {
            if (holdsContainer(key)) {
                ((TensorDictBase) rawGet(key)).adoptLeadingNames(this.names);
            }
        }
        writeMetadata();
        return this;
    }

    @Override
    void adoptLeadingNames(List<String> parentNames) {
        setNames(Invariants.withLeading(names, parentNames));
    }

    @Override
    public PersistentTensorDict setBatchSize(int... newSize) {
        for (Map.Entry<String, MemmapMetadata.Entry> entry : entries.entrySet()) {
            String key = entry.getKey();
            int[] shape = entry.getValue().isTensor() ? entry.getValue().shape() : ((TensorDictBase) rawGet(key)).batchSize();
            Invariants.checkPrefix(key, shape, newSize);
        }
        batchSize = newSize.clone();
        names = Invariants.resize(names, newSize.length);
        writeMetadata();
        return this;
    }

    // ==================== Entries ====================

    @Override
    List<String> rootKeys() {
        return new ArrayList<>(entries.keySet());
    }

    @Override
    boolean holdsContainer(String key) {
        MemmapMetadata.Entry entry = entries.get(key);
        return entry != null && !entry.isTensor();
    }

    @Override
    Object rawGet(String key) {
        MemmapMetadata.Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        Object value = opened.get(key);
        if (value == null) {
            try {
                value = entry.isTensor()
                    ? MemmapPersistence.mapLeaf(directory, key, MemmapPersistence.parseDevice(entry.device()))
                    : open(MemmapPersistence.nestedPath(directory, key));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to open entry \"" + key + "\" of " + directory, e);
            }
            opened.put(key, value);
        }
        return value;
    }

    @Override
    void rawSet(String key, Object value, boolean inplace) {
        NestedKey.checkAtom(key);
        boolean present = entries.containsKey(key);
        if (inplace && present) {
            writeInPlace(key, value);
            return;
        }
        Invariants.checkPrefix(key, Invariants.shapeOf(value), batchSize);
        try {
            if (present) {
                removeFiles(key);
            }
            if (value instanceof Tensor tensor) {
                Tensor leaf = Invariants.reconcileDevice(tensor, device);
                opened.put(key, MemmapPersistence.writeLeaf(directory, key, leaf));
                entries.put(key, MemmapMetadata.Entry.tensor(leaf.shape(), leaf.dtype().toNpyDtype(),
                    MemmapPersistence.deviceString(leaf.device())));
            } else {
                TensorDictBase nested = Invariants.reconcileDevice((TensorDictBase) value, device);
                PersistentTensorDict child = fromTensorDict(nested, MemmapPersistence.nestedPath(directory, key));
                if (!Invariants.isUnnamed(names)) {
                    child.adoptLeadingNames(names);
                }
                opened.put(key, child);
                entries.put(key, MemmapMetadata.Entry.nested(MemmapMetadata.TENSORDICT));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write entry \"" + key + "\" to " + directory, e);
        }
        writeMetadata();
        LOG.fine(() -> "Wrote entry \"" + key + "\" to tensordict store " + directory);
    }

    private void writeInPlace(String key, Object value) {
        Object existing = rawGet(key);
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

    @Override
    void rawDelete(String key) {
        if (!entries.containsKey(key)) {
            throw KeyMissingException.notFound(NestedKey.of(key), entries.keySet());
        }
        try {
            removeFiles(key);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete entry \"" + key + "\" from " + directory, e);
        }
        entries.remove(key);
        opened.remove(key);
        writeMetadata();
    }

    private void removeFiles(String key) throws IOException {
        if (entries.get(key).isTensor()) {
            Files.deleteIfExists(MemmapPersistence.leafPath(directory, key));
            return;
        }
        Path nested = MemmapPersistence.nestedPath(directory, key);
        if (!Files.exists(nested)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(nested)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.delete(path);
        }
    }

    private void writeMetadata() {
        MemmapMetadata meta = new MemmapMetadata(MemmapMetadata.TENSORDICT, batchSize,
            MemmapPersistence.deviceString(device), names, entries, -1, 0);
        try {
            MemmapPersistence.writeMetadata(directory, meta);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write metadata of " + directory, e);
        }
    }

    // ==================== Unsupported ====================

    @Override
    public TensorDictBase select(boolean strict, boolean inplace, NestedKey... keys) {
        throw new UnsupportedOnProxyException(
            "Cannot select keys of a PersistentTensorDict. Call toTensorDict() first.");
    }

    @Override
    public TensorDictBase exclude(boolean inplace, NestedKey... keys) {
        throw new UnsupportedOnProxyException(
            "Cannot exclude keys of a PersistentTensorDict. Call toTensorDict() first.");
    }

    @Override
    public boolean isLocked() {
        return false;
    }

    @Override
    public Set<Long> lockOwners() {
        return Set.of();
    }

    @Override
    public TensorDictBase lock() {
        throw new UnsupportedOnProxyException("Cannot lock a PersistentTensorDict.");
    }

    @Override
    public TensorDictBase unlock() {
        throw new UnsupportedOnProxyException("Cannot unlock a PersistentTensorDict.");
    }

    @Override
    LockNode propagateLock(Set<Long> ids) {
        return null;
    }

    @Override
    void propagateUnlock(Set<Long> ids, List<LockNode> visited) {
    }

    @Override
    long cacheStamp() {
        return 0;
    }

    @Override
    public TensorDictBase memmap(Path prefix, boolean copyExisting) {
        throw new UnsupportedOnProxyException(
            "Cannot build a memmap TensorDict in-place. Call toTensorDict().memmap(prefix) instead.");
    }

    @Override
    public Path memmapPrefix() {
        return directory;
    }

    @Override
    public boolean isMemmap() {
        return true;
    }

    @Override
    public String toString() {
        return "PersistentTensorDict(directory=" + directory + ", keys=" + entries.keySet()
            + ", batchSize=" + Arrays.toString(batchSize) + ")";
    }
}
