package io.surfworks.tensordict;

import io.surfworks.tensordict.config.TensorDictConfig;
import io.surfworks.tensordict.lock.EnumerationCache;
import io.surfworks.tensordict.lock.LockNode;
import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.Index;
import io.surfworks.tensordict.tensor.Indexer;
import io.surfworks.tensordict.tensor.ScalarType;
import io.surfworks.tensordict.tensor.Tensor;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A tree of tensor leaves under string keys, all sharing a leading batch shape.
 *
 * <p>Variants differ in where entries live: {@link TensorDict} stores them, the
 * {@link TransformedTensorDict} family and {@link SubTensorDict} derive them from a source,
 * {@link LazyStackedTensorDict} derives them from a list of children and
 * {@link PersistentTensorDict} reads them from disk. Each variant implements a small
 * entry-level core; every operation below is written against that core.
 *
 * <p>Values accepted by {@code set}: a {@link Tensor}, a {@code TensorDictBase}, a nested
 * {@link Map} (converted with this container's batch size), a {@link Number} (a 0-d tensor)
 * or a primitive array (a 1-d tensor).
 */
public abstract sealed class TensorDictBase
        permits TensorDict, TransformedTensorDict, SubTensorDict, LazyStackedTensorDict, PersistentTensorDict {

    final EnumerationCache cache = new EnumerationCache();

    TensorDictBase() {
    }

    // ==================== Variant Core ====================

    public abstract int[] batchSize();

    public int batchDims() {
        return batchSize().length;
    }

    /**
     * Device shared by every leaf, or null when leaves may live on different devices.
     */
    public abstract Device device();

    /**
     * Dimension names, one per batch dimension; unnamed dimensions are null.
     */
    public abstract List<String> names();

    public abstract TensorDictBase setNames(List<String> names);

    public TensorDictBase setNames(String... names) {
        return setNames(Arrays.asList(names));
    }

    /**
     * Assign a new batch size. Every entry must keep it as a prefix.
     *
     * @throws ShapeMismatchException       if an entry does not start with the new size
     * @throws BatchSizeImmutableException  on containers whose batch size is derived
     */
    public abstract TensorDictBase setBatchSize(int... batchSize);

    /** Top-level keys in insertion order. */
    abstract List<String> rootKeys();

    /** Tensor, TensorDictBase, or null when absent. */
    abstract Object rawGet(String key);

    /** Store an already converted value under a top-level key. */
    abstract void rawSet(String key, Object value, boolean inplace);

    abstract void rawDelete(String key);

    /**
     * Whether a top-level key holds a nested container, without materializing it.
     */
    boolean holdsContainer(String key) {
        return rawGet(key) instanceof TensorDictBase;
    }

    // ==================== Lock Graph ====================

    public abstract boolean isLocked();

    /**
     * Ids of the ancestors currently holding this container locked.
     */
    public abstract Set<Long> lockOwners();

    /**
     * Lock this container and everything reachable from it against structural mutation.
     */
    public abstract TensorDictBase lock();

    /**
     * @throws LockedMutationException if another locked ancestor still owns part of the graph
     */
    public abstract TensorDictBase unlock();

    /**
     * Withdraw this container's lock contributions, as when it is garbage collected.
     */
    public void release() {
    }

    /**
     * Add {@code ids} to this container's owners and lock its children.
     *
     * @return the node that recorded the lock, or null if this variant does not take part
     */
    abstract LockNode propagateLock(Set<Long> ids);

    /**
     * Remove {@code ids} from this container's owners and unlock its children.
     *
     * @param ids     mutable; every visited node adds its own id, so a container reachable
     *                through several parents loses all of them as owners
     * @param visited collects the nodes that were unlocked
     */
    abstract void propagateUnlock(Set<Long> ids, List<LockNode> visited);

    /**
     * Changes whenever a lock node this container depends on is unlocked.
     */
    abstract long cacheStamp();

    /**
     * Lock for the duration of a try-with-resources block.
     */
    public LockScope lockScope() {
        boolean wasLocked = isLocked();
        lock();
        return new LockScope(() -> {
            if (!wasLocked) {
                unlock();
            }
        });
    }

    public LockScope unlockScope() {
        boolean wasLocked = isLocked();
        unlock();
        return new LockScope(() -> {
            if (wasLocked) {
                lock();
            }
        });
    }

    /**
     * Number of memoized enumerations; always 0 once the container was unlocked.
     */
    public int cacheSize() {
        return cache.size(cacheStamp());
    }

    void checkUnlocked() {
        if (isLocked()) {
            throw LockedMutationException.locked();
        }
    }

    // ==================== Keys ====================

    /**
     * Top-level keys in insertion order.
     */
    public List<String> keys() {
        if (!isLocked()) {
            return Collections.unmodifiableList(new ArrayList<>(rootKeys()));
        }
        return cache.computeIfAbsent("keys", cacheStamp(), () -> List.copyOf(rootKeys()));
    }

    /**
     * Key paths in depth-first order.
     *
     * @param includeNested descend into nested containers
     * @param leavesOnly    omit the paths of nested containers themselves
     */
    public List<NestedKey> keys(boolean includeNested, boolean leavesOnly) {
        if (!isLocked()) {
            return collectKeys(includeNested, leavesOnly);
        }
        return cache.computeIfAbsent("keys:" + includeNested + ":" + leavesOnly, cacheStamp(),
            () -> collectKeys(includeNested, leavesOnly));
    }

    public List<String> sortedKeys() {
        if (!isLocked()) {
            return sorted();
        }
        return cache.computeIfAbsent("sortedKeys", cacheStamp(), this::sorted);
    }

    private List<String> sorted() {
        List<String> result = new ArrayList<>(rootKeys());
        Collections.sort(result);
        return Collections.unmodifiableList(result);
    }

    private List<NestedKey> collectKeys(boolean includeNested, boolean leavesOnly) {
        List<NestedKey> result = new ArrayList<>();
        collectKeys(null, includeNested, leavesOnly, result);
        return Collections.unmodifiableList(result);
    }

    private void collectKeys(NestedKey prefix, boolean includeNested, boolean leavesOnly, List<NestedKey> out) {
        for (String key : rootKeys()) {
            NestedKey path = prefix == null ? NestedKey.of(key) : prefix.append(key);
            boolean nested = holdsContainer(key);
            if (!nested || !leavesOnly) {
                out.add(path);
            }
            if (nested && includeNested) {
                ((TensorDictBase) rawGet(key)).collectKeys(path, true, leavesOnly, out);
            }
        }
    }

    /**
     * Top-level values: tensors and nested containers.
     */
    public List<Object> values() {
        if (!isLocked() || !cachesValues()) {
            return collectValues();
        }
        return cache.computeIfAbsent("values", cacheStamp(), this::collectValues);
    }

    public List<Object> values(boolean includeNested, boolean leavesOnly) {
        if (!isLocked() || !cachesValues()) {
            return List.copyOf(collectItems(includeNested, leavesOnly).values());
        }
        return cache.computeIfAbsent("values:" + includeNested + ":" + leavesOnly, cacheStamp(),
            () -> List.copyOf(collectItems(includeNested, leavesOnly).values()));
    }

    public Map<NestedKey, Object> items(boolean includeNested, boolean leavesOnly) {
        if (!isLocked() || !cachesValues()) {
            return collectItems(includeNested, leavesOnly);
        }
        return cache.computeIfAbsent("items:" + includeNested + ":" + leavesOnly, cacheStamp(),
            () -> collectItems(includeNested, leavesOnly));
    }

    /**
     * Whether enumerated values are the stored entries themselves. Containers that assemble
     * a fresh value on every read must not memoize them.
     */
    boolean cachesValues() {
        return true;
    }

    private List<Object> collectValues() {
        List<Object> result = new ArrayList<>();
        for (String key : keys()) {
            result.add(rawGet(key));
        }
        return Collections.unmodifiableList(result);
    }

    private Map<NestedKey, Object> collectItems(boolean includeNested, boolean leavesOnly) {
        Map<NestedKey, Object> result = new LinkedHashMap<>();
        for (NestedKey key : keys(includeNested, leavesOnly)) {
            result.put(key, getEntry(key));
        }
        return Collections.unmodifiableMap(result);
    }

    public boolean containsKey(String... key) {
        return containsKey(NestedKey.of(key));
    }

    public boolean containsKey(NestedKey key) {
        TensorDictBase td = this;
        List<String> atoms = key.atoms();
        for (int i = 0; i < atoms.size() - 1; i++) {
            String atom = atoms.get(i);
            if (!td.rootKeys().contains(atom) || !td.holdsContainer(atom)) {
                return false;
            }
            td = (TensorDictBase) td.rawGet(atom);
        }
        return td.rootKeys().contains(key.last());
    }

    // ==================== Get ====================

    /**
     * The leaf at a key path.
     *
     * @throws KeyMissingException  if the path is absent
     * @throws TypeMismatchException if the path holds a nested container
     */
    public Tensor get(String... key) {
        return get(NestedKey.of(key));
    }

    public Tensor get(NestedKey key) {
        Object value = getEntry(key);
        if (value instanceof Tensor tensor) {
            return tensor;
        }
        throw new TypeMismatchException(
            "Expected a Tensor at key " + key + " but found a nested TensorDictBase. Use getTensorDict() instead.");
    }

    public TensorDictBase getTensorDict(String... key) {
        return getTensorDict(NestedKey.of(key));
    }

    public TensorDictBase getTensorDict(NestedKey key) {
        Object value = getEntry(key);
        if (value instanceof TensorDictBase nested) {
            return nested;
        }
        throw new TypeMismatchException("Expected a TensorDictBase at key " + key + " but found a Tensor.");
    }

    /**
     * The tensor or nested container at a key path.
     */
    public Object getEntry(NestedKey key) {
        TensorDictBase parent = walk(key);
        Object value = parent.rawGet(key.last());
        if (value == null) {
            throw KeyMissingException.notFound(key, parent.keys());
        }
        return value;
    }

    public Object getOrDefault(NestedKey key, Object defaultValue) {
        Object value = find(key);
        return value != null ? value : defaultValue;
    }

    /**
     * The container holding the last atom of {@code key}; every intermediate must exist.
     */
    private TensorDictBase walk(NestedKey key) {
        TensorDictBase td = this;
        List<String> atoms = key.atoms();
        for (int i = 0; i < atoms.size() - 1; i++) {
            Object value = td.rawGet(atoms.get(i));
            if (value == null) {
                throw KeyMissingException.notFound(key, td.keys());
            }
            if (!(value instanceof TensorDictBase nested)) {
                throw new TypeMismatchException(
                    "Expected a TensorDictBase instance at \"" + atoms.get(i) + "\" while looking up " + key
                    + ", got a Tensor");
            }
            td = nested;
        }
        return td;
    }

    /**
     * Like {@link #getEntry} but returns null for an absent path.
     */
    Object find(NestedKey key) {
        TensorDictBase td = this;
        List<String> atoms = key.atoms();
        for (int i = 0; i < atoms.size() - 1; i++) {
            Object value = td.rawGet(atoms.get(i));
            if (!(value instanceof TensorDictBase nested)) {
                return null;
            }
            td = nested;
        }
        return td.rawGet(key.last());
    }

    // ==================== Set ====================

    public TensorDictBase set(String key, Object value) {
        return set(NestedKey.of(key), value, false);
    }

    public TensorDictBase set(NestedKey key, Object value) {
        return set(key, value, false);
    }

    /**
     * Store a value, creating intermediate containers along the path.
     *
     * @param inplace write into the existing entry's storage when the key is present
     * @throws ShapeMismatchException  if the value does not start with the batch size
     * @throws LockedMutationException if the write is structural and this container is locked
     */
    public TensorDictBase set(NestedKey key, Object value, boolean inplace) {
        Objects.requireNonNull(value, "value cannot be null");
        TensorDictBase target = this;
        // first container created along the path, removed again if the write fails
        TensorDictBase createdIn = null;
        String createdAtom = null;
        for (String atom : key.atoms().subList(0, key.size() - 1)) {
            if (createdIn == null && target.rawGet(atom) == null) {
                createdIn = target;
                createdAtom = atom;
            }
            target = target.nestedForWrite(atom);
        }
        try {
            target.rawSet(key.last(), target.convert(key.last(), value), inplace);
        } catch (RuntimeException e) {
            if (createdIn != null) {
                rollbackCreated(createdIn, createdAtom, e);
            }
            throw e;
        }
        return this;
    }

    private static void rollbackCreated(TensorDictBase parent, String atom, RuntimeException cause) {
        try {
            parent.rawDelete(atom);
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Write into an existing entry; allowed while locked.
     *
     * @throws KeyMissingException if the key is absent
     */
    public TensorDictBase setInPlace(String key, Object value) {
        return setInPlace(NestedKey.of(key), value);
    }

    public TensorDictBase setInPlace(NestedKey key, Object value) {
        if (!containsKey(key)) {
            // lazy stacks discover keys on read
            getEntry(key);
        }
        return set(key, value, true);
    }

    /**
     * Write {@code value} into the elements of an existing entry selected by {@code index}.
     */
    public TensorDictBase setAt(String key, Object value, Index... index) {
        return setAt(NestedKey.of(key), value, index);
    }

    public TensorDictBase setAt(NestedKey key, Object value, Index... index) {
        TensorDictBase parent = walk(key);
        Index[] expanded = parent.expandIndex(index);
        parent.rawSetAt(key.last(), parent.convertAt(value), expanded);
        return this;
    }

    /**
     * Write a container (or map) into the sub-batch selected by {@code index}: {@code td[index] = value}.
     * Keys missing here are created zero-filled first.
     */
    public TensorDictBase setIndex(Index[] index, Object value) {
        Index[] expanded = expandIndex(index);
        int[] target = Indexer.resultShape(batchSize(), expanded);
        TensorDictBase source = asContainer(value, target);
        for (String key : source.keys()) {
            Object part = source.rawGet(key);
            if (find(NestedKey.of(key)) == null) {
                set(key, zerosFor(part, source.batchDims(), batchSize(), device()));
            }
            rawSetAt(key, part, expanded);
        }
        return this;
    }

    public TensorDictBase updateAt(Object other, Index... index) {
        return setIndex(index, other);
    }

    /**
     * Default scatter: read the entry, write the selection, store it back in place.
     * Variants whose reads alias storage write directly instead.
     */
    void rawSetAt(String key, Object value, Index[] index) {
        Object existing = rawGet(key);
        if (existing == null) {
            throw KeyMissingException.notFound(NestedKey.of(key), keys());
        }
        if (existing instanceof TensorDictBase nested) {
            nested.setIndex(index, value);
            return;
        }
        if (!(value instanceof Tensor tensor)) {
            throw new TypeMismatchException("Cannot write a TensorDictBase into the Tensor at key \"" + key + "\"");
        }
        Tensor updated = ((Tensor) existing).copy();
        try {
            updated.indexPut(index, tensor);
        } catch (IllegalArgumentException e) {
            throw new ShapeMismatchException("Cannot write a value of shape " + Arrays.toString(tensor.shape())
                + " at the index into key \"" + key + "\"", e);
        }
        rawSet(key, updated, true);
    }

    public TensorDictBase delete(String... key) {
        return delete(NestedKey.of(key));
    }

    public TensorDictBase delete(NestedKey key) {
        TensorDictBase parent = walk(key);
        if (parent.rawGet(key.last()) == null) {
            throw KeyMissingException.notFound(key, parent.keys());
        }
        parent.rawDelete(key.last());
        return this;
    }

    /**
     * Remove and return an entry.
     */
    public Object pop(String key) {
        return pop(NestedKey.of(key));
    }

    public Object pop(NestedKey key) {
        Object value = find(key);
        if (value == null) {
            throw new KeyMissingException(
                "You are trying to pop key `" + key + "` which is not in dict without providing default value.", key);
        }
        delete(key);
        return value;
    }

    public Object pop(NestedKey key, Object defaultValue) {
        Object value = find(key);
        if (value == null) {
            return defaultValue;
        }
        delete(key);
        return value;
    }

    /**
     * Return the entry at {@code key}, storing {@code value} there first if absent.
     */
    public Object setDefault(NestedKey key, Object value) {
        if (find(key) == null) {
            set(key, value);
        }
        return getEntry(key);
    }

    /**
     * Create an empty nested container with this container's batch size and device.
     */
    public TensorDictBase createNested(String... key) {
        return createNested(NestedKey.of(key));
    }

    public TensorDictBase createNested(NestedKey key) {
        TensorDictBase target = this;
        for (String atom : key.atoms().subList(0, key.size() - 1)) {
            target = target.nestedForWrite(atom);
        }
        target.rawSet(key.last(), target.emptyLike(), false);
        return this;
    }

    public TensorDictBase renameKey(String oldKey, String newKey) {
        return renameKey(NestedKey.of(oldKey), NestedKey.of(newKey), false);
    }

    /**
     * @param safe refuse to overwrite an existing entry at {@code newKey}
     */
    public TensorDictBase renameKey(NestedKey oldKey, NestedKey newKey, boolean safe) {
        checkUnlocked();
        if (safe && find(newKey) != null) {
            throw new KeyCollisionException("key \"" + newKey + "\" already present in TensorDict.");
        }
        Object value = getEntry(oldKey);
        set(newKey, value);
        delete(oldKey);
        return this;
    }

    /**
     * Set every entry of {@code other} here, merging nested containers.
     */
    public TensorDictBase update(Object other) {
        return update(other, false);
    }

    public TensorDictBase update(Object other, boolean inplace) {
        TensorDictBase source = asContainer(other, batchSize());
        for (String key : source.keys()) {
            Object value = source.rawGet(key);
            Object mine = find(NestedKey.of(key));
            if (value instanceof TensorDictBase nested && mine instanceof TensorDictBase target) {
                target.update(nested, inplace);
            } else {
                set(NestedKey.of(key), value, inplace);
            }
        }
        return this;
    }

    /**
     * Write every entry of {@code other} into the existing entries here.
     *
     * @throws KeyMissingException if {@code other} has a key this container lacks
     */
    public TensorDictBase updateInPlace(Object other) {
        TensorDictBase source = asContainer(other, batchSize());
        for (String key : source.keys()) {
            Object value = source.rawGet(key);
            Object mine = getEntry(NestedKey.of(key));
            if (value instanceof TensorDictBase nested && mine instanceof TensorDictBase target) {
                target.updateInPlace(nested);
            } else {
                setInPlace(NestedKey.of(key), value);
            }
        }
        return this;
    }

    private TensorDictBase nestedForWrite(String atom) {
        Object existing = rawGet(atom);
        if (existing == null) {
            rawSet(atom, emptyLike(), false);
            existing = rawGet(atom);
        }
        if (!(existing instanceof TensorDictBase nested)) {
            throw new TypeMismatchException("Expected a TensorDictBase instance at \"" + atom + "\", got a Tensor");
        }
        return nested;
    }

    Object convert(String key, Object value) {
        if (value instanceof Tensor || value instanceof TensorDictBase) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            return new TensorDict(map, batchSize(), device());
        }
        if (value instanceof Boolean flag) {
            return Tensor.scalar(flag ? 1 : 0, ScalarType.BOOL);
        }
        if (value instanceof Double || value instanceof Float) {
            return Tensor.scalar(((Number) value).doubleValue(), ScalarType.F32);
        }
        if (value instanceof Number number) {
            return Tensor.scalar(number.longValue(), ScalarType.I64);
        }
        if (value instanceof float[] data) {
            return Tensor.fromFloatArray(data, data.length);
        }
        if (value instanceof double[] data) {
            return Tensor.fromDoubleArray(data, data.length);
        }
        if (value instanceof int[] data) {
            return Tensor.fromIntArray(data, data.length);
        }
        if (value instanceof long[] data) {
            return Tensor.fromLongArray(data, data.length);
        }
        if (value instanceof boolean[] data) {
            return Tensor.fromBooleanArray(data, data.length);
        }
        throw new TypeMismatchException(
            "Unsupported value type " + value.getClass().getName() + " for key \"" + key + "\"");
    }

    private Object convertAt(Object value) {
        if (value instanceof Number number) {
            return Tensor.scalar(number.doubleValue(), ScalarType.F64);
        }
        if (value instanceof Map<?, ?> map) {
            return new TensorDict(map, new int[0], device());
        }
        return convert("<index>", value);
    }

    private TensorDictBase asContainer(Object value, int[] batchSize) {
        if (value instanceof TensorDictBase td) {
            return td;
        }
        if (value instanceof Map<?, ?> map) {
            return new TensorDict(map, batchSize, device());
        }
        throw new TypeMismatchException("Expected a TensorDictBase or a Map, got "
            + (value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Zero-filled counterpart of {@code value} whose first {@code valueBatchDims} dims are replaced by {@code batch}.
     */
    static Object zerosFor(Object value, int valueBatchDims, int[] batch, Device device) {
        if (value instanceof Tensor tensor) {
            int[] shape = Invariants.concat(batch, Invariants.trailing(tensor.shape(), valueBatchDims));
            return Tensor.zeros(tensor.dtype(), device != null ? device : tensor.device(), shape);
        }
        TensorDictBase nested = (TensorDictBase) value;
        int[] nestedBatch = Invariants.concat(batch, Invariants.trailing(nested.batchSize(), valueBatchDims));
        TensorDict result = new TensorDict(new LinkedHashMap<>(), nestedBatch, device);
        for (String key : nested.keys()) {
            result.putEntry(key, zerosFor(nested.rawGet(key), valueBatchDims, batch, device));
        }
        return result;
    }

    // ==================== Select / Exclude ====================

    public TensorDictBase select(String... keys) {
        return select(true, false, toKeys(keys));
    }

    public TensorDictBase select(NestedKey... keys) {
        return select(true, false, keys);
    }

    /**
     * Keep only the given key paths.
     *
     * @param strict  fail on a missing key instead of skipping it
     * @param inplace modify this container instead of returning a new one
     */
    public TensorDictBase select(boolean strict, boolean inplace, NestedKey... keys) {
        TensorDict result = emptyLike();
        Set<TensorDict> created = Collections.newSetFromMap(new IdentityHashMap<>());
        created.add(result);
        for (NestedKey key : keys) {
            if (find(key) == null) {
                if (strict) {
                    throw KeyMissingException.notFound(key, keys());
                }
                continue;
            }
            copyPath(result, this, key, created);
        }
        if (!inplace) {
            return result;
        }
        checkUnlocked();
        replaceContents(result);
        return this;
    }

    private static void copyPath(TensorDict dst, TensorDictBase src, NestedKey key, Set<TensorDict> created) {
        String first = key.first();
        if (!key.isNested()) {
            dst.putEntry(first, src.rawGet(first));
            return;
        }
        Object existing = dst.rawGet(first);
        TensorDictBase child = (TensorDictBase) src.rawGet(first);
        if (existing instanceof TensorDict target && created.contains(target)) {
            copyPath(target, child, key.rest(), created);
        } else if (existing == null) {
            TensorDict target = child.emptyLike();
            created.add(target);
            dst.putEntry(first, target);
            copyPath(target, child, key.rest(), created);
        }
        // otherwise the whole nested container was already selected
    }

    public TensorDictBase exclude(String... keys) {
        return exclude(false, toKeys(keys));
    }

    public TensorDictBase exclude(NestedKey... keys) {
        return exclude(false, keys);
    }

    public TensorDictBase exclude(boolean inplace, NestedKey... keys) {
        if (inplace) {
            checkUnlocked();
            for (NestedKey key : keys) {
                if (find(key) != null) {
                    delete(key);
                }
            }
            return this;
        }
        TensorDict result = shallowCopy();
        for (NestedKey key : keys) {
            if (result.find(key) != null) {
                result.delete(key);
            }
        }
        return result;
    }

    private static NestedKey[] toKeys(String[] keys) {
        NestedKey[] result = new NestedKey[keys.length];
        for (int i = 0; i < keys.length; i++) {
            result[i] = NestedKey.of(keys[i]);
        }
        return result;
    }

    /**
     * Replace all entries by those of {@code source}. The caller checks the lock.
     */
    void replaceContents(TensorDict source) {
        for (String key : new ArrayList<>(rootKeys())) {
            rawDelete(key);
        }
        for (String key : source.rootKeys()) {
            rawSet(key, source.rawGet(key), false);
        }
    }

    // ==================== Flatten / Unflatten Keys ====================

    public TensorDictBase flattenKeys() {
        return flattenKeys(TensorDictConfig.global().separator(), false);
    }

    public TensorDictBase flattenKeys(String separator) {
        return flattenKeys(separator, false);
    }

    /**
     * Replace nested containers by leaves whose keys join the full path with {@code separator}.
     *
     * @throws KeyCollisionException   if two paths join to the same key
     * @throws LockedMutationException if {@code inplace} and locked
     */
    public TensorDictBase flattenKeys(String separator, boolean inplace) {
        if (inplace) {
            checkUnlocked();
            replaceContents(buildFlattened(separator));
            return this;
        }
        if (isLocked()) {
            return cache.computeIfAbsent("flattenKeys:" + separator, cacheStamp(), () -> buildFlattened(separator));
        }
        return buildFlattened(separator);
    }

    private TensorDict buildFlattened(String separator) {
        TensorDict result = emptyLike();
        for (NestedKey key : keys(true, true)) {
            String joined = key.join(separator);
            if (result.rawGet(joined) != null) {
                throw new KeyCollisionException(
                    "Flattening keys in tensordict collides with existing key '" + joined + "'");
            }
            result.putEntry(joined, getEntry(key));
        }
        return result;
    }

    public TensorDictBase unflattenKeys() {
        return unflattenKeys(TensorDictConfig.global().separator(), false);
    }

    public TensorDictBase unflattenKeys(String separator) {
        return unflattenKeys(separator, false);
    }

    /**
     * Split keys on {@code separator} into nested containers; the inverse of {@link #flattenKeys}.
     *
     * @throws KeyCollisionException if an unflattened path would overwrite an existing entry
     */
    public TensorDictBase unflattenKeys(String separator, boolean inplace) {
        if (inplace) {
            checkUnlocked();
            replaceContents(buildUnflattened(separator));
            return this;
        }
        if (isLocked()) {
            return cache.computeIfAbsent("unflattenKeys:" + separator, cacheStamp(),
                () -> buildUnflattened(separator));
        }
        return buildUnflattened(separator);
    }

    private TensorDict buildUnflattened(String separator) {
        TensorDict result = emptyLike();
        for (String key : rootKeys()) {
            Object value = rawGet(key);
            if (value instanceof TensorDictBase nested) {
                value = nested.buildUnflattened(separator);
            }
            NestedKey path = key.contains(separator) ? NestedKey.parse(key, separator) : NestedKey.of(key);
            placeUnflattened(result, path, value);
        }
        return result;
    }

    private static void placeUnflattened(TensorDict result, NestedKey path, Object value) {
        TensorDict target = result;
        for (String atom : path.atoms().subList(0, path.size() - 1)) {
            Object existing = target.rawGet(atom);
            if (existing == null) {
                TensorDict child = target.emptyLike();
                target.putEntry(atom, child);
                target = child;
            } else if (existing instanceof TensorDict child) {
                target = child;
            } else {
                throw unflattenCollision(path);
            }
        }
        if (target.rawGet(path.last()) != null) {
            throw unflattenCollision(path);
        }
        target.putEntry(path.last(), value);
    }

    private static KeyCollisionException unflattenCollision(NestedKey path) {
        return new KeyCollisionException(
            "Unflattening key(s) in tensordict will override existing unflattened key " + path);
    }

    // ==================== Indexing ====================

    /**
     * Index the batch dimensions of every entry: {@code td[index]}.
     * Basic components produce views of the leaves; advanced ones gather copies.
     */
    public TensorDictBase index(Index... index) {
        Index[] expanded = expandIndex(index);
        int[] batch = Indexer.resultShape(batchSize(), expanded);
        List<String> names = Indexer.resultNames(names(), expanded);
        return mapStructure(batch, names, device(), leaf -> leaf.index(expanded), nested -> nested.index(expanded));
    }

    /**
     * A proxy that reads {@code parent.get(key).index(index)} and writes through to this container.
     */
    public TensorDictBase getSubTensorDict(Index... index) {
        return new SubTensorDict(this, List.of(new Index[][]{expandIndex(index)}));
    }

    Index[] expandIndex(Index... index) {
        return Indexer.expand(batchDims(), index);
    }

    // ==================== Shape Operations ====================

    /**
     * Lazily permute the batch dimensions.
     */
    public TensorDictBase permute(int... dims) {
        int n = batchDims();
        if (dims.length != n) {
            throw new IllegalArgumentException(
                "number of dims don't match in permute: got " + dims.length + " dims for a batch of " + n);
        }
        int[] normalized = new int[n];
        boolean[] seen = new boolean[n];
        boolean identity = true;
        for (int i = 0; i < n; i++) {
            int d = Indexer.normalizeDim(dims[i], n);
            if (seen[d]) {
                throw new IllegalArgumentException("repeated dim in permute: " + Arrays.toString(dims));
            }
            seen[d] = true;
            normalized[i] = d;
            identity &= d == i;
        }
        if (identity) {
            return this;
        }
        return applyTransform(new ViewTransform.Permute(normalized));
    }

    public TensorDictBase transpose(int dim0, int dim1) {
        int a = Indexer.normalizeDim(dim0, batchDims());
        int b = Indexer.normalizeDim(dim1, batchDims());
        if (a == b) {
            return this;
        }
        return applyTransform(new ViewTransform.Transpose(a, b));
    }

    /**
     * Lazily remove a batch dimension of size 1; other sizes leave the container unchanged.
     */
    public TensorDictBase squeeze(int dim) {
        int d = Indexer.normalizeDim(dim, batchDims());
        if (batchSize()[d] != 1) {
            return this;
        }
        return applyTransform(new ViewTransform.Squeeze(d));
    }

    /**
     * Remove every batch dimension of size 1, last first.
     */
    public TensorDictBase squeeze() {
        TensorDictBase result = this;
        int[] batch = batchSize();
        for (int d = batch.length - 1; d >= 0; d--) {
            if (batch[d] == 1) {
                result = result.squeeze(d);
            }
        }
        return result;
    }

    public TensorDictBase unsqueeze(int dim) {
        int n = batchDims();
        int d = dim < 0 ? dim + n + 1 : dim;
        if (d < 0 || d > n) {
            throw new IndexOutOfBoundsException(
                "Dimension out of range (expected to be in range of [" + (-n - 1) + ", " + n + "], but got " + dim + ")");
        }
        return applyTransform(new ViewTransform.Unsqueeze(d));
    }

    /**
     * Lazily reinterpret the batch dimensions; one size may be -1.
     */
    public TensorDictBase view(int... shape) {
        int[] batch = batchSize();
        int[] target = Tensor.inferShape(shape, Invariants.product(batch));
        if (Arrays.equals(target, batch)) {
            return this;
        }
        return applyTransform(new ViewTransform.View(batch, target));
    }

    TensorDictBase applyTransform(ViewTransform transform) {
        return transform.wrap(this);
    }

    /**
     * Reshape the batch dimensions into a new container, copying leaves that cannot be viewed.
     */
    public TensorDict reshape(int... shape) {
        int n = batchDims();
        int[] target = Tensor.inferShape(shape, Invariants.product(batchSize()));
        return mapStructure(target, Invariants.unnamed(target.length), device(),
            leaf -> leaf.reshape(Invariants.concat(target, Invariants.trailing(leaf.shape(), n))),
            nested -> nested.reshape(Invariants.concat(target, Invariants.trailing(nested.batchSize(), n))));
    }

    /**
     * Broadcast the batch to {@code sizes} without copying; -1 keeps a size.
     */
    public TensorDict expand(int... sizes) {
        int n = batchDims();
        int lead = sizes.length - n;
        if (lead < 0) {
            throw new IllegalArgumentException("expand: " + sizes.length + " sizes for a batch of " + n + " dims");
        }
        int[] target = sizes.clone();
        for (int i = lead; i < target.length; i++) {
            if (target[i] == -1) {
                target[i] = batchSize()[i - lead];
            }
        }
        List<String> names = new ArrayList<>(Invariants.unnamed(lead));
        names.addAll(names());
        return mapStructure(target, names, device(),
            leaf -> leaf.expand(Invariants.concat(target, Invariants.trailing(leaf.shape(), n))),
            nested -> nested.expand(Invariants.concat(target, Invariants.trailing(nested.batchSize(), n))));
    }

    /**
     * Merge batch dimensions {@code start..end} (inclusive).
     */
    public TensorDictBase flatten(int start, int end) {
        int n = batchDims();
        int s = Indexer.normalizeDim(start, n);
        int e = Indexer.normalizeDim(end, n);
        if (s > e) {
            throw new IllegalArgumentException("flatten() has invalid args: start_dim cannot come after end_dim");
        }
        if (s == e) {
            return this;
        }
        int[] batch = batchSize();
        int[] target = new int[n - (e - s)];
        int merged = 1;
        for (int i = s; i <= e; i++) {
            merged *= batch[i];
        }
        System.arraycopy(batch, 0, target, 0, s);
        target[s] = merged;
        System.arraycopy(batch, e + 1, target, s + 1, n - e - 1);
        List<String> names = new ArrayList<>(names().subList(0, s));
        names.add(null);
        names.addAll(names().subList(e + 1, n));
        return mapStructure(target, names, device(), leaf -> leaf.flatten(s, e), nested -> nested.flatten(s, e));
    }

    /**
     * Split batch dimension {@code dim} into {@code sizes}; one size may be -1.
     */
    public TensorDictBase unflatten(int dim, int... sizes) {
        int n = batchDims();
        int d = Indexer.normalizeDim(dim, n);
        int[] batch = batchSize();
        int[] inner = Tensor.inferShape(sizes, batch[d]);
        int[] target = new int[n - 1 + inner.length];
        System.arraycopy(batch, 0, target, 0, d);
        System.arraycopy(inner, 0, target, d, inner.length);
        System.arraycopy(batch, d + 1, target, d + inner.length, n - d - 1);
        List<String> names = new ArrayList<>(names().subList(0, d));
        names.addAll(Invariants.unnamed(inner.length));
        names.addAll(names().subList(d + 1, n));
        return mapStructure(target, names, device(), leaf -> leaf.unflatten(d, inner), nested -> nested.unflatten(d, inner));
    }

    /**
     * Views of every slice along a batch dimension.
     */
    public List<TensorDictBase> unbind(int dim) {
        int d = Indexer.normalizeDim(dim, batchDims());
        List<TensorDictBase> result = new ArrayList<>();
        for (int i = 0; i < batchSize()[d]; i++) {
            result.add(index(prefixIndex(d, Index.at(i))));
        }
        return result;
    }

    /**
     * Consecutive pieces of {@code size} along a batch dimension; the last may be shorter.
     */
    public List<TensorDictBase> split(int size, int dim) {
        if (size <= 0) {
            throw new IllegalArgumentException("split size must be positive, got " + size);
        }
        int d = Indexer.normalizeDim(dim, batchDims());
        int length = batchSize()[d];
        List<TensorDictBase> result = new ArrayList<>();
        for (int start = 0; start < length; start += size) {
            result.add(index(prefixIndex(d, Index.slice(start, Math.min(start + size, length)))));
        }
        return result;
    }

    public List<TensorDictBase> chunk(int chunks, int dim) {
        if (chunks <= 0) {
            throw new IllegalArgumentException("chunk expects a positive number of chunks, got " + chunks);
        }
        int length = batchSize()[Indexer.normalizeDim(dim, batchDims())];
        return split(Math.max(1, (length + chunks - 1) / chunks), dim);
    }

    static Index[] prefixIndex(int dim, Index component) {
        Index[] index = new Index[dim + 1];
        Arrays.fill(index, Index.all());
        index[dim] = component;
        return index;
    }

    // ==================== Copies and Casts ====================

    /**
     * Deep copy with fresh storage for every leaf.
     */
    @Override
    public TensorDictBase clone() {
        return toTensorDict();
    }

    /**
     * Materialize into a plain {@link TensorDict} with fresh storage.
     */
    public TensorDict toTensorDict() {
        return mapStructure(batchSize(), names(), device(), Tensor::copy, TensorDictBase::toTensorDict);
    }

    /**
     * A plain container whose leaves are contiguous; leaves that already are keep their storage.
     */
    public TensorDict contiguous() {
        return mapStructure(batchSize(), names(), device(), Tensor::contiguous, TensorDictBase::contiguous);
    }

    public TensorDictBase to(Device target) {
        Objects.requireNonNull(target, "device cannot be null");
        if (target.equals(device())) {
            return this;
        }
        return mapStructure(batchSize(), names(), target, leaf -> leaf.to(target), nested -> nested.to(target));
    }

    public TensorDict to(ScalarType dtype) {
        return mapStructure(batchSize(), names(), device(), leaf -> leaf.to(dtype), nested -> nested.to(dtype));
    }

    /**
     * New container with {@code fn} applied to every leaf; results must keep the batch prefix.
     */
    public TensorDict apply(UnaryOperator<Tensor> fn) {
        TensorDict result = emptyLike();
        for (String key : keys()) {
            Object value = rawGet(key);
            if (value instanceof TensorDictBase nested) {
                result.set(key, nested.apply(fn));
            } else {
                result.set(key, fn.apply((Tensor) value));
            }
        }
        return result;
    }

    TensorDict emptyLike() {
        return new TensorDict(new LinkedHashMap<>(), batchSize(), device(), names());
    }

    /**
     * New structure with the same nested containers (copied) and the same leaf objects.
     */
    TensorDict shallowCopy() {
        return mapStructure(batchSize(), names(), device(), leaf -> leaf, TensorDictBase::shallowCopy);
    }

    TensorDict mapStructure(int[] batch, List<String> names, Device device,
                            Function<Tensor, Tensor> leafFn, Function<TensorDictBase, TensorDictBase> nestedFn) {
        TensorDict result = new TensorDict(new LinkedHashMap<>(), batch, device, names);
        for (String key : keys()) {
            Object value = rawGet(key);
            if (value instanceof Tensor leaf) {
                result.putEntry(key, leafFn.apply(leaf));
            } else {
                result.putEntry(key, nestedFn.apply((TensorDictBase) value));
            }
        }
        return result;
    }

    // ==================== Names ====================

    /**
     * Shallow copy carrying new dimension names.
     */
    public TensorDictBase rename(String... names) {
        TensorDict copy = shallowCopy();
        copy.setNames(Arrays.asList(names));
        return copy;
    }

    public TensorDictBase rename(Map<String, String> mapping) {
        List<String> renamed = new ArrayList<>(names());
        Set<String> used = new HashSet<>();
        for (int i = 0; i < renamed.size(); i++) {
            String name = renamed.get(i);
            if (name != null && mapping.containsKey(name)) {
                renamed.set(i, mapping.get(name));
                used.add(name);
            }
        }
        if (!used.containsAll(mapping.keySet())) {
            Set<String> missing = new HashSet<>(mapping.keySet());
            missing.removeAll(used);
            throw new IllegalArgumentException("Some names to be renamed were not part of the names: " + missing);
        }
        return rename(renamed.toArray(new String[0]));
    }

    public TensorDictBase renameInPlace(String... names) {
        return setNames(Arrays.asList(names));
    }

    /**
     * Take over a parent's names for the leading dims. Only stored names can adopt.
     */
    void adoptLeadingNames(List<String> parentNames) {
    }

    // ==================== Fills ====================

    /**
     * Fill an entry (every leaf below it, for a nested container) in place.
     */
    public TensorDictBase fill(String key, double value) {
        return fill(NestedKey.of(key), value);
    }

    public TensorDictBase fill(NestedKey key, double value) {
        Object entry = getEntry(key);
        if (entry instanceof TensorDictBase nested) {
            for (NestedKey leafKey : nested.keys(true, true)) {
                nested.fill(leafKey, value);
            }
        } else {
            Tensor leaf = (Tensor) entry;
            setInPlace(key, Tensor.full(value, leaf.dtype(), leaf.shape()));
        }
        return this;
    }

    public TensorDictBase zero() {
        for (NestedKey key : keys(true, true)) {
            fill(key, 0.0);
        }
        return this;
    }

    /**
     * Fill, in place, the batch elements where {@code mask} is true.
     */
    public TensorDictBase maskedFillInPlace(Tensor mask, double value) {
        if (mask.rank() > batchDims()) {
            throw new IllegalArgumentException("mask of rank " + mask.rank() + " exceeds the batch dims " + batchDims());
        }
        for (NestedKey key : keys(true, true)) {
            setAt(key, Tensor.scalar(value, ScalarType.F64), Index.mask(mask));
        }
        return this;
    }

    public TensorDictBase maskedFill(Tensor mask, double value) {
        return clone().maskedFillInPlace(mask, value);
    }

    // ==================== Comparison ====================

    public boolean allEqual(TensorDictBase other) {
        if (!Arrays.equals(batchSize(), other.batchSize())) {
            return false;
        }
        List<NestedKey> mine = keys(true, true);
        if (!new HashSet<>(mine).equals(new HashSet<>(other.keys(true, true)))) {
            return false;
        }
        for (NestedKey key : mine) {
            if (!get(key).allEqual(other.get(key))) {
                return false;
            }
        }
        return true;
    }

    public boolean allEqual(double value) {
        for (NestedKey key : keys(true, true)) {
            if (!get(key).allEqual(value)) {
                return false;
            }
        }
        return true;
    }

    public boolean allClose(TensorDictBase other, double rtol, double atol) {
        if (!Arrays.equals(batchSize(), other.batchSize())) {
            return false;
        }
        List<NestedKey> mine = keys(true, true);
        if (!new HashSet<>(mine).equals(new HashSet<>(other.keys(true, true)))) {
            return false;
        }
        for (NestedKey key : mine) {
            if (!get(key).allClose(other.get(key), rtol, atol)) {
                return false;
            }
        }
        return true;
    }

    // ==================== Memmap ====================

    public TensorDictBase memmap() {
        return memmap(null, false);
    }

    public TensorDictBase memmap(Path prefix) {
        return memmap(prefix, false);
    }

    /**
     * Move every leaf to a memory-mapped file under {@code prefix} and lock the container.
     *
     * @param prefix       target directory, or null for a temporary one
     * @param copyExisting allow copying leaves that are already mapped elsewhere
     */
    public abstract TensorDictBase memmap(Path prefix, boolean copyExisting);

    /**
     * Directory holding the memmapped leaves, or null.
     */
    public Path memmapPrefix() {
        return null;
    }

    public boolean isMemmap() {
        List<NestedKey> leaves = keys(true, true);
        if (leaves.isEmpty()) {
            return false;
        }
        for (NestedKey key : leaves) {
            if (!get(key).isMapped()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Zero-filled memmapped container with the same structure, shapes and dtypes.
     */
    public TensorDictBase memmapLike(Path prefix) {
        return zerosLike().memmap(prefix, false);
    }

    TensorDict zerosLike() {
        return mapStructure(batchSize(), names(), device(),
            leaf -> Tensor.zeros(leaf.dtype(), leaf.device(), leaf.shape()), TensorDictBase::zerosLike);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(keys=" + keys() + ", batchSize=" + Arrays.toString(batchSize())
            + ", device=" + device() + ", locked=" + isLocked() + ")";
    }
}
