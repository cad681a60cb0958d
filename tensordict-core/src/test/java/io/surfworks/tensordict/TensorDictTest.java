package io.surfworks.tensordict;

import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.Index;
import io.surfworks.tensordict.tensor.ScalarType;
import io.surfworks.tensordict.tensor.Tensor;
import io.surfworks.tensordict.testing.TensorAssert;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for TensorDict and the operations shared by every container.
 */
@DisplayName("TensorDict Unit Tests")
class TensorDictTest {

    private Random random;

    @BeforeEach
    void setUp() {
        random = new Random(1);
    }

    /**
     * Batch (4, 5) with a leaf, a wide leaf and a nested container holding one more level.
     */
    private TensorDict sample() {
        Map<Object, Object> source = new LinkedHashMap<>();
        source.put("a", Tensor.randn(random, 4, 5));
        source.put("b", Tensor.randn(random, 4, 5, 3));
        source.put(NestedKey.of("c", "d"), Tensor.randn(random, 4, 5, 2));
        source.put(NestedKey.of("c", "e", "f"), Tensor.randn(random, 4, 5));
        return new TensorDict(source, 4, 5);
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("nested paths in the source create nested containers")
        void nestedPaths() {
            TensorDict td = sample();
            assertEquals(List.of("a", "b", "c"), td.keys());
            assertInstanceOf(TensorDict.class, td.getTensorDict("c"));
            assertArrayEquals(new int[]{4, 5}, td.getTensorDict("c", "e").batchSize());
        }

        @Test
        @DisplayName("nested maps take the parent's batch size")
        void nestedMaps() {
            TensorDict td = new TensorDict(Map.of("n", Map.of("x", Tensor.zeros(3, 2))), 3);
            assertArrayEquals(new int[]{3}, td.getTensorDict("n").batchSize());
            assertArrayEquals(new int[]{3, 2}, td.get("n", "x").shape());
        }

        @Test
        @DisplayName("entries must start with the batch size")
        void batchPrefix() {
            assertThrows(ShapeMismatchException.class, () -> new TensorDict(Map.of("x", Tensor.zeros(3)), 4));
        }

        @Test
        @DisplayName("negative batch sizes are rejected")
        void negativeBatch() {
            assertThrows(IllegalArgumentException.class, () -> new TensorDict(Map.of(), -1));
        }

        @Test
        @DisplayName("fromMap infers the longest common leading shape")
        void fromMapInfers() {
            Map<String, Object> source = new LinkedHashMap<>();
            source.put("a", Tensor.zeros(3, 4, 5));
            source.put("b", Map.of("c", Tensor.zeros(3, 4, 5, 6)));
            source.put("d", Tensor.zeros(3, 4));
            TensorDict td = TensorDicts.fromMap(source);
            assertArrayEquals(new int[]{3, 4}, td.batchSize());
            assertArrayEquals(new int[]{3, 4, 5, 6}, td.get("b", "c").shape());
        }

        @Test
        @DisplayName("fromMap counts primitive arrays by their length")
        void fromMapArrays() {
            Map<String, Object> source = new LinkedHashMap<>();
            source.put("a", new float[]{1, 2, 3});
            source.put("b", Tensor.zeros(3, 2));
            TensorDict td = TensorDicts.fromMap(source);
            assertArrayEquals(new int[]{3}, td.batchSize());
            assertArrayEquals(new float[]{1, 2, 3}, td.get("a").toFloatArray());

            source.put("c", new long[]{7, 8});
            assertArrayEquals(new int[0], TensorDicts.fromMap(source).batchSize());
        }

        @Test
        @DisplayName("a device moves every leaf")
        void deviceMovesLeaves() {
            TensorDict td = new TensorDict(Map.of("x", Tensor.zeros(2)), new int[]{2}, Device.cuda(0));
            assertEquals(Device.cuda(0), td.get("x").device());
            td.set("y", Tensor.ones(ScalarType.F64, 2));
            assertEquals(Device.cuda(0), td.get("y").device());
        }
    }

    @Nested
    @DisplayName("Set and Get")
    class SetAndGet {

        @Test
        @DisplayName("a rejected nested set leaves no intermediate containers behind")
        void rejectedNestedSet() {
            TensorDict td = new TensorDict(Map.of("a", Tensor.zeros(4, 5)), 4, 5);
            assertThrows(ShapeMismatchException.class,
                () -> td.set(NestedKey.of("new", "x"), Tensor.zeros(5, 5)));
            assertEquals(List.of("a"), td.keys());

            td.set("n", new TensorDict(Map.of(), 4, 5));
            assertThrows(ShapeMismatchException.class,
                () -> td.set(NestedKey.of("n", "deep", "x"), Tensor.zeros(5, 5)));
            assertTrue(td.getTensorDict("n").keys().isEmpty());
            assertThrows(TypeMismatchException.class, () -> td.set(NestedKey.of("m", "x"), new Object()));
            assertFalse(td.containsKey("m"));
        }

        @Test
        @DisplayName("a mis-shaped set fails, an in-place set casts the dtype")
        void shapeMismatchAndInPlaceCast() {
            TensorDict td = new TensorDict(Map.of(), 4, 5);
            td.set("key1", Tensor.randn(random, 4, 5));

            assertThrows(ShapeMismatchException.class, () -> td.set("key1", Tensor.randn(random, 5, 5)));

            td.setInPlace("key1", Tensor.ones(ScalarType.F64, 4, 5));
            assertTrue(td.get("key1").allEqual(1.0));
            assertEquals(ScalarType.F32, td.get("key1").dtype());
        }

        @Test
        @DisplayName("setInPlace on a missing key reports the available keys")
        void setInPlaceMissing() {
            TensorDict td = sample();
            KeyMissingException e = assertThrows(KeyMissingException.class,
                () -> td.setInPlace("smartypants", Tensor.ones(4, 5)));
            assertTrue(e.getMessage().contains("not found in TensorDict with keys"));
            assertEquals(NestedKey.of("smartypants"), e.key());
        }

        @Test
        @DisplayName("setAt writes a sub-block of a leaf")
        void setAt() {
            TensorDict td = new TensorDict(Map.of("key2", Tensor.zeros(4, 5, 6)), 4, 5);
            Tensor x = Tensor.randn(random, 6);
            td.setAt("key2", x, Index.at(2), Index.at(2));
            TensorAssert.assertEquals(x, td.get("key2").index(Index.at(2), Index.at(2)));
            assertTrue(td.get("key2").index(Index.at(0)).allEqual(0.0));
        }

        @Test
        @DisplayName("numbers and arrays become tensors")
        void conversions() {
            TensorDict td = new TensorDict();
            td.set("flag", true);
            td.set("count", 3);
            td.set("ratio", 0.5);
            td.set("values", new double[]{1, 2});
            assertEquals(ScalarType.BOOL, td.get("flag").dtype());
            assertEquals(ScalarType.I64, td.get("count").dtype());
            assertEquals(3.0, td.get("count").item());
            assertEquals(ScalarType.F32, td.get("ratio").dtype());
            assertArrayEquals(new int[]{2}, td.get("values").shape());
            assertThrows(TypeMismatchException.class, () -> td.set("bad", "text"));
        }

        @Test
        @DisplayName("get on a nested container and getTensorDict on a leaf fail with TypeMismatch")
        void wrongKind() {
            TensorDict td = sample();
            assertThrows(TypeMismatchException.class, () -> td.get("c"));
            assertThrows(TypeMismatchException.class, () -> td.getTensorDict("a"));
            assertThrows(TypeMismatchException.class, () -> td.get("a", "x"));
        }

        @Test
        @DisplayName("setting a path through a leaf fails")
        void pathThroughLeaf() {
            TensorDict td = sample();
            assertThrows(TypeMismatchException.class, () -> td.set(NestedKey.of("a", "x"), Tensor.zeros(4, 5)));
        }

        @Test
        @DisplayName("empty key atoms are rejected")
        void emptyAtom() {
            assertThrows(IllegalArgumentException.class, () -> NestedKey.of("a", ""));
            assertThrows(IllegalArgumentException.class, () -> new TensorDict().set("", 1));
        }

        @Test
        @DisplayName("containsKey walks nested paths")
        void containsKey() {
            TensorDict td = sample();
            assertTrue(td.containsKey("c", "e", "f"));
            assertFalse(td.containsKey("c", "x"));
            assertFalse(td.containsKey("a", "x"));
        }

        @Test
        @DisplayName("getOrDefault and setDefault")
        void defaults() {
            TensorDict td = sample();
            Tensor fallback = Tensor.zeros(4, 5);
            assertSame(fallback, td.getOrDefault(NestedKey.of("missing"), fallback));
            Object stored = td.setDefault(NestedKey.of("c", "new"), fallback);
            assertSame(fallback, stored);
            assertSame(td.get("a"), td.setDefault(NestedKey.of("a"), fallback));
        }

        @Test
        @DisplayName("createNested adds an empty container with the parent's batch size")
        void createNested() {
            TensorDict td = sample();
            td.createNested("x", "y");
            TensorDictBase y = td.getTensorDict("x", "y");
            assertTrue(y.keys().isEmpty());
            assertArrayEquals(new int[]{4, 5}, y.batchSize());
        }
    }

    @Nested
    @DisplayName("Keys")
    class Keys {

        @Test
        @DisplayName("nested key enumeration is depth first")
        void nestedKeys() {
            TensorDict td = sample();
            assertEquals(List.of(NestedKey.of("a"), NestedKey.of("b"), NestedKey.of("c", "d"),
                NestedKey.of("c", "e", "f")), td.keys(true, true));
            assertEquals(List.of(NestedKey.of("a"), NestedKey.of("b"), NestedKey.of("c"), NestedKey.of("c", "d"),
                NestedKey.of("c", "e"), NestedKey.of("c", "e", "f")), td.keys(true, false));
        }

        @Test
        @DisplayName("items pairs keys with their values")
        void items() {
            TensorDict td = sample();
            Map<NestedKey, Object> items = td.items(true, true);
            assertEquals(4, items.size());
            assertSame(td.get("c", "d"), items.get(NestedKey.of("c", "d")));
        }

        @Test
        @DisplayName("sortedKeys orders top-level keys")
        void sortedKeys() {
            TensorDict td = new TensorDict(Map.of("b", Tensor.zeros(1), "a", Tensor.zeros(1)), 1);
            assertEquals(List.of("a", "b"), td.sortedKeys());
        }
    }

    @Nested
    @DisplayName("Delete, Pop and Rename")
    class DeletePopRename {

        @Test
        @DisplayName("pop removes and returns the entry")
        void pop() {
            TensorDict td = sample();
            Tensor a = td.get("a");
            assertSame(a, td.pop("a"));
            assertFalse(td.containsKey("a"));
        }

        @Test
        @DisplayName("pop without a default reports the path")
        void popMissing() {
            TensorDict td = sample();
            KeyMissingException e = assertThrows(KeyMissingException.class, () -> td.pop("zz"));
            assertTrue(e.getMessage().contains("zz"));
            assertEquals("fallback", td.pop(NestedKey.of("zz"), "fallback"));
        }

        @Test
        @DisplayName("delete of a nested path keeps the siblings")
        void deleteNested() {
            TensorDict td = sample();
            td.delete("c", "d");
            assertEquals(List.of("e"), td.getTensorDict("c").keys());
            assertThrows(KeyMissingException.class, () -> td.delete("c", "d"));
        }

        @Test
        @DisplayName("renameKey moves the entry, safe mode refuses to overwrite")
        void renameKey() {
            TensorDict td = sample();
            Tensor a = td.get("a");
            td.renameKey("a", "z");
            assertSame(a, td.get("z"));
            assertFalse(td.containsKey("a"));
            assertThrows(KeyCollisionException.class,
                () -> td.renameKey(NestedKey.of("z"), NestedKey.of("b"), true));
        }
    }

    @Nested
    @DisplayName("Select and Exclude")
    class SelectExclude {

        @Test
        @DisplayName("select keeps only the requested paths and shares leaves")
        void select() {
            TensorDict td = sample();
            TensorDictBase selected = td.select(NestedKey.of("a"), NestedKey.of("c", "e", "f"));
            assertEquals(List.of(NestedKey.of("a"), NestedKey.of("c", "e", "f")), selected.keys(true, true));
            assertSame(td.get("a"), selected.get("a"));
            assertEquals(List.of("a", "b", "c"), td.keys());
        }

        @Test
        @DisplayName("strict select fails on a missing key, lenient select skips it")
        void strictSelect() {
            TensorDict td = sample();
            assertThrows(KeyMissingException.class, () -> td.select("a", "missing"));
            assertEquals(List.of("a"), td.select(false, false, NestedKey.of("a"), NestedKey.of("missing")).keys());
        }

        @Test
        @DisplayName("in-place select restricts this container")
        void selectInPlace() {
            TensorDict td = sample();
            assertSame(td, td.select(true, true, NestedKey.of("b")));
            assertEquals(List.of("b"), td.keys());
        }

        @Test
        @DisplayName("exclude drops paths without touching the source")
        void exclude() {
            TensorDict td = sample();
            TensorDictBase excluded = td.exclude(NestedKey.of("c", "d"), NestedKey.of("b"));
            assertEquals(List.of(NestedKey.of("a"), NestedKey.of("c", "e", "f")), excluded.keys(true, true));
            assertTrue(td.containsKey("c", "d"));
        }
    }

    @Nested
    @DisplayName("Flatten and Unflatten Keys")
    class FlattenKeys {

        @Test
        @DisplayName("flattenKeys joins paths with the separator")
        void flatten() {
            TensorDict td = sample();
            TensorDictBase flat = td.flattenKeys();
            assertEquals(List.of("a", "b", "c.d", "c.e.f"), flat.keys());
            assertSame(td.get("c", "e", "f"), flat.get("c.e.f"));
        }

        @Test
        @DisplayName("unflattenKeys reverses flattenKeys")
        void roundTrip() {
            TensorDict td = sample();
            TensorDictBase restored = td.flattenKeys("/").unflattenKeys("/");
            assertEquals(new HashSet<>(td.keys(true, true)), new HashSet<>(restored.keys(true, true)));
            TensorAssert.assertTensorDictEquals(td, restored);
        }

        @Test
        @DisplayName("colliding flattened keys are rejected")
        void collision() {
            TensorDict td = sample();
            td.set("c.d", Tensor.zeros(4, 5));
            assertThrows(KeyCollisionException.class, td::flattenKeys);
        }

        @Test
        @DisplayName("unflattening onto an existing leaf is rejected")
        void unflattenCollision() {
            TensorDict td = new TensorDict(Map.of(), 2);
            td.set("a", Tensor.zeros(2));
            td.set("a.b", Tensor.zeros(2));
            assertThrows(KeyCollisionException.class, td::unflattenKeys);
        }

        @Test
        @DisplayName("in-place flatten replaces the entries")
        void flattenInPlace() {
            TensorDict td = sample();
            td.flattenKeys("_", true);
            assertEquals(List.of("a", "b", "c_d", "c_e_f"), td.keys());
        }
    }

    @Nested
    @DisplayName("Update")
    class Update {

        @Test
        @DisplayName("update merges nested containers")
        void updateMerges() {
            TensorDict td = sample();
            Tensor extra = Tensor.zeros(4, 5);
            td.update(Map.of("c", Map.of("g", extra)));
            assertSame(extra, td.get("c", "g"));
            assertTrue(td.containsKey("c", "d"));
        }

        @Test
        @DisplayName("updateInPlace writes into existing storage")
        void updateInPlace() {
            TensorDict td = sample();
            Tensor before = td.get("a");
            td.updateInPlace(Map.of("a", Tensor.ones(4, 5)));
            assertSame(before, td.get("a"));
            assertTrue(before.allEqual(1.0));
            assertThrows(KeyMissingException.class, () -> td.updateInPlace(Map.of("zz", Tensor.ones(4, 5))));
        }

        @Test
        @DisplayName("setIndex writes a container into a sub-batch and creates missing keys")
        void setIndex() {
            TensorDict td = new TensorDict(Map.of("a", Tensor.zeros(4, 5)), 4, 5);
            td.setIndex(new Index[]{Index.at(1)},
                Map.of("a", Tensor.ones(5), "new", Tensor.full(2.0, 5, 3)));
            assertTrue(td.get("a").index(Index.at(1)).allEqual(1.0));
            assertTrue(td.get("a").index(Index.at(0)).allEqual(0.0));
            assertArrayEquals(new int[]{4, 5, 3}, td.get("new").shape());
            assertTrue(td.get("new").index(Index.at(1)).allEqual(2.0));
            assertTrue(td.get("new").index(Index.at(2)).allEqual(0.0));
        }

        @Test
        @DisplayName("updateAt writes another container at a batch slice")
        void updateAt() {
            TensorDict td = sample();
            TensorDict ones = new TensorDict(Map.of("a", Tensor.ones(2, 5)), 2, 5);
            td.updateAt(ones, Index.slice(1, 3));
            assertTrue(td.get("a").index(Index.slice(1, 3)).allEqual(1.0));
            assertFalse(td.get("a").index(Index.at(0)).allEqual(1.0));
        }
    }

    @Nested
    @DisplayName("Indexing and Shape Operations")
    class ShapeOperations {

        @Test
        @DisplayName("integer index drops the batch dim and returns views")
        void indexAt() {
            TensorDict td = sample();
            TensorDictBase row = td.index(Index.at(1));
            assertArrayEquals(new int[]{5}, row.batchSize());
            assertArrayEquals(new int[]{5, 2}, row.get("c", "d").shape());
            row.get("a").fill(9);
            assertTrue(td.get("a").index(Index.at(1)).allEqual(9.0));
        }

        @Test
        @DisplayName("mask index gathers selected batch elements")
        void indexMask() {
            TensorDict td = sample();
            Tensor mask = Tensor.fromBooleanArray(new boolean[]{true, false, false, true}, 4);
            TensorDictBase picked = td.index(Index.mask(mask));
            assertArrayEquals(new int[]{2, 5}, picked.batchSize());
            TensorAssert.assertEquals(td.get("b").index(Index.at(3)), picked.get("b").index(Index.at(1)));
        }

        @Test
        @DisplayName("maskedFill fills masked batch elements of every leaf")
        void maskedFill() {
            TensorDict td = sample();
            Tensor mask = Tensor.fromBooleanArray(new boolean[]{false, true, false, false}, 4);
            TensorDictBase filled = td.maskedFill(mask, 1.0);
            assertTrue(filled.get("b").index(Index.at(1)).allEqual(1.0));
            assertTrue(filled.get("c", "e", "f").index(Index.at(1)).allEqual(1.0));
            assertFalse(td.get("b").index(Index.at(1)).allEqual(1.0));
        }

        @Test
        @DisplayName("maskedFillInPlace writes into the existing leaves")
        void maskedFillInPlace() {
            TensorDict td = sample();
            Tensor before = td.get("a");
            Tensor mask = Tensor.fromBooleanArray(new boolean[]{true, false, false, true}, 4);
            assertSame(td, td.maskedFillInPlace(mask, -1.0));
            assertTrue(before.index(Index.at(0)).allEqual(-1.0));
            assertTrue(before.index(Index.at(3)).allEqual(-1.0));
            assertFalse(before.index(Index.at(1)).allEqual(-1.0));
            assertThrows(IllegalArgumentException.class,
                () -> td.maskedFillInPlace(Tensor.fromBooleanArray(new boolean[40], 4, 5, 2), 0.0));
        }

        @Test
        @DisplayName("unbind, split and chunk along a batch dim")
        void unbindSplitChunk() {
            TensorDict td = sample();
            assertEquals(5, td.unbind(1).size());
            List<TensorDictBase> pieces = td.split(3, 0);
            assertEquals(2, pieces.size());
            assertArrayEquals(new int[]{1, 5}, pieces.get(1).batchSize());
            assertEquals(2, td.chunk(2, 1).size());
            assertArrayEquals(new int[]{4, 3}, td.chunk(2, 1).get(0).batchSize());
        }

        @Test
        @DisplayName("reshape, flatten and unflatten the batch")
        void reshapeFlatten() {
            TensorDict td = sample();
            assertArrayEquals(new int[]{20, 3}, td.reshape(-1).get("b").shape());
            TensorDictBase flat = td.flatten(0, 1);
            assertArrayEquals(new int[]{20}, flat.batchSize());
            assertArrayEquals(new int[]{20, 2}, flat.get("c", "d").shape());
            assertArrayEquals(new int[]{4, 5}, flat.unflatten(0, 4, 5).batchSize());
        }

        @Test
        @DisplayName("expand prepends broadcast dims without copying")
        void expand() {
            TensorDict td = new TensorDict(Map.of("x", Tensor.zeros(1, 2)), 1);
            TensorDict expanded = td.expand(3, -1);
            assertArrayEquals(new int[]{3, 1}, expanded.batchSize());
            assertArrayEquals(new int[]{3, 1, 2}, expanded.get("x").shape());
            assertTrue(expanded.get("x").sharesStorage(td.get("x")));
        }
    }

    @Nested
    @DisplayName("Batch Size and Names")
    class BatchSizeAndNames {

        @Test
        @DisplayName("batch size can shrink to a shorter prefix")
        void setBatchSize() {
            TensorDict td = sample();
            td.setBatchSize(4);
            assertArrayEquals(new int[]{4}, td.batchSize());
            assertThrows(ShapeMismatchException.class, () -> td.setBatchSize(3));
        }

        @Test
        @DisplayName("names propagate to the leading dims of nested containers")
        void namesPropagate() {
            TensorDict td = sample();
            td.setNames("x", "y");
            assertEquals(List.of("x", "y"), td.names());
            assertEquals(List.of("x", "y"), td.getTensorDict("c", "e").names());
        }

        @Test
        @DisplayName("names must be unique and match the batch rank")
        void namesValidated() {
            TensorDict td = sample();
            assertThrows(IllegalArgumentException.class, () -> td.setNames("x", "x"));
            assertThrows(IllegalArgumentException.class, () -> td.setNames("x", "y", "z"));
        }

        @Test
        @DisplayName("rename returns a renamed shallow copy")
        void rename() {
            TensorDict td = sample();
            td.setNames("x", "y");
            TensorDictBase renamed = td.rename(Map.of("y", "w"));
            assertEquals(Arrays.asList("x", "w"), renamed.names());
            assertEquals(List.of("x", "y"), td.names());
            assertThrows(IllegalArgumentException.class, () -> td.rename(Map.of("nope", "w")));
        }

        @Test
        @DisplayName("renameInPlace replaces the names of the container itself")
        void renameInPlace() {
            TensorDict td = sample();
            assertSame(td, td.renameInPlace("t", "u"));
            assertEquals(List.of("t", "u"), td.names());
            assertEquals(List.of("t", "u"), td.getTensorDict("c").names());
        }

        @Test
        @DisplayName("integer indexing drops the indexed name")
        void indexDropsName() {
            TensorDict td = sample();
            td.setNames("x", "y");
            assertEquals(List.of("y"), td.index(Index.at(0)).names());
        }

        @Test
        @DisplayName("unnamed containers report null names")
        void unnamed() {
            assertNull(sample().names().get(0));
        }
    }

    @Nested
    @DisplayName("Copies")
    class Copies {

        @Test
        @DisplayName("clone owns fresh storage")
        void cloneIsDeep() {
            TensorDict td = sample();
            TensorDictBase copy = td.clone();
            TensorAssert.assertTensorDictEquals(td, copy);
            copy.get("c", "d").fill(5);
            assertFalse(td.get("c", "d").allEqual(5.0));
        }

        @Test
        @DisplayName("apply maps every leaf")
        void apply() {
            TensorDict td = sample();
            TensorDict doubled = td.apply(t -> t.to(ScalarType.F64));
            for (NestedKey key : doubled.keys(true, true)) {
                assertEquals(ScalarType.F64, doubled.get(key).dtype());
            }
        }

        @Test
        @DisplayName("zero and fill write in place")
        void zeroAndFill() {
            TensorDict td = sample();
            Tensor b = td.get("b");
            td.fill("c", 3.0);
            assertTrue(td.get("c", "e", "f").allEqual(3.0));
            td.zero();
            assertSame(b, td.get("b"));
            assertTrue(td.allEqual(0.0));
        }

        @Test
        @DisplayName("allClose tolerates small differences")
        void allClose() {
            TensorDict td = new TensorDict(Map.of("x", Tensor.full(1.0, 2)), 2);
            TensorDict near = new TensorDict(Map.of("x", Tensor.full(1.0 + 1e-7, 2)), 2);
            assertTrue(td.allClose(near, 1e-5, 1e-8));
            assertFalse(td.allEqual(new TensorDict(Map.of("x", Tensor.full(2.0, 2)), 2)));
        }
    }

    @Nested
    @DisplayName("Concatenation")
    class Concatenation {

        @Test
        @DisplayName("cat joins along a batch dim, recursing into nested containers")
        void cat() {
            TensorDict td = sample();
            TensorDict joined = TensorDicts.cat(List.of(td, td.clone()), 0);
            assertArrayEquals(new int[]{8, 5}, joined.batchSize());
            assertArrayEquals(new int[]{8, 5, 2}, joined.get("c", "d").shape());
        }

        @Test
        @DisplayName("cat rejects batch sizes that differ outside the dim")
        void catMismatch() {
            TensorDict a = new TensorDict(Map.of("x", Tensor.zeros(2, 3)), 2, 3);
            TensorDict b = new TensorDict(Map.of("x", Tensor.zeros(2, 4)), 2, 4);
            assertThrows(BatchSizeMismatchException.class, () -> TensorDicts.cat(List.of(a, b), 0));
        }

        @Test
        @DisplayName("stackInto writes the stacked leaves into an existing container")
        void stackInto() {
            TensorDict a = new TensorDict(Map.of("x", Tensor.ones(3)), 3);
            TensorDict b = new TensorDict(Map.of("x", Tensor.full(2.0, 3)), 3);
            TensorDict out = new TensorDict(Map.of("x", Tensor.zeros(2, 3)), 2, 3);
            Tensor storage = out.get("x");
            TensorDicts.stackInto(List.of(a, b), 0, out);
            assertSame(storage, out.get("x"));
            assertArrayEquals(new float[]{1, 1, 1, 2, 2, 2}, storage.toFloatArray());
        }
    }

    @Test
    @DisplayName("every leaf keeps the batch size as a prefix")
    void batchPrefixInvariant() {
        TensorDict td = sample();
        Set<NestedKey> keys = new HashSet<>(td.keys(true, true));
        for (NestedKey key : keys) {
            int[] shape = td.get(key).shape();
            assertArrayEquals(td.batchSize(), Arrays.copyOf(shape, td.batchDims()));
        }
    }
}
