package io.surfworks.tensordict.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for LockNode and LockGraph.
 */
@DisplayName("LockGraph Unit Tests")
class LockGraphTest {

    @Test
    @DisplayName("node ids are unique")
    void uniqueIds() {
        assertNotEquals(new LockNode().id(), new LockNode().id());
    }

    @Test
    @DisplayName("withSelf adds the node id without touching the input")
    void withSelf() {
        LockNode node = new LockNode();
        Set<Long> ids = Set.of(-1L);
        assertEquals(Set.of(-1L, node.id()), node.withSelf(ids));
        assertEquals(Set.of(-1L), ids);
    }

    @Test
    @DisplayName("release withdraws the node id from every node it locked, transitively")
    void releaseTransitive() {
        LockNode root = new LockNode();
        LockNode child = new LockNode();
        LockNode grandchild = new LockNode();
        LockGraph.atomically(() -> {
            root.setLocked(true);
            child.addOwners(root.withSelf(Set.of()));
            child.setLocked(true);
            root.addLockedChild(child);
            grandchild.addOwners(child.withSelf(Set.of(root.id())));
            grandchild.setLocked(true);
            child.addLockedChild(grandchild);
        });

        LockGraph.release(root);

        assertFalse(child.hasOwners());
        assertEquals(Set.of(child.id()), grandchild.owners());
        assertTrue(child.isLocked());
        assertTrue(grandchild.isLocked());
    }

    @Test
    @DisplayName("unlocking bumps the generation seen by enumeration caches")
    void generation() {
        LockNode node = new LockNode();
        long before = node.generation();
        node.bumpGeneration();
        assertEquals(before + 1, node.generation());
    }

    @Test
    @DisplayName("atomically returns the supplier's result")
    void atomicallyReturns() {
        Integer result = LockGraph.atomically(() -> 42);
        assertEquals(42, result);
    }
}
