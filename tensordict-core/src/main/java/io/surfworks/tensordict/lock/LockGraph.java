package io.surfworks.tensordict.lock;

import java.lang.ref.Cleaner;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Shared monitor and release logic for the lock graph.
 *
 * <p>Lock propagation itself is driven by the containers, which know their edges.
 * This class only owns what must work without them: the monitor guarding all
 * {@link LockNode} state, and the withdrawal of a dead container's owner id from
 * every node it locked.
 */
public final class LockGraph {

    private static final Logger LOG = Logger.getLogger(LockGraph.class.getName());

    private static final Object MONITOR = new Object();
    private static final Cleaner CLEANER = Cleaner.create();

    private LockGraph() {} // Utility class

    /**
     * Run an action while holding the lock-graph monitor.
     */
    public static <T> T atomically(Supplier<T> action) {
        synchronized (MONITOR) {
            return action.get();
        }
    }

    public static void atomically(Runnable action) {
        synchronized (MONITOR) {
            action.run();
        }
    }

    /**
     * Release {@code node} when {@code container} becomes phantom reachable.
     */
    public static Cleaner.Cleanable register(Object container, LockNode node) {
        return CLEANER.register(container, new Release(node));
    }

    /**
     * Withdraw the node's id from every node it locked, transitively.
     * Locked flags are left untouched.
     */
    public static void release(LockNode node) {
        synchronized (MONITOR) {
            if (node.lockedChildCount() > 0) {
                LOG.fine(() -> "Releasing lock contributions of node " + node.id());
            }
            removeLock(node, node.id());
        }
    }

    private static void removeLock(LockNode node, long ownerId) {
        for (LockNode child : node.lockedChildren()) {
            child.removeOwner(ownerId);
            removeLock(child, ownerId);
        }
    }

    // Must not capture the container, or it would never become unreachable.
    private record Release(LockNode node) implements Runnable {
        @Override
        public void run() {
            release(node);
        }
    }
}
