package io.surfworks.tensordict;

/**
 * Restores a container's previous lock state when closed.
 *
 * <pre>{@code
 * try (LockScope scope = td.lockScope()) {
 *     // td is locked here
 * }
 * }</pre>
 */
public final class LockScope implements AutoCloseable {

    private final Runnable restore;
    private boolean closed;

    LockScope(Runnable restore) {
        this.restore = restore;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            restore.run();
        }
    }
}
