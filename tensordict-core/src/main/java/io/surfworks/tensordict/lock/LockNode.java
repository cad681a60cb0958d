package io.surfworks.tensordict.lock;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lock bookkeeping for one container instance.
 *
 * <p>The node records which ancestors currently hold the container locked (by their node id),
 * its own locked flag, and the nodes it locked on the way down so that its contribution can be
 * withdrawn when it is released. Nodes never reference containers, so a {@link java.lang.ref.Cleaner}
 * can release them after the container became unreachable.
 *
 * <p>Every method must be called while holding the {@link LockGraph} monitor.
 */
public final class LockNode {

    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    private final long id;
    private final Set<Long> owners = new HashSet<>();
    private final List<LockNode> lockedChildren = new ArrayList<>();
    private boolean locked;
    private long generation;

    public LockNode() {
        this.id = NEXT_ID.getAndIncrement();
    }

    public long id() {
        return id;
    }

    public boolean isLocked() {
        return locked;
    }

    public void setLocked(boolean locked) {
        this.locked = locked;
    }

    public Set<Long> owners() {
        return Set.copyOf(owners);
    }

    public boolean hasOwners() {
        return !owners.isEmpty();
    }

    public void addOwners(Collection<Long> ids) {
        owners.addAll(ids);
    }

    public void removeOwners(Collection<Long> ids) {
        owners.removeAll(ids);
    }

    void removeOwner(long ownerId) {
        owners.remove(ownerId);
    }

    public void addLockedChild(LockNode child) {
        lockedChildren.add(child);
    }

    public int lockedChildCount() {
        return lockedChildren.size();
    }

    public void clearLockedChildren() {
        lockedChildren.clear();
    }

    List<LockNode> lockedChildren() {
        return lockedChildren;
    }

    /**
     * Incremented on every unlock; enumeration caches compare it to detect staleness.
     */
    public long generation() {
        return generation;
    }

    public void bumpGeneration() {
        generation++;
    }

    /**
     * Owner ids to hand to children: the given set plus this node's id.
     */
    public Set<Long> withSelf(Set<Long> ids) {
        Set<Long> result = new HashSet<>(ids);
        result.add(id);
        return result;
    }

    @Override
    public String toString() {
        return "LockNode[id=" + id + ", locked=" + locked + ", owners=" + owners + "]";
    }
}
