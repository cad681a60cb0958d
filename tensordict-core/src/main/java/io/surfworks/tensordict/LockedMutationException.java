package io.surfworks.tensordict;

/**
 * Raised on structural mutation of a locked container, or when an unlock is blocked by another owner.
 */
public class LockedMutationException extends TensorDictException {

    public LockedMutationException(String message) {
        super(message, ErrorCode.LOCKED_MUTATION);
    }

    public static LockedMutationException locked() {
        return new LockedMutationException(
            "Cannot modify locked TensorDict. For in-place modification, consider using the `setInPlace()` "
            + "method and make sure the key is present in the TensorDict.");
    }

    public static LockedMutationException partOfLockedGraph() {
        return new LockedMutationException(
            "Cannot unlock a tensordict that is part of a locked graph. Unlock the root tensordict first. "
            + "If the tensordict is part of multiple graphs, group the graphs under a common tensordict "
            + "and unlock this root.");
    }
}
