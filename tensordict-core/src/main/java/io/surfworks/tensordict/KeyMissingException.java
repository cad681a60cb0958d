package io.surfworks.tensordict;

import java.util.Collection;

/**
 * Raised when a key path is not present.
 */
public class KeyMissingException extends TensorDictException {

    private final NestedKey key;

    public KeyMissingException(String message, NestedKey key) {
        super(message, ErrorCode.KEY_MISSING);
        this.key = key;
    }

    /**
     * The path that was looked up.
     */
    public NestedKey key() {
        return key;
    }

    public static KeyMissingException notFound(NestedKey key, Collection<String> available) {
        return new KeyMissingException(
            "key \"" + key + "\" not found in TensorDict with keys " + available, key);
    }
}
