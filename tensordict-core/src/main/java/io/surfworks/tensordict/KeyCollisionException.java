package io.surfworks.tensordict;

/**
 * Raised when two logical keys would map to the same entry.
 */
public class KeyCollisionException extends TensorDictException {

    public KeyCollisionException(String message) {
        super(message, ErrorCode.KEY_COLLISION);
    }
}
