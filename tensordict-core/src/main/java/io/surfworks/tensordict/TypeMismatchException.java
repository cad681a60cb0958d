package io.surfworks.tensordict;

/**
 * Raised when a value or index has the wrong type.
 */
public class TypeMismatchException extends TensorDictException {

    public TypeMismatchException(String message) {
        super(message, ErrorCode.TYPE_MISMATCH);
    }
}
