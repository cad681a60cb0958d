package io.surfworks.tensordict;

/**
 * Raised when a value or batch size violates the batch-prefix invariant.
 */
public class ShapeMismatchException extends TensorDictException {

    public ShapeMismatchException(String message) {
        super(message, ErrorCode.SHAPE_MISMATCH);
    }

    public ShapeMismatchException(String message, Throwable cause) {
        super(message, ErrorCode.SHAPE_MISMATCH, cause);
    }
}
