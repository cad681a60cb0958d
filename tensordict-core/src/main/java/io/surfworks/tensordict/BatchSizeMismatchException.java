package io.surfworks.tensordict;

/**
 * Raised when composed containers have different batch sizes.
 */
public class BatchSizeMismatchException extends TensorDictException {

    public BatchSizeMismatchException(String message) {
        super(message, ErrorCode.BATCH_SIZE_MISMATCH);
    }
}
