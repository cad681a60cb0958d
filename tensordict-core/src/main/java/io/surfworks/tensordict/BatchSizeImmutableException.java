package io.surfworks.tensordict;

/**
 * Raised when assigning the batch size of a derived container.
 */
public class BatchSizeImmutableException extends TensorDictException {

    public BatchSizeImmutableException(String message) {
        super(message, ErrorCode.BATCH_SIZE_IMMUTABLE);
    }
}
