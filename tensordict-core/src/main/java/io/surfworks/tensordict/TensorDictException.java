package io.surfworks.tensordict;

/**
 * Base exception for container operations.
 *
 * <p>Subclasses map to the error families callers can rely on; the {@link ErrorCode}
 * is carried for logging and for the few failures that have no dedicated subclass.
 */
public class TensorDictException extends RuntimeException {

    private final ErrorCode errorCode;

    public TensorDictException(String message) {
        this(message, ErrorCode.UNKNOWN);
    }

    public TensorDictException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public TensorDictException(String message, ErrorCode errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Container error codes.
     */
    public enum ErrorCode {
        /** Unknown or unclassified error */
        UNKNOWN,

        /** Value shape does not start with the batch size */
        SHAPE_MISMATCH,

        /** Two logical keys would alias after flatten/unflatten or a safe rename */
        KEY_COLLISION,

        /** Path not present */
        KEY_MISSING,

        /** Structural mutation of a locked container, or an unlock blocked by another owner */
        LOCKED_MUTATION,

        /** Operation not defined for this container variant */
        UNSUPPORTED_ON_PROXY,

        /** Wrong value or index type */
        TYPE_MISMATCH,

        /** Siblings live on different devices */
        DEVICE_MISMATCH,

        /** Siblings have different batch sizes */
        BATCH_SIZE_MISMATCH,

        /** Batch size of a derived container cannot be assigned */
        BATCH_SIZE_IMMUTABLE,

        /** Memmap already stored at a different location */
        MEMMAP_LOCATION,

        /** Reading or writing persisted data failed */
        IO_ERROR
    }

    public static TensorDictException memmapLocation(Object existing, Object requested) {
        return new TensorDictException(
            "TensorDict already contains MemmapTensors saved to a different location (" + existing
            + ", requested " + requested + "). Use copyExisting=true to copy them.",
            ErrorCode.MEMMAP_LOCATION);
    }
}
