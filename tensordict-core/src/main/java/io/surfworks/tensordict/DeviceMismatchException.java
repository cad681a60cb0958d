package io.surfworks.tensordict;

/**
 * Raised when composed containers live on different devices.
 */
public class DeviceMismatchException extends TensorDictException {

    public DeviceMismatchException(String message) {
        super(message, ErrorCode.DEVICE_MISMATCH);
    }
}
