package io.surfworks.tensordict;

/**
 * Raised when an operation is not defined for a container variant.
 */
public class UnsupportedOnProxyException extends TensorDictException {

    public UnsupportedOnProxyException(String message) {
        super(message, ErrorCode.UNSUPPORTED_ON_PROXY);
    }
}
