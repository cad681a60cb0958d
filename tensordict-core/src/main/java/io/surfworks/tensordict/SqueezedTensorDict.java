package io.surfworks.tensordict;

/**
 * Source with one batch dimension of size 1 removed.
 */
public final class SqueezedTensorDict extends TransformedTensorDict {

    SqueezedTensorDict(TensorDictBase source, ViewTransform.Squeeze squeeze) {
        super(source, squeeze);
    }

    public int squeezedDim() {
        return ((ViewTransform.Squeeze) transform()).dim();
    }
}
