package io.surfworks.tensordict;

/**
 * Source with a batch dimension of size 1 inserted.
 */
public final class UnsqueezedTensorDict extends TransformedTensorDict {

    UnsqueezedTensorDict(TensorDictBase source, ViewTransform.Unsqueeze unsqueeze) {
        super(source, unsqueeze);
    }

    public int unsqueezedDim() {
        return ((ViewTransform.Unsqueeze) transform()).dim();
    }
}
