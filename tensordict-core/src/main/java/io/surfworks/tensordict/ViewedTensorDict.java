package io.surfworks.tensordict;

/**
 * Source batch dimensions reinterpreted with another shape of the same element count.
 * Leaves must be viewable (row-major over their batch dims).
 */
public final class ViewedTensorDict extends TransformedTensorDict {

    ViewedTensorDict(TensorDictBase source, ViewTransform.View view) {
        super(source, view);
    }

    public int[] sourceBatchSize() {
        return ((ViewTransform.View) transform()).sourceShape();
    }
}
