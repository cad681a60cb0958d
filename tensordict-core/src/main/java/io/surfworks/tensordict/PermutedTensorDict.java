package io.surfworks.tensordict;

/**
 * Batch dimensions of the source reordered: dim {@code i} of the view is dim {@code dims[i]} of the source.
 */
public final class PermutedTensorDict extends TransformedTensorDict {

    PermutedTensorDict(TensorDictBase source, ViewTransform.Permute permute) {
        super(source, permute);
    }

    /**
     * Source dimension of each view dimension.
     */
    public int[] dims() {
        return ((ViewTransform.Permute) transform()).dims();
    }
}
