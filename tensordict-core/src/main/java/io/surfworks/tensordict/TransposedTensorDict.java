package io.surfworks.tensordict;

/**
 * Two batch dimensions of the source swapped.
 */
public final class TransposedTensorDict extends TransformedTensorDict {

    TransposedTensorDict(TensorDictBase source, ViewTransform.Transpose transpose) {
        super(source, transpose);
    }

    public int[] swappedDims() {
        ViewTransform.Transpose transpose = (ViewTransform.Transpose) transform();
        return new int[]{transpose.dim0(), transpose.dim1()};
    }
}
