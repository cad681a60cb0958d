package io.surfworks.tensordict;

import io.surfworks.tensordict.tensor.Tensor;

import java.util.Arrays;
import java.util.List;

/**
 * A transform over the batch dimensions of a container, applied uniformly to every leaf.
 *
 * <p>Trailing (non-batch) dimensions of leaves are never touched. Every transform has an
 * exact inverse, which is what lets a view write through to its source.
 */
sealed interface ViewTransform permits ViewTransform.Permute, ViewTransform.Transpose,
        ViewTransform.Squeeze, ViewTransform.Unsqueeze, ViewTransform.View {

    int[] forwardShape(int[] batchSize);

    List<String> forwardNames(List<String> names);

    Tensor forward(Tensor leaf);

    /**
     * Map a value shaped like the view back to the source layout.
     */
    Tensor inverse(Tensor value);

    TensorDictBase forward(TensorDictBase nested);

    TensorDictBase inverse(TensorDictBase value);

    /**
     * True if applying {@code this} after {@code other} is the identity.
     */
    boolean isInverseOf(ViewTransform other);

    TransformedTensorDict wrap(TensorDictBase source);

    // ==================== Variants ====================

    record Permute(int[] dims) implements ViewTransform {
        public Permute {
            dims = dims.clone();
        }

        @Override
        public int[] forwardShape(int[] batchSize) {
            int[] result = new int[dims.length];
            for (int i = 0; i < dims.length; i++) {
                result[i] = batchSize[dims[i]];
            }
            return result;
        }

        @Override
        public List<String> forwardNames(List<String> names) {
            return Invariants.permuted(names, dims);
        }

        @Override
        public Tensor forward(Tensor leaf) {
            return leaf.permute(extend(dims, leaf.rank()));
        }

        @Override
        public Tensor inverse(Tensor value) {
            return value.permute(extend(inverted(), value.rank()));
        }

        @Override
        public TensorDictBase forward(TensorDictBase nested) {
            return nested.permute(extend(dims, nested.batchDims()));
        }

        @Override
        public TensorDictBase inverse(TensorDictBase value) {
            return value.permute(extend(inverted(), value.batchDims()));
        }

        @Override
        public boolean isInverseOf(ViewTransform other) {
            return other instanceof Permute that && Arrays.equals(dims, that.inverted());
        }

        @Override
        public TransformedTensorDict wrap(TensorDictBase source) {
            return new PermutedTensorDict(source, this);
        }

        int[] inverted() {
            int[] inverse = new int[dims.length];
            for (int i = 0; i < dims.length; i++) {
                inverse[dims[i]] = i;
            }
            return inverse;
        }

        private static int[] extend(int[] dims, int rank) {
            int[] full = Arrays.copyOf(dims, rank);
            for (int i = dims.length; i < rank; i++) {
                full[i] = i;
            }
            return full;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Permute that && Arrays.equals(dims, that.dims);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(dims);
        }

        @Override
        public String toString() {
            return "Permute" + Arrays.toString(dims);
        }
    }

    record Transpose(int dim0, int dim1) implements ViewTransform {

        @Override
        public int[] forwardShape(int[] batchSize) {
            int[] result = batchSize.clone();
            result[dim0] = batchSize[dim1];
            result[dim1] = batchSize[dim0];
            return result;
        }

        @Override
        public List<String> forwardNames(List<String> names) {
            int[] dims = new int[names.size()];
            for (int i = 0; i < dims.length; i++) {
                dims[i] = i == dim0 ? dim1 : i == dim1 ? dim0 : i;
            }
            return Invariants.permuted(names, dims);
        }

        @Override
        public Tensor forward(Tensor leaf) {
            return leaf.transpose(dim0, dim1);
        }

        @Override
        public Tensor inverse(Tensor value) {
            return value.transpose(dim0, dim1);
        }

        @Override
        public TensorDictBase forward(TensorDictBase nested) {
            return nested.transpose(dim0, dim1);
        }

        @Override
        public TensorDictBase inverse(TensorDictBase value) {
            return value.transpose(dim0, dim1);
        }

        @Override
        public boolean isInverseOf(ViewTransform other) {
            return other instanceof Transpose that
                && ((dim0 == that.dim0 && dim1 == that.dim1) || (dim0 == that.dim1 && dim1 == that.dim0));
        }

        @Override
        public TransformedTensorDict wrap(TensorDictBase source) {
            return new TransposedTensorDict(source, this);
        }
    }

    /**
     * Removes a batch dimension of size 1.
     */
    record Squeeze(int dim) implements ViewTransform {

        @Override
        public int[] forwardShape(int[] batchSize) {
            return Invariants.remove(batchSize, dim);
        }

        @Override
        public List<String> forwardNames(List<String> names) {
            return Invariants.removed(names, dim);
        }

        @Override
        public Tensor forward(Tensor leaf) {
            return leaf.squeeze(dim);
        }

        @Override
        public Tensor inverse(Tensor value) {
            return value.unsqueeze(dim);
        }

        @Override
        public TensorDictBase forward(TensorDictBase nested) {
            return nested.squeeze(dim);
        }

        @Override
        public TensorDictBase inverse(TensorDictBase value) {
            return value.unsqueeze(dim);
        }

        @Override
        public boolean isInverseOf(ViewTransform other) {
            return other instanceof Unsqueeze that && that.dim == dim;
        }

        @Override
        public TransformedTensorDict wrap(TensorDictBase source) {
            return new SqueezedTensorDict(source, this);
        }
    }

    record Unsqueeze(int dim) implements ViewTransform {

        @Override
        public int[] forwardShape(int[] batchSize) {
            return Invariants.insert(batchSize, dim, 1);
        }

        @Override
        public List<String> forwardNames(List<String> names) {
            return Invariants.inserted(names, dim, null);
        }

        @Override
        public Tensor forward(Tensor leaf) {
            return leaf.unsqueeze(dim);
        }

        @Override
        public Tensor inverse(Tensor value) {
            return value.squeeze(dim);
        }

        @Override
        public TensorDictBase forward(TensorDictBase nested) {
            return nested.unsqueeze(dim);
        }

        @Override
        public TensorDictBase inverse(TensorDictBase value) {
            return value.squeeze(dim);
        }

        @Override
        public boolean isInverseOf(ViewTransform other) {
            return other instanceof Squeeze that && that.dim == dim;
        }

        @Override
        public TransformedTensorDict wrap(TensorDictBase source) {
            return new UnsqueezedTensorDict(source, this);
        }
    }

    /**
     * Reinterprets the batch dimensions with a new shape of the same element count.
     */
    record View(int[] sourceShape, int[] targetShape) implements ViewTransform {
        public View {
            sourceShape = sourceShape.clone();
            targetShape = targetShape.clone();
        }

        @Override
        public int[] forwardShape(int[] batchSize) {
            return targetShape.clone();
        }

        @Override
        public List<String> forwardNames(List<String> names) {
            return Invariants.unnamed(targetShape.length);
        }

        @Override
        public Tensor forward(Tensor leaf) {
            return leaf.view(Invariants.concat(targetShape, Invariants.trailing(leaf.shape(), sourceShape.length)));
        }

        @Override
        public Tensor inverse(Tensor value) {
            // written values need not be viewable
            return value.reshape(Invariants.concat(sourceShape, Invariants.trailing(value.shape(), targetShape.length)));
        }

        @Override
        public TensorDictBase forward(TensorDictBase nested) {
            return nested.view(Invariants.concat(targetShape,
                Invariants.trailing(nested.batchSize(), sourceShape.length)));
        }

        @Override
        public TensorDictBase inverse(TensorDictBase value) {
            return value.view(Invariants.concat(sourceShape,
                Invariants.trailing(value.batchSize(), targetShape.length)));
        }

        @Override
        public boolean isInverseOf(ViewTransform other) {
            return other instanceof View that
                && Arrays.equals(sourceShape, that.targetShape) && Arrays.equals(targetShape, that.sourceShape);
        }

        @Override
        public TransformedTensorDict wrap(TensorDictBase source) {
            return new ViewedTensorDict(source, this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof View that
                && Arrays.equals(sourceShape, that.sourceShape) && Arrays.equals(targetShape, that.targetShape);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(sourceShape) + Arrays.hashCode(targetShape);
        }

        @Override
        public String toString() {
            return "View" + Arrays.toString(sourceShape) + "->" + Arrays.toString(targetShape);
        }
    }
}
