package io.surfworks.tensordict.tensor;

import java.util.Arrays;
import java.util.Objects;

/**
 * One component of an indexing expression, following NumPy semantics.
 *
 * <p>{@link At}, {@link Slice}, {@link NewAxis} and {@link Ellipsis} are basic
 * components and always produce views. {@link Take} and {@link Mask} are advanced
 * components: reads gather into a copy, writes scatter into the source.
 */
public sealed interface Index permits Index.At, Index.Slice, Index.NewAxis, Index.Ellipsis,
        Index.Take, Index.Mask {

    /**
     * Single position along one dimension; the dimension is dropped.
     */
    record At(long position) implements Index {
    }

    /**
     * Python-style slice; null bounds mean "from the start" / "to the end".
     */
    record Slice(Long start, Long stop, long step) implements Index {
        public Slice {
            if (step <= 0) {
                throw new IllegalArgumentException("slice step must be positive, got " + step);
            }
        }
    }

    /**
     * Inserts a new dimension of size 1.
     */
    record NewAxis() implements Index {
    }

    /**
     * Expands to as many full slices as needed.
     */
    record Ellipsis() implements Index {
    }

    /**
     * Integer array index along one dimension.
     */
    record Take(long[] positions) implements Index {
        public Take {
            positions = positions.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Take that && Arrays.equals(positions, that.positions);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(positions);
        }

        @Override
        public String toString() {
            return "Take" + Arrays.toString(positions);
        }
    }

    /**
     * Boolean mask covering {@code mask.rank()} consecutive dimensions.
     */
    record Mask(Tensor mask) implements Index {
        public Mask {
            Objects.requireNonNull(mask, "mask cannot be null");
            if (mask.dtype() != ScalarType.BOOL) {
                throw new IllegalArgumentException("mask must have dtype BOOL, got " + mask.dtype());
            }
            if (mask.rank() == 0) {
                throw new IllegalArgumentException("mask must have at least one dimension");
            }
        }
    }

    // ==================== Factory Methods ====================

    static Index at(long position) {
        return new At(position);
    }

    static Index all() {
        return new Slice(null, null, 1);
    }

    static Index slice(long start, long stop) {
        return new Slice(start, stop, 1);
    }

    static Index slice(Long start, Long stop, long step) {
        return new Slice(start, stop, step);
    }

    static Index from(long start) {
        return new Slice(start, null, 1);
    }

    static Index to(long stop) {
        return new Slice(null, stop, 1);
    }

    static Index newAxis() {
        return new NewAxis();
    }

    static Index ellipsis() {
        return new Ellipsis();
    }

    static Index take(long... positions) {
        return new Take(positions);
    }

    static Index mask(Tensor mask) {
        return new Mask(mask);
    }

    /**
     * True for components that select by data (integer arrays and masks).
     */
    default boolean isAdvanced() {
        return this instanceof Take || this instanceof Mask;
    }

    /**
     * Number of source dimensions this component consumes.
     */
    default int consumedDims() {
        if (this instanceof Mask m) {
            return m.mask().rank();
        }
        if (this instanceof NewAxis || this instanceof Ellipsis) {
            return 0;
        }
        return 1;
    }
}
