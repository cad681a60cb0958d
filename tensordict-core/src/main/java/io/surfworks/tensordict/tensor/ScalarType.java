package io.surfworks.tensordict.tensor;

/**
 * Scalar element types for tensor leaves.
 * Provides byte size information and the NumPy dtype mapping used by memmap files.
 */
public enum ScalarType {
    F32(4, false, true),
    F64(8, false, true),

    I8(1, true, false),
    I16(2, true, false),
    I32(4, true, false),
    I64(8, true, false),
    BOOL(1, false, false);

    private final int byteSize;
    private final boolean isInteger;
    private final boolean isFloating;

    ScalarType(int byteSize, boolean isInteger, boolean isFloating) {
        this.byteSize = byteSize;
        this.isInteger = isInteger;
        this.isFloating = isFloating;
    }

    public int byteSize() {
        return byteSize;
    }

    public boolean isInteger() {
        return isInteger;
    }

    public boolean isFloating() {
        return isFloating;
    }

    /**
     * Parse from NumPy dtype string (e.g., "<f4", ">f8", "<i4").
     */
    public static ScalarType fromNpyDtype(String dtype) {
        // Strip byte order prefix if present
        String typeStr = dtype;
        if (dtype.startsWith("<") || dtype.startsWith(">") || dtype.startsWith("|") || dtype.startsWith("=")) {
            typeStr = dtype.substring(1);
        }

        return switch (typeStr) {
            case "f4" -> F32;
            case "f8" -> F64;
            case "i1" -> I8;
            case "i2" -> I16;
            case "i4" -> I32;
            case "i8" -> I64;
            case "u1" -> I8;  // Unsigned byte treated as signed for now
            case "b1", "?" -> BOOL;
            default -> throw new IllegalArgumentException("Unknown NumPy dtype: " + dtype);
        };
    }

    /**
     * Convert to NumPy dtype string (little-endian).
     */
    public String toNpyDtype() {
        return switch (this) {
            case F32 -> "<f4";
            case F64 -> "<f8";
            case BOOL -> "|b1";
            case I8 -> "|i1";
            case I16 -> "<i2";
            case I32 -> "<i4";
            case I64 -> "<i8";
        };
    }

    /**
     * Type a binary operation between the two types would produce.
     * Used when values of different dtypes are stacked or concatenated.
     */
    public static ScalarType promote(ScalarType a, ScalarType b) {
        if (a == b) {
            return a;
        }
        if (a.isFloating || b.isFloating) {
            return (a == F64 || b == F64) ? F64 : F32;
        }
        if (a == BOOL) {
            return b;
        }
        if (b == BOOL) {
            return a;
        }
        return a.byteSize >= b.byteSize ? a : b;
    }
}
