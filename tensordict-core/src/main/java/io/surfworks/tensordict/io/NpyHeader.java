package io.surfworks.tensordict.io;

import io.surfworks.tensordict.tensor.ScalarType;

import java.nio.ByteOrder;
import java.util.HashMap;
import java.util.Map;

/**
 * Header of a NumPy .npy file: element type, layout, and the file offset where element data begins.
 *
 * <p>The header text is a Python dict literal such as
 * {@code {'descr': '<f4', 'fortran_order': False, 'shape': (2, 3), }}. Only the three keys NumPy
 * writes are interpreted; any others are ignored.
 */
public record NpyHeader(
    int majorVersion,
    int minorVersion,
    ScalarType dtype,
    ByteOrder byteOrder,
    boolean fortranOrder,
    int[] shape,
    long dataOffset
) {

    /** Element data of files written here starts on a multiple of this many bytes. */
    public static final int ALIGNMENT = 64;

    // magic (6) + version (2) + header length (2)
    static final int PREAMBLE_V1 = 10;

    /**
     * Header for a row-major little-endian version 1.0 file. The data offset follows from the padded header.
     */
    public static NpyHeader forWrite(ScalarType dtype, int[] shape) {
        NpyHeader draft = new NpyHeader(1, 0, dtype, ByteOrder.LITTLE_ENDIAN, false, shape.clone(), -1);
        return new NpyHeader(1, 0, dtype, ByteOrder.LITTLE_ENDIAN, false, draft.shape(),
            PREAMBLE_V1 + (long) draft.toPaddedHeaderString().length());
    }

    /**
     * Interpret a header dict read from a file.
     *
     * @param dataOffset offset of the first element byte, right after the header text
     * @throws IllegalArgumentException if {@code descr} or {@code shape} is missing or malformed
     */
    public static NpyHeader parse(int majorVersion, int minorVersion, String headerStr, long dataOffset) {
        Map<String, String> fields = fields(headerStr);
        String descr = fields.get("descr");
        if (descr == null) {
            throw new IllegalArgumentException("Missing 'descr' in header: " + headerStr);
        }
        String shapeLiteral = fields.get("shape");
        if (shapeLiteral == null) {
            throw new IllegalArgumentException("Missing 'shape' in header: " + headerStr);
        }
        return new NpyHeader(majorVersion, minorVersion, ScalarType.fromNpyDtype(descr), byteOrderOf(descr),
            "True".equals(fields.get("fortran_order")), dims(shapeLiteral), dataOffset);
    }

    /**
     * Raw values of a dict literal by key. Quoted strings lose their quotes and tuples their parentheses.
     */
    private static Map<String, String> fields(String dict) {
        int open = dict.indexOf('{');
        if (open < 0) {
            throw new IllegalArgumentException("Header is not a dict literal: " + dict);
        }
        Map<String, String> result = new HashMap<>();
        int pos = open + 1;
        while (true) {
            int keyStart = dict.indexOf('\'', pos);
            if (keyStart < 0) {
                return result;
            }
            int keyEnd = dict.indexOf('\'', keyStart + 1);
            int colon = keyEnd < 0 ? -1 : dict.indexOf(':', keyEnd);
            if (colon < 0) {
                throw new IllegalArgumentException("Malformed header: " + dict);
            }
            int start = colon + 1;
            while (start < dict.length() && dict.charAt(start) == ' ') {
                start++;
            }
            if (start >= dict.length()) {
                throw new IllegalArgumentException("Malformed header: " + dict);
            }
            String value;
            char first = dict.charAt(start);
            if (first == '\'' || first == '(') {
                int close = dict.indexOf(first == '\'' ? '\'' : ')', start + 1);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated value in header: " + dict);
                }
                value = dict.substring(start + 1, close);
                pos = close + 1;
            } else {
                int end = start;
                while (end < dict.length() && dict.charAt(end) != ',' && dict.charAt(end) != '}') {
                    end++;
                }
                value = dict.substring(start, end).trim();
                pos = end;
            }
            result.put(dict.substring(keyStart + 1, keyEnd), value);
        }
    }

    private static ByteOrder byteOrderOf(String descr) {
        if (descr.isEmpty()) {
            return ByteOrder.LITTLE_ENDIAN;
        }
        return switch (descr.charAt(0)) {
            case '>' -> ByteOrder.BIG_ENDIAN;
            case '=' -> ByteOrder.nativeOrder();
            default -> ByteOrder.LITTLE_ENDIAN; // '<' and '|' (single byte)
        };
    }

    // "2, 3", "3," or "" for a scalar
    private static int[] dims(String tuple) {
        String[] parts = tuple.split(",");
        int[] buffer = new int[parts.length];
        int rank = 0;
        for (String part : parts) {
            String dim = part.trim();
            if (dim.isEmpty()) {
                continue;
            }
            try {
                buffer[rank++] = Integer.parseInt(dim);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid dimension '" + dim + "' in shape (" + tuple + ")", e);
            }
        }
        int[] result = new int[rank];
        System.arraycopy(buffer, 0, result, 0, rank);
        return result;
    }

    /**
     * The header dict as NumPy writes it, without padding.
     */
    public String toHeaderString() {
        StringBuilder tuple = new StringBuilder();
        for (int i = 0; i < shape.length; i++) {
            if (i > 0) {
                tuple.append(", ");
            }
            tuple.append(shape[i]);
        }
        if (shape.length == 1) {
            tuple.append(',');
        }
        return "{'descr': '" + dtype.toNpyDtype() + "', 'fortran_order': " + (fortranOrder ? "True" : "False")
            + ", 'shape': (" + tuple + "), }";
    }

    /**
     * The header dict followed by space padding and a newline, so that the data of a
     * version 1.0 file starts on an {@link #ALIGNMENT} boundary.
     */
    public String toPaddedHeaderString() {
        String dict = toHeaderString();
        int unpadded = PREAMBLE_V1 + dict.length() + 1;
        int padding = (ALIGNMENT - unpadded % ALIGNMENT) % ALIGNMENT;
        return dict + " ".repeat(padding) + "\n";
    }

    /**
     * Element data is stored big-endian and cannot be mapped directly.
     */
    public boolean needsByteSwap() {
        return byteOrder == ByteOrder.BIG_ENDIAN && dtype.byteSize() > 1;
    }
}
