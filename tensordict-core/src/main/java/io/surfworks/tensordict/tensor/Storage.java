package io.surfworks.tensordict.tensor;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Flat, typed element buffer shared by every view of a tensor.
 *
 * <p>Backed either by a heap buffer or by a memory-mapped file region. Elements are
 * little-endian and addressed by element index, not byte offset.
 */
public final class Storage {

    private final ByteBuffer buffer;
    private final ScalarType dtype;
    private final long length;
    private final Path file;

    private Storage(ByteBuffer buffer, ScalarType dtype, long length, Path file) {
        this.buffer = buffer.order(ByteOrder.LITTLE_ENDIAN);
        this.dtype = dtype;
        this.length = length;
        this.file = file;
    }

    /**
     * Allocate a zero-filled heap storage.
     */
    public static Storage allocate(ScalarType dtype, long length) {
        long bytes = length * dtype.byteSize();
        if (bytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Storage of " + bytes + " bytes exceeds the 2 GiB buffer limit");
        }
        return new Storage(ByteBuffer.allocate((int) bytes), dtype, length, null);
    }

    /**
     * Map a region of a file as storage.
     *
     * @param file        file to map
     * @param byteOffset  offset of the first element in the file
     * @param dtype       element type
     * @param length      number of elements
     * @param writable    map read-write when true, read-only otherwise
     */
    public static Storage map(Path file, long byteOffset, ScalarType dtype, long length, boolean writable)
            throws IOException {
        long bytes = length * dtype.byteSize();
        if (bytes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Mapped region of " + bytes + " bytes exceeds the 2 GiB buffer limit");
        }
        StandardOpenOption[] options = writable
            ? new StandardOpenOption[]{StandardOpenOption.READ, StandardOpenOption.WRITE}
            : new StandardOpenOption[]{StandardOpenOption.READ};
        try (FileChannel channel = FileChannel.open(file, options)) {
            MappedByteBuffer mapped = channel.map(
                writable ? FileChannel.MapMode.READ_WRITE : FileChannel.MapMode.READ_ONLY,
                byteOffset, bytes);
            return new Storage(mapped, dtype, length, file);
        }
    }

    public ScalarType dtype() {
        return dtype;
    }

    public long length() {
        return length;
    }

    /**
     * Backing file, or null for heap storage.
     */
    public Path file() {
        return file;
    }

    public boolean isMapped() {
        return file != null;
    }

    public boolean isReadOnly() {
        return buffer.isReadOnly();
    }

    /**
     * Flush a mapped region to its file. No-op for heap storage.
     */
    public void force() {
        if (buffer instanceof MappedByteBuffer mapped) {
            mapped.force();
        }
    }

    // ==================== Element Access ====================

    public double getDouble(long index) {
        int pos = position(index);
        return switch (dtype) {
            case F32 -> buffer.getFloat(pos);
            case F64 -> buffer.getDouble(pos);
            case I8 -> buffer.get(pos);
            case I16 -> buffer.getShort(pos);
            case I32 -> buffer.getInt(pos);
            case I64 -> buffer.getLong(pos);
            case BOOL -> buffer.get(pos) != 0 ? 1.0 : 0.0;
        };
    }

    public long getLong(long index) {
        int pos = position(index);
        return switch (dtype) {
            case F32 -> (long) buffer.getFloat(pos);
            case F64 -> (long) buffer.getDouble(pos);
            case I8 -> buffer.get(pos);
            case I16 -> buffer.getShort(pos);
            case I32 -> buffer.getInt(pos);
            case I64 -> buffer.getLong(pos);
            case BOOL -> buffer.get(pos) != 0 ? 1L : 0L;
        };
    }

    public void setDouble(long index, double value) {
        int pos = position(index);
        switch (dtype) {
            case F32 -> buffer.putFloat(pos, (float) value);
            case F64 -> buffer.putDouble(pos, value);
            case I8 -> buffer.put(pos, (byte) (long) value);
            case I16 -> buffer.putShort(pos, (short) (long) value);
            case I32 -> buffer.putInt(pos, (int) (long) value);
            case I64 -> buffer.putLong(pos, (long) value);
            case BOOL -> buffer.put(pos, value != 0.0 ? (byte) 1 : (byte) 0);
        }
    }

    public void setLong(long index, long value) {
        int pos = position(index);
        switch (dtype) {
            case F32 -> buffer.putFloat(pos, (float) value);
            case F64 -> buffer.putDouble(pos, (double) value);
            case I8 -> buffer.put(pos, (byte) value);
            case I16 -> buffer.putShort(pos, (short) value);
            case I32 -> buffer.putInt(pos, (int) value);
            case I64 -> buffer.putLong(pos, value);
            case BOOL -> buffer.put(pos, value != 0 ? (byte) 1 : (byte) 0);
        }
    }

    /**
     * Copy raw bytes of a contiguous element range into {@code dst}.
     */
    public void readBytes(long firstElement, byte[] dst) {
        if (dst.length == 0) {
            return;
        }
        ByteBuffer view = buffer.duplicate();
        view.position(position(firstElement));
        view.get(dst);
    }

    /**
     * Overwrite a contiguous element range with raw little-endian bytes.
     */
    public void writeBytes(long firstElement, byte[] src) {
        if (src.length == 0) {
            return;
        }
        ByteBuffer view = buffer.duplicate();
        view.position(position(firstElement));
        view.put(src);
    }

    private int position(long index) {
        if (index < 0 || index >= length) {
            throw new IndexOutOfBoundsException(
                "Element " + index + " out of bounds for storage of length " + length);
        }
        return (int) (index * dtype.byteSize());
    }

    @Override
    public String toString() {
        return "Storage[dtype=" + dtype + ", length=" + length + (file != null ? ", file=" + file : "") + "]";
    }
}
