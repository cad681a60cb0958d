package io.surfworks.tensordict.io;

import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.ScalarType;
import io.surfworks.tensordict.tensor.Storage;
import io.surfworks.tensordict.tensor.Tensor;
import io.surfworks.tensordict.tensor.TensorSpec;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * NumPy .npy file I/O for reading, writing and memory-mapping tensor leaves.
 *
 * The .npy format stores a single NumPy array with:
 * - Magic number: \x93NUMPY
 * - Version: 1.0, 2.0, or 3.0
 * - Header: Python dict with dtype, shape, fortran_order
 * - Data: Raw binary array data
 */
public final class NpyIO {

    // Magic bytes: \x93NUMPY
    private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};

    private NpyIO() {} // Utility class

    // ==================== Reading ====================

    /**
     * Read a tensor from a .npy file into heap memory.
     */
    public static Tensor read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             BufferedInputStream bis = new BufferedInputStream(is)) {
            return read(bis);
        }
    }

    /**
     * Read a tensor from an input stream.
     */
    public static Tensor read(InputStream in) throws IOException {
        DataInputStream dis = new DataInputStream(in);
        NpyHeader header = readHeader(dis);

        TensorSpec spec = layoutOf(header);
        Storage storage = Storage.allocate(header.dtype(), spec.elementCount());

        byte[] dataBytes = new byte[(int) spec.byteSize()];
        dis.readFully(dataBytes);

        if (header.needsByteSwap()) {
            dataBytes = swapBytes(dataBytes, header.dtype());
        }
        storage.writeBytes(0, dataBytes);
        return Tensor.wrap(storage, spec, Device.CPU);
    }

    /**
     * Memory-map a .npy file without reading its element data.
     *
     * @param path     file to map
     * @param writable map read-write so that writes reach the file
     * @param device   device tag carried by the returned tensor
     */
    public static Tensor map(Path path, boolean writable, Device device) throws IOException {
        NpyHeader header = readHeader(path);
        if (header.needsByteSwap()) {
            throw new IOException("Cannot memory-map big-endian array " + path + "; use read() instead");
        }
        TensorSpec spec = layoutOf(header);
        Storage storage = Storage.map(path, header.dataOffset(), header.dtype(), spec.elementCount(), writable);
        return Tensor.wrap(storage, spec, device);
    }

    private static TensorSpec layoutOf(NpyHeader header) {
        if (header.fortranOrder()) {
            long[] strides = TensorSpec.computeColumnMajorStrides(header.shape());
            return TensorSpec.withStrides(header.dtype(), header.shape(), strides);
        }
        return TensorSpec.of(header.dtype(), header.shape());
    }

    /**
     * Reverse the byte order of every element of a big-endian buffer.
     */
    private static byte[] swapBytes(byte[] data, ScalarType dtype) {
        ByteBuffer source = ByteBuffer.wrap(data).order(ByteOrder.BIG_ENDIAN);
        ByteBuffer target = ByteBuffer.allocate(data.length).order(ByteOrder.LITTLE_ENDIAN);
        int elementCount = data.length / dtype.byteSize();

        switch (dtype) {
            case F32 -> {
                for (int i = 0; i < elementCount; i++) {
                    target.putFloat(i * 4, source.getFloat(i * 4));
                }
            }
            case F64 -> {
                for (int i = 0; i < elementCount; i++) {
                    target.putDouble(i * 8, source.getDouble(i * 8));
                }
            }
            case I16 -> {
                for (int i = 0; i < elementCount; i++) {
                    target.putShort(i * 2, source.getShort(i * 2));
                }
            }
            case I32 -> {
                for (int i = 0; i < elementCount; i++) {
                    target.putInt(i * 4, source.getInt(i * 4));
                }
            }
            case I64 -> {
                for (int i = 0; i < elementCount; i++) {
                    target.putLong(i * 8, source.getLong(i * 8));
                }
            }
            default -> {
                // Single-byte types don't need swapping
                return data;
            }
        }
        return target.array();
    }

    // ==================== Writing ====================

    /**
     * Write a tensor to a .npy file.
     */
    public static void write(Tensor tensor, Path path) throws IOException {
        try (OutputStream os = Files.newOutputStream(path);
             BufferedOutputStream bos = new BufferedOutputStream(os)) {
            write(tensor, bos);
        }
    }

    /**
     * Write a tensor to an output stream, in row-major order.
     */
    public static void write(Tensor tensor, OutputStream out) throws IOException {
        DataOutputStream dos = new DataOutputStream(out);

        dos.write(MAGIC);

        NpyHeader header = NpyHeader.forWrite(tensor.dtype(), tensor.shape());
        String headerStr = header.toPaddedHeaderString();

        dos.writeByte(header.majorVersion());
        dos.writeByte(header.minorVersion());

        // Header length (little-endian)
        dos.writeByte(headerStr.length() & 0xFF);
        dos.writeByte((headerStr.length() >> 8) & 0xFF);

        dos.write(headerStr.getBytes(StandardCharsets.US_ASCII));

        Tensor contiguous = tensor.contiguous();
        byte[] dataBytes = new byte[(int) contiguous.spec().byteSize()];
        contiguous.storage().readBytes(contiguous.spec().offset(), dataBytes);
        dos.write(dataBytes);
        dos.flush();
    }

    // ==================== Header Parsing ====================

    /**
     * Read only the header from a .npy file (useful for metadata inspection).
     */
    public static NpyHeader readHeader(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             BufferedInputStream bis = new BufferedInputStream(is)) {
            return readHeader(bis);
        }
    }

    /**
     * Read only the header from an input stream.
     */
    public static NpyHeader readHeader(InputStream in) throws IOException {
        DataInputStream dis = in instanceof DataInputStream d ? d : new DataInputStream(in);

        byte[] magic = new byte[6];
        dis.readFully(magic);
        for (int i = 0; i < MAGIC.length; i++) {
            if (magic[i] != MAGIC[i]) {
                throw new IOException("Invalid NumPy magic number");
            }
        }

        int majorVersion = dis.readUnsignedByte();
        int minorVersion = dis.readUnsignedByte();

        int headerLen;
        int prefixLen;
        if (majorVersion == 1) {
            // Version 1.0: 2-byte header length
            int b0 = dis.readUnsignedByte();
            int b1 = dis.readUnsignedByte();
            headerLen = b0 | (b1 << 8);
            prefixLen = 10;
        } else {
            // Version 2.0+: 4-byte header length
            int b0 = dis.readUnsignedByte();
            int b1 = dis.readUnsignedByte();
            int b2 = dis.readUnsignedByte();
            int b3 = dis.readUnsignedByte();
            headerLen = b0 | (b1 << 8) | (b2 << 16) | (b3 << 24);
            prefixLen = 12;
        }

        byte[] headerBytes = new byte[headerLen];
        dis.readFully(headerBytes);
        String headerStr = new String(headerBytes, StandardCharsets.US_ASCII).trim();

        return NpyHeader.parse(majorVersion, minorVersion, headerStr, prefixLen + (long) headerLen);
    }
}
