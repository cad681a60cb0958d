package io.surfworks.tensordict.io;

import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.ScalarType;
import io.surfworks.tensordict.tensor.Tensor;
import io.surfworks.tensordict.testing.TensorAssert;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for reading, writing and mapping .npy files.
 */
@DisplayName("NpyIO Tests")
class NpyIOTest {

    @TempDir
    Path tempDir;

    @ParameterizedTest(name = "{0}")
    @EnumSource(ScalarType.class)
    @DisplayName("every dtype survives a write and read")
    void writeRead(ScalarType dtype) throws IOException {
        Tensor original = Tensor.ones(dtype, 2, 3);
        original.setDouble(0, 1, 2);
        Path file = tempDir.resolve(dtype + ".npy");

        NpyIO.write(original, file);
        Tensor loaded = NpyIO.read(file);

        assertArrayEquals(new int[]{2, 3}, loaded.shape());
        assertEquals(dtype, loaded.dtype());
        TensorAssert.assertEquals(original, loaded);
    }

    @Test
    @DisplayName("header data offset is 64-byte aligned")
    void headerAlignment() throws IOException {
        Path file = tempDir.resolve("aligned.npy");
        NpyIO.write(Tensor.zeros(4, 5), file);

        NpyHeader header = NpyIO.readHeader(file);
        assertEquals(0, header.dataOffset() % 64);
        assertEquals(header.dataOffset() + 4 * 5 * 4, Files.size(file));
    }

    @Test
    @DisplayName("non-contiguous views are written in logical order")
    void writesLogicalOrder() throws IOException {
        Tensor t = Tensor.fromFloatArray(new float[]{0, 1, 2, 3, 4, 5}, 2, 3).transpose(0, 1);
        Path file = tempDir.resolve("transposed.npy");

        NpyIO.write(t, file);

        assertArrayEquals(new float[]{0, 3, 1, 4, 2, 5}, NpyIO.read(file).toFloatArray());
    }

    @Test
    @DisplayName("writes through a writable mapping reach the file")
    void mappedWritesPersist() throws IOException {
        Path file = tempDir.resolve("mapped.npy");
        NpyIO.write(Tensor.zeros(3), file);

        Tensor mapped = NpyIO.map(file, true, Device.CPU);
        assertTrue(mapped.isMapped());
        mapped.fill(7);
        mapped.storage().force();

        Tensor reread = NpyIO.read(file);
        assertFalse(reread.isMapped());
        assertTrue(reread.allEqual(7));
    }

    @Test
    @DisplayName("mapped tensors carry the requested device tag")
    void mappedDevice() throws IOException {
        Path file = tempDir.resolve("device.npy");
        NpyIO.write(Tensor.zeros(2), file);

        assertEquals(Device.cuda(1), NpyIO.map(file, false, Device.cuda(1)).device());
    }

    @Test
    @DisplayName("bad magic is rejected")
    void badMagic() {
        byte[] bytes = "NOTNUMPY".getBytes();
        assertThrows(IOException.class, () -> NpyIO.read(new ByteArrayInputStream(bytes)));
    }
}
