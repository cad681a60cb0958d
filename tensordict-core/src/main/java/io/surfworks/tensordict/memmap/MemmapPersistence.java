package io.surfworks.tensordict.memmap;

import io.surfworks.tensordict.config.TensorDictConfig;
import io.surfworks.tensordict.io.NpyIO;
import io.surfworks.tensordict.tensor.Device;
import io.surfworks.tensordict.tensor.Tensor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Logger;

/**
 * File layout of memmapped containers.
 *
 * <p>Layout of one container directory:
 * <pre>
 * prefix/
 *   meta.json        container sidecar ({@link MemmapMetadata})
 *   obs.npy          one NumPy file per leaf
 *   nested/          one subdirectory per nested container
 *     meta.json
 *     ...
 * </pre>
 */
public final class MemmapPersistence {

    private static final Logger LOG = Logger.getLogger(MemmapPersistence.class.getName());

    public static final String NPY_SUFFIX = ".npy";

    private MemmapPersistence() {} // Utility class

    /**
     * Write a leaf to {@code dir/key.npy} and map the file back read-write.
     *
     * <p>The file is written next to its target and moved into place, so tensors still
     * mapped to a previous version of the file keep their data.
     *
     * @return a file-backed tensor with the leaf's shape, dtype and device
     */
    public static Tensor writeLeaf(Path dir, String key, Tensor leaf) throws IOException {
        Files.createDirectories(dir);
        Path file = leafPath(dir, key);
        Path staging = dir.resolve(checkFileKey(key) + NPY_SUFFIX + ".tmp");
        NpyIO.write(leaf, staging);
        Files.move(staging, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.fine(() -> "Wrote memmap leaf " + file);
        return NpyIO.map(file, true, leaf.device());
    }

    /**
     * Map an existing leaf file read-write.
     */
    public static Tensor mapLeaf(Path dir, String key, Device device) throws IOException {
        Path file = leafPath(dir, key);
        if (!Files.isRegularFile(file)) {
            throw new IOException("Missing memmap leaf file " + file);
        }
        return NpyIO.map(file, true, device != null ? device : Device.CPU);
    }

    public static Path leafPath(Path dir, String key) {
        return dir.resolve(checkFileKey(key) + NPY_SUFFIX);
    }

    /**
     * Directory of the nested container stored under {@code key}.
     */
    public static Path nestedPath(Path dir, String key) {
        return dir.resolve(checkFileKey(key));
    }

    /**
     * Check that a key names a single entry inside its container directory.
     *
     * @throws IllegalArgumentException for separators and relative path segments
     */
    public static String checkFileKey(String key) {
        if (".".equals(key) || "..".equals(key)
                || key.indexOf('/') >= 0 || key.indexOf('\\') >= 0 || key.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Key \"" + key + "\" cannot be stored as a memmap file name");
        }
        return key;
    }

    public static Path metadataPath(Path dir) {
        return dir.resolve(TensorDictConfig.global().metaFileName());
    }

    public static void writeMetadata(Path dir, MemmapMetadata metadata) throws IOException {
        Files.createDirectories(dir);
        Files.writeString(metadataPath(dir), metadata.toJson(), StandardCharsets.UTF_8);
    }

    /**
     * @throws IOException if the sidecar is missing or malformed
     */
    public static MemmapMetadata readMetadata(Path dir) throws IOException {
        Path file = metadataPath(dir);
        if (!Files.isRegularFile(file)) {
            throw new IOException("No memmap metadata found at " + file);
        }
        try {
            return MemmapMetadata.fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (RuntimeException e) {
            throw new IOException("Malformed memmap metadata " + file + ": " + e.getMessage(), e);
        }
    }

    public static boolean hasMetadata(Path dir) {
        return Files.isRegularFile(metadataPath(dir));
    }

    public static String deviceString(Device device) {
        return device == null ? null : device.toString();
    }

    public static Device parseDevice(String device) {
        return device == null ? null : Device.parse(device);
    }
}
