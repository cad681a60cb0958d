package io.surfworks.tensordict.config;

import io.surfworks.tensordict.tensor.Device;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Process-wide defaults for containers.
 *
 * <p>Configuration is loaded in order of precedence:
 * <ol>
 *   <li>Values set programmatically with {@link #setGlobal(TensorDictConfig)}</li>
 *   <li>Config file ({@code ~/.config/tensordict/config.json}, or the file named by the
 *       {@code tensordict.config} system property)</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * @param separator         separator used by flattenKeys/unflattenKeys when none is given
 * @param metaFileName      name of the metadata sidecar written next to memmap leaves
 * @param memmapTempDir     parent directory for anonymous memmaps
 * @param defaultDevice     device assigned to containers built without one (may be null)
 * @param stackKeyDiscovery whether a lazy stack re-derives its key set when a key is missing
 */
public record TensorDictConfig(
        String separator,
        String metaFileName,
        Path memmapTempDir,
        Device defaultDevice,
        boolean stackKeyDiscovery
) {

    /** Default key separator */
    public static final String DEFAULT_SEPARATOR = ".";

    /** Default metadata file name */
    public static final String DEFAULT_META_FILE = "meta.json";

    /** Config directory */
    public static final Path CONFIG_DIR = Path.of(
            System.getProperty("user.home"), ".config", "tensordict"
    );

    /** Config file name */
    public static final String CONFIG_FILE = "config.json";

    /** System property overriding the config file location */
    public static final String CONFIG_PROPERTY = "tensordict.config";

    private static volatile TensorDictConfig global;

    public TensorDictConfig {
        Objects.requireNonNull(separator, "separator cannot be null");
        Objects.requireNonNull(metaFileName, "metaFileName cannot be null");
        Objects.requireNonNull(memmapTempDir, "memmapTempDir cannot be null");

        if (separator.isEmpty()) {
            throw new IllegalArgumentException("separator cannot be empty");
        }
        if (metaFileName.isBlank()) {
            throw new IllegalArgumentException("metaFileName cannot be blank");
        }
        if (metaFileName.endsWith(".npy")) {
            throw new IllegalArgumentException("metaFileName cannot use the leaf extension .npy");
        }
    }

    /**
     * Returns the default configuration.
     */
    public static TensorDictConfig defaults() {
        return new TensorDictConfig(
                DEFAULT_SEPARATOR,
                DEFAULT_META_FILE,
                Path.of(System.getProperty("java.io.tmpdir")),
                null,
                true
        );
    }

    /**
     * Returns the config file path.
     */
    public static Path configFile() {
        String override = System.getProperty(CONFIG_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Path.of(override);
        }
        return CONFIG_DIR.resolve(CONFIG_FILE);
    }

    /**
     * The active configuration, loaded from the config file on first use.
     */
    public static TensorDictConfig global() {
        TensorDictConfig config = global;
        if (config == null) {
            synchronized (TensorDictConfig.class) {
                config = global;
                if (config == null) {
                    config = TensorDictConfigLoader.load();
                    global = config;
                }
            }
        }
        return config;
    }

    /**
     * Replace the active configuration.
     */
    public static void setGlobal(TensorDictConfig config) {
        global = Objects.requireNonNull(config, "config cannot be null");
    }

    public TensorDictConfig withSeparator(String sep) {
        return new TensorDictConfig(sep, metaFileName, memmapTempDir, defaultDevice, stackKeyDiscovery);
    }

    public TensorDictConfig withMetaFileName(String name) {
        return new TensorDictConfig(separator, name, memmapTempDir, defaultDevice, stackKeyDiscovery);
    }

    public TensorDictConfig withMemmapTempDir(Path dir) {
        return new TensorDictConfig(separator, metaFileName, dir, defaultDevice, stackKeyDiscovery);
    }

    public TensorDictConfig withDefaultDevice(Device device) {
        return new TensorDictConfig(separator, metaFileName, memmapTempDir, device, stackKeyDiscovery);
    }

    public TensorDictConfig withStackKeyDiscovery(boolean enabled) {
        return new TensorDictConfig(separator, metaFileName, memmapTempDir, defaultDevice, enabled);
    }
}
