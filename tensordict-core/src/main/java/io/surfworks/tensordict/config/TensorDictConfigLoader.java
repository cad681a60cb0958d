package io.surfworks.tensordict.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.surfworks.tensordict.tensor.Device;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves TensorDictConfig.
 *
 * <p>A missing file yields the defaults. An unreadable file is reported and also yields
 * the defaults, so a broken user config never prevents containers from being built.
 */
public final class TensorDictConfigLoader {

    private static final Logger LOG = Logger.getLogger(TensorDictConfigLoader.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    private TensorDictConfigLoader() {
    }

    /**
     * Loads configuration from the default config file.
     *
     * @return the loaded configuration
     */
    public static TensorDictConfig load() {
        return load(TensorDictConfig.configFile());
    }

    /**
     * Loads configuration from a specific file.
     *
     * @param configFile path to the config file
     * @return the loaded configuration
     */
    public static TensorDictConfig load(Path configFile) {
        TensorDictConfig config = TensorDictConfig.defaults();

        if (Files.exists(configFile)) {
            config = loadFromFile(configFile, config);
        }

        return config;
    }

    /**
     * Saves configuration to a specific file.
     *
     * @param config     the configuration to save
     * @param configFile path to write the config
     * @throws IOException if saving fails
     */
    public static void save(TensorDictConfig config, Path configFile) throws IOException {
        if (configFile.getParent() != null) {
            Files.createDirectories(configFile.getParent());
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("separator", config.separator());
        root.put("metaFileName", config.metaFileName());
        root.put("memmapTempDir", config.memmapTempDir().toString());
        if (config.defaultDevice() != null) {
            root.put("defaultDevice", config.defaultDevice().toString());
        }
        root.put("stackKeyDiscovery", config.stackKeyDiscovery());

        JSON.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), root);
    }

    private static TensorDictConfig loadFromFile(Path configFile, TensorDictConfig base) {
        try {
            JsonNode root = JSON.readTree(configFile.toFile());
            if (root == null || !root.isObject()) {
                LOG.warning("Ignoring config file " + configFile + ": expected a JSON object");
                return base;
            }

            TensorDictConfig config = base
                    .withSeparator(getStringOrDefault(root, "separator", base.separator()))
                    .withMetaFileName(getStringOrDefault(root, "metaFileName", base.metaFileName()));

            if (root.has("memmapTempDir")) {
                config = config.withMemmapTempDir(Path.of(root.get("memmapTempDir").asText()));
            }
            if (root.has("defaultDevice") && !root.get("defaultDevice").isNull()) {
                config = config.withDefaultDevice(Device.parse(root.get("defaultDevice").asText()));
            }
            if (root.has("stackKeyDiscovery")) {
                config = config.withStackKeyDiscovery(root.get("stackKeyDiscovery").asBoolean(true));
            }

            LOG.fine("Loaded tensordict config from " + configFile);
            return config;

        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable config file " + configFile, e);
            return base;
        }
    }

    private static String getStringOrDefault(JsonNode node, String field, String defaultValue) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        return value.asText();
    }
}
