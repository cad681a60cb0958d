package io.surfworks.tensordict.memmap;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Contents of the {@code meta.json} sidecar written next to memmapped leaves.
 *
 * <p>A plain container directory lists its entries in insertion order: leaves with their
 * shape, dtype and device, nested containers with their type (their own sidecar lives in
 * the subdirectory of the same name). A stack directory only records the stack dimension
 * and the child count; children live in {@code 0/}, {@code 1/}, ...
 *
 * @param type      container type, {@code "TensorDict"} or {@code "LazyStackedTensorDict"}
 * @param batchSize batch size of the container
 * @param device    device string, or null
 * @param names     dimension names (entries may be null)
 * @param entries   entries in insertion order (empty for stacks)
 * @param stackDim  stack dimension, or -1 for plain containers
 * @param count     number of stacked children, or 0 for plain containers
 */
public record MemmapMetadata(
    String type,
    int[] batchSize,
    String device,
    List<String> names,
    Map<String, Entry> entries,
    int stackDim,
    int count
) {

    public static final String TENSORDICT = "TensorDict";
    public static final String LAZY_STACKED = "LazyStackedTensorDict";

    public static final String KIND_TENSOR = "tensor";
    public static final String KIND_TENSORDICT = "tensordict";

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    public MemmapMetadata {
        Objects.requireNonNull(type, "type cannot be null");
        batchSize = batchSize.clone();
        names = Collections.unmodifiableList(new ArrayList<>(names));
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /**
     * One entry of a plain container.
     *
     * @param kind   {@link #KIND_TENSOR} or {@link #KIND_TENSORDICT}
     * @param shape  leaf shape (null for nested containers)
     * @param dtype  NumPy dtype descriptor (null for nested containers)
     * @param device leaf device string, or null
     * @param type   nested container type (null for leaves)
     */
    public record Entry(String kind, int[] shape, String dtype, String device, String type) {

        public static Entry tensor(int[] shape, String dtype, String device) {
            return new Entry(KIND_TENSOR, shape.clone(), dtype, device, null);
        }

        public static Entry nested(String type) {
            return new Entry(KIND_TENSORDICT, null, null, null, type);
        }

        public boolean isTensor() {
            return KIND_TENSOR.equals(kind);
        }
    }

    public static MemmapMetadata forStack(int[] batchSize, String device, List<String> names, int stackDim, int count) {
        return new MemmapMetadata(LAZY_STACKED, batchSize, device, names, Map.of(), stackDim, count);
    }

    public boolean isStack() {
        return LAZY_STACKED.equals(type);
    }

    // ==================== JSON ====================

    public String toJson() {
        JsonObject root = new JsonObject();
        root.addProperty("type", type);
        root.add("batch_size", GSON.toJsonTree(batchSize));
        root.addProperty("device", device);
        JsonArray nameArray = new JsonArray();
        for (String name : names) {
            nameArray.add(name);
        }
        root.add("names", nameArray);
        if (isStack()) {
            root.addProperty("stack_dim", stackDim);
            root.addProperty("count", count);
        } else {
            JsonObject entryObject = new JsonObject();
            for (Map.Entry<String, Entry> e : entries.entrySet()) {
                Entry entry = e.getValue();
                JsonObject json = new JsonObject();
                json.addProperty("kind", entry.kind());
                if (entry.isTensor()) {
                    json.add("shape", GSON.toJsonTree(entry.shape()));
                    json.addProperty("dtype", entry.dtype());
                    json.addProperty("device", entry.device());
                } else {
                    json.addProperty("type", entry.type());
                }
                entryObject.add(e.getKey(), json);
            }
            root.add("entries", entryObject);
        }
        return GSON.toJson(root);
    }

    /**
     * @throws IllegalArgumentException if the document is not a container sidecar
     */
    public static MemmapMetadata fromJson(String json) {
        JsonObject root = GSON.fromJson(json, JsonObject.class);
        if (root == null || !root.has("type") || !root.has("batch_size")) {
            throw new IllegalArgumentException("Not a memmap metadata document: missing type or batch_size");
        }
        String type = root.get("type").getAsString();
        int[] batchSize = GSON.fromJson(root.get("batch_size"), int[].class);
        String device = stringOrNull(root.get("device"));
        List<String> names = new ArrayList<>();
        if (root.has("names")) {
            for (JsonElement name : root.getAsJsonArray("names")) {
                names.add(stringOrNull(name));
            }
        }
        if (LAZY_STACKED.equals(type)) {
            return forStack(batchSize, device, names, root.get("stack_dim").getAsInt(), root.get("count").getAsInt());
        }
        Map<String, Entry> entries = new LinkedHashMap<>();
        if (root.has("entries")) {
            for (Map.Entry<String, JsonElement> e : root.getAsJsonObject("entries").entrySet()) {
                JsonObject entryJson = e.getValue().getAsJsonObject();
                String kind = entryJson.get("kind").getAsString();
                if (KIND_TENSOR.equals(kind)) {
                    entries.put(e.getKey(), Entry.tensor(GSON.fromJson(entryJson.get("shape"), int[].class),
                        entryJson.get("dtype").getAsString(), stringOrNull(entryJson.get("device"))));
                } else if (KIND_TENSORDICT.equals(kind)) {
                    entries.put(e.getKey(), Entry.nested(entryJson.get("type").getAsString()));
                } else {
                    throw new IllegalArgumentException("Unknown entry kind '" + kind + "' for key " + e.getKey());
                }
            }
        }
        return new MemmapMetadata(type, batchSize, device, names, entries, -1, 0);
    }

    private static String stringOrNull(JsonElement element) {
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }

    // ==================== Builder ====================

    public static Builder builder(int[] batchSize, String device, List<String> names) {
        return new Builder(batchSize, device, names);
    }

    /**
     * Collects entries of a plain container in insertion order.
     */
    public static final class Builder {
        private final int[] batchSize;
        private final String device;
        private final List<String> names;
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        private Builder(int[] batchSize, String device, List<String> names) {
            this.batchSize = batchSize;
            this.device = device;
            this.names = names;
        }

        public Builder tensor(String key, int[] shape, String dtype, String device) {
            entries.put(key, Entry.tensor(shape, dtype, device));
            return this;
        }

        public Builder nested(String key, String type) {
            entries.put(key, Entry.nested(type));
            return this;
        }

        public MemmapMetadata build() {
            return new MemmapMetadata(TENSORDICT, batchSize, device, names, entries, -1, 0);
        }
    }
}
