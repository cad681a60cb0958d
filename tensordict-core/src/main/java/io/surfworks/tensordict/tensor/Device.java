package io.surfworks.tensordict.tensor;

import java.util.Objects;

/**
 * Placement tag for a tensor leaf ("cpu", "cuda:0", ...).
 *
 * <p>All storage lives in host memory; the device is carried so that containers
 * can enforce device uniformity and casts produce a distinct copy, the way a
 * transfer between accelerators would.
 *
 * @param type  device type, lower case
 * @param index device ordinal, or -1 when unspecified
 */
public record Device(String type, int index) {

    public static final Device CPU = new Device("cpu", -1);

    public Device {
        Objects.requireNonNull(type, "type cannot be null");
        if (type.isBlank()) {
            throw new IllegalArgumentException("type cannot be blank");
        }
        if (index < -1) {
            throw new IllegalArgumentException("index must be >= -1, got " + index);
        }
        type = type.toLowerCase();
    }

    /**
     * Parse a device string such as {@code "cpu"}, {@code "cuda"} or {@code "cuda:1"}.
     */
    public static Device parse(String spec) {
        Objects.requireNonNull(spec, "device spec cannot be null");
        int colon = spec.indexOf(':');
        if (colon < 0) {
            return new Device(spec.trim(), -1);
        }
        String type = spec.substring(0, colon).trim();
        String ordinal = spec.substring(colon + 1).trim();
        try {
            return new Device(type, Integer.parseInt(ordinal));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid device ordinal in '" + spec + "'", e);
        }
    }

    public static Device cuda(int index) {
        return new Device("cuda", index);
    }

    public boolean isCpu() {
        return "cpu".equals(type);
    }

    @Override
    public String toString() {
        return index < 0 ? type : type + ":" + index;
    }
}
