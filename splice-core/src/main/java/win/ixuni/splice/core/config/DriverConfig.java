package win.ixuni.splice.core.config;

import lombok.Data;
import win.ixuni.splice.core.exception.InvalidArgumentException;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Driver configuration
 * <p>
 * Generic driver configuration structure. Each driver type reads its own settings from {@link #properties}.
 */
@Data
public class DriverConfig {

    /**
     * Driver instance name
     */
    private String name = "default";

    /**
     * Driver type (memory, s3)
     */
    private String type;

    /**
     * Driver-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    public static DriverConfig of(String name, String type, Map<String, Object> properties) {
        DriverConfig config = new DriverConfig();
        config.setName(name);
        config.setType(type);
        config.setProperties(new HashMap<>(properties));
        return config;
    }

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Get a string configuration value that must be present and non-blank
     */
    public String requireString(String key) {
        String value = getString(key, null);
        if (value == null || value.isBlank()) {
            throw new InvalidArgumentException(
                    "Driver '" + name + "': property '" + key + "' must be configured");
        }
        return value;
    }

    /**
     * Get a boolean configuration value
     */
    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * Get a list configuration value
     * <p>
     * Accepts a YAML list, a map indexed by position (how Spring binds list entries into a {@code Map<String, Object>})
     * or a comma-separated string.
     */
    public List<String> getList(String key) {
        Object value = properties.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(Object::toString).map(String::trim).toList();
        }
        if (value instanceof Map<?, ?> indexed) {
            return indexed.values().stream().map(Object::toString).map(String::trim).toList();
        }
        return List.of(value.toString().split(",")).stream()
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .toList();
    }
}
