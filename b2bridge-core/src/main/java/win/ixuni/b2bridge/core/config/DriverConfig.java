package win.ixuni.b2bridge.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Driver configuration
 * <p>
 * Generic structure bound from {@code b2bridge.drivers[*]}; driver-specific settings live in
 * {@link #properties} and are parsed by each driver into its own typed config.
 */
@Data
public class DriverConfig {

    /**
     * Driver instance name (unique identifier)
     */
    private String name;

    /**
     * Driver type (b2, ...)
     */
    private String type;

    private boolean enabled = true;

    /**
     * Driver-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Get a string value that must be present and non-blank
     *
     * @throws IllegalArgumentException when the value is missing
     */
    public String getRequiredString(String key) {
        String value = getString(key, null);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(
                    "Driver '" + name + "': property '" + key + "' must be configured");
        }
        return value;
    }

    public Integer getInt(String key, Integer defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString().trim());
    }

    public Long getLong(String key, Long defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString().trim());
    }

    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }
}
