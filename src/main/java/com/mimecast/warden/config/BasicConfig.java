package com.mimecast.warden.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Type safe accessors over a configuration map.
 *
 * <p>Maps come from Gson so numbers arrive as {@link Double} and are narrowed here.
 * <br>Property names may use dots to address nested maps, for example {@code work.replyFrom}.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new BasicConfig instance with an empty map.
     */
    public BasicConfig() {
        this((Map<String, Object>) null);
    }

    /**
     * Constructs a new BasicConfig instance.
     *
     * @param map Configuration map, null treated as empty.
     */
    public BasicConfig(Map<String, Object> map) {
        this.map = map != null ? Collections.unmodifiableMap(new LinkedHashMap<>(map)) : Collections.emptyMap();
    }

    /**
     * Gets the underlying map.
     *
     * @return Unmodifiable map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if a property is defined.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return getProperty(name) != null;
    }

    /**
     * Gets a raw property, walking nested maps for dotted names.
     *
     * @param name Property name.
     * @return Object or null.
     */
    protected Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String key : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(key);
        }
        return current;
    }

    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets a string property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = getProperty(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    public Long getLongProperty(String name) {
        return getLongProperty(name, null);
    }

    /**
     * Gets a long property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            return Long.parseLong((String) value);
        }
        return defaultValue;
    }

    public Boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets a boolean property.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public Boolean getBooleanProperty(String name, Boolean defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * Gets a list property.
     *
     * @param name Property name.
     * @return List or null.
     */
    public List<?> getListProperty(String name) {
        Object value = getProperty(name);
        return value instanceof List ? (List<?>) value : null;
    }

    /**
     * Gets a list of strings, empty if undefined.
     *
     * @param name Property name.
     * @return List of strings.
     */
    public List<String> getStringListProperty(String name) {
        List<String> list = new ArrayList<>();
        List<?> values = getListProperty(name);
        if (values != null) {
            for (Object value : values) {
                list.add(String.valueOf(value));
            }
        }
        return list;
    }

    /**
     * Gets a map property.
     *
     * @param name Property name.
     * @return Map or null.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    /**
     * Gets a map of strings preserving definition order, empty if undefined.
     *
     * @param name Property name.
     * @return Map of strings.
     */
    public Map<String, String> getStringMapProperty(String name) {
        Map<String, String> strings = new LinkedHashMap<>();
        Map<String, Object> values = getMapProperty(name);
        if (values != null) {
            values.forEach((k, v) -> strings.put(k, String.valueOf(v)));
        }
        return strings;
    }
}
