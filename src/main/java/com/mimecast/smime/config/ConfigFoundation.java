package com.mimecast.smime.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Wraps a configuration map and provides typed accessors with defaults.
 * <br>Keys may be dotted paths to reach into nested maps, e.g. <code>sign.allowExpired</code>.
 */
public class ConfigFoundation {

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map, may be null.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Gets the underlying map.
     *
     * @return Map instance.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if a property exists.
     *
     * @param name Property name or dotted path.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return getProperty(name) != null;
    }

    /**
     * Gets a property value.
     *
     * @param name Property name or dotted path.
     * @return Object or null if missing.
     */
    public Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String part : name.split("\\.")) {
            if (!(current instanceof Map<?, ?> nested) || !nested.containsKey(part)) {
                return null;
            }
            current = nested.get(part);
        }
        return current;
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

    /**
     * Gets a boolean property.
     * <p>Accepts booleans and their string forms.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String str) {
            return Boolean.parseBoolean(str.trim());
        }
        return defaultValue;
    }

    /**
     * Gets a long property.
     * <p>Gson reads all JSON numbers as doubles, hence the Number handling.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public long getLongProperty(String name, long defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String str) {
            try {
                return Long.parseLong(str.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets a map property.
     *
     * @param name Property name.
     * @return Map, empty if missing or not a map.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return new HashMap<>();
    }
}
