package com.parley.common.config;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Lenient typed reads over a raw settings map. A missing or unconvertible value
 * yields the supplied default; unconvertible values are logged.
 */
@Slf4j
public final class SettingsValues {

    private final Map<String, Object> values;

    private SettingsValues(Map<String, Object> values) {
        this.values = values;
    }

    public static SettingsValues of(Map<String, Object> values) {
        return new SettingsValues(values != null ? values : Map.of());
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null)
            return defaultValue;
        if (value instanceof Boolean b)
            return b;
        if (value instanceof Number n)
            return n.intValue() != 0;
        String s = value.toString().trim().toLowerCase();
        switch (s) {
            case "true", "yes", "on", "1":
                return true;
            case "false", "no", "off", "0", "":
                return false;
            default:
                log.warn("Setting {} is not a boolean: {}", key, value);
                return defaultValue;
        }
    }

    public int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null)
            return defaultValue;
        if (value instanceof Number n)
            return n.intValue();
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            log.warn("Setting {} is not an integer: {}", key, value);
            return defaultValue;
        }
    }

    /**
     * A duration given as a number of seconds.
     */
    public Duration getSeconds(String key, Duration defaultValue) {
        Object value = values.get(key);
        if (value == null)
            return defaultValue;
        try {
            long seconds = value instanceof Number n ? n.longValue() : Long.parseLong(value.toString().trim());
            if (seconds < 0) {
                log.warn("Setting {} must not be negative: {}", key, value);
                return defaultValue;
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            log.warn("Setting {} is not a number of seconds: {}", key, value);
            return defaultValue;
        }
    }

    public String getString(String key, String defaultValue) {
        Object value = values.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * A list given either as a collection or as a comma-separated string.
     * Entries are trimmed; blank entries are dropped.
     */
    public List<String> getList(String key, List<String> defaultValue) {
        Object value = values.get(key);
        if (value == null)
            return defaultValue;
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null)
                    addTrimmed(item.toString(), result);
            }
        } else {
            for (String part : value.toString().split(",")) {
                addTrimmed(part, result);
            }
        }
        return List.copyOf(result);
    }

    private static void addTrimmed(String value, List<String> target) {
        String trimmed = value.trim();
        if (!trimmed.isEmpty())
            target.add(trimmed);
    }
}
