package com.parley.common.config;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Settings held in memory. Used when embedding the pipeline and in tests.
 */
public class InMemorySettingsSource extends AbstractSettingsSource {

    private final Map<String, Object> values = new HashMap<>();

    public InMemorySettingsSource() {
    }

    public InMemorySettingsSource(Map<String, ?> initial) {
        values.putAll(initial);
    }

    @Override
    public Map<String, Object> current(Set<String> keys) {
        Map<String, Object> result = new LinkedHashMap<>();
        synchronized (values) {
            for (String key : keys) {
                if (values.containsKey(key))
                    result.put(key, values.get(key));
            }
        }
        return result;
    }

    public void put(String key, Object value) {
        putAll(Map.of(key, value));
    }

    /**
     * Apply several values as one change; watchers are notified once.
     */
    public void putAll(Map<String, ?> changes) {
        List<String> changed;
        synchronized (values) {
            changed = changes.entrySet().stream()
                    .filter(e -> !Objects.equals(values.get(e.getKey()), e.getValue())
                            || !values.containsKey(e.getKey()))
                    .map(Map.Entry::getKey)
                    .toList();
            values.putAll(changes);
        }
        fireChanged(changed);
    }

    public void remove(String key) {
        boolean removed;
        synchronized (values) {
            removed = values.containsKey(key);
            values.remove(key);
        }
        if (removed)
            fireChanged(List.of(key));
    }
}
