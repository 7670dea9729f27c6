package com.parley.common.config;

import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Key/value settings store with change notification.
 *
 * <p>
 * Notifications always carry the current values of every watched key, never a
 * single changed key on its own, so a listener can rebuild its state from one
 * notification without reading the source again.
 */
public interface SettingsSource {

    /**
     * Current values for the given keys. Keys with no value are absent from the
     * returned map.
     */
    Map<String, Object> current(Set<String> keys);

    /**
     * Subscribe to changes of any of the given keys.
     *
     * @param keys     keys to watch
     * @param listener receives the current values of all watched keys after a
     *                 change
     * @return handle that stops the subscription
     */
    Subscription watch(Set<String> keys, Consumer<Map<String, Object>> listener);

    /**
     * Handle returned by {@link #watch}.
     */
    @FunctionalInterface
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
