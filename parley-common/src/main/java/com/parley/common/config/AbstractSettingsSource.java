package com.parley.common.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Watcher bookkeeping shared by the settings sources. Subclasses call
 * {@link #fireChanged} after their backing values changed.
 */
@Slf4j
public abstract class AbstractSettingsSource implements SettingsSource {

    private final List<Watcher> watchers = new CopyOnWriteArrayList<>();

    private record Watcher(Set<String> keys, Consumer<Map<String, Object>> listener) {
    }

    @Override
    public Subscription watch(Set<String> keys, Consumer<Map<String, Object>> listener) {
        Watcher watcher = new Watcher(Set.copyOf(keys), listener);
        watchers.add(watcher);
        return () -> watchers.remove(watcher);
    }

    /**
     * Notify every watcher that observes at least one of the changed keys.
     * A failing listener is logged and does not stop the others.
     */
    protected void fireChanged(Collection<String> changedKeys) {
        if (changedKeys.isEmpty())
            return;
        for (Watcher watcher : watchers) {
            if (changedKeys.stream().noneMatch(watcher.keys()::contains))
                continue;
            try {
                watcher.listener().accept(current(watcher.keys()));
            } catch (Exception e) {
                log.error("Settings listener failed: {}", e.getMessage(), e);
            }
        }
    }

    protected int watcherCount() {
        return watchers.size();
    }
}
