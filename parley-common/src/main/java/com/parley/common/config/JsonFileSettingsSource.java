package com.parley.common.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Settings read from a JSON object file.
 *
 * <p>
 * Nested objects are flattened into dotted keys, so
 * <code>{"message": {"quoteChainLimit": 2}}</code> and
 * <code>{"message.quoteChainLimit": 2}</code> are equivalent. Reads are cached
 * for a short TTL. After {@link #start()} a watcher thread reloads the file when
 * it changes and notifies watchers of the keys whose values differ.
 */
@Slf4j
public class JsonFileSettingsSource extends AbstractSettingsSource implements AutoCloseable {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);

    /** Reload once the file has been quiet for 500 ms. */
    private static final long DEBOUNCE_MS = 500;

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Cache<String, Map<String, Object>> cache;
    private final Path settingsPath;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Map<String, Object> lastLoaded = Map.of();
    private volatile Thread watchThread;
    private volatile WatchService watchService;

    public JsonFileSettingsSource(Path settingsPath) {
        this(settingsPath, DEFAULT_CACHE_TTL);
    }

    public JsonFileSettingsSource(Path settingsPath, Duration cacheTtl) {
        String pathStr = settingsPath.toString();
        if (pathStr.startsWith("~")) {
            settingsPath = Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        this.settingsPath = settingsPath.toAbsolutePath();
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
        this.lastLoaded = loadAll();
    }

    @Override
    public Map<String, Object> current(Set<String> keys) {
        Map<String, Object> all = loadAll();
        Map<String, Object> result = new LinkedHashMap<>();
        for (String key : keys) {
            if (all.containsKey(key))
                result.put(key, all.get(key));
        }
        return result;
    }

    /**
     * All settings in the file, flattened.
     */
    public Map<String, Object> loadAll() {
        return cache.get(settingsPath.toString(), key -> doLoad());
    }

    /**
     * Re-read the file, bypassing the cache, and notify watchers of changed
     * keys.
     *
     * @return the keys whose values changed
     */
    public Set<String> reload() {
        Map<String, Object> previous = lastLoaded;
        cache.invalidateAll();
        Map<String, Object> next = loadAll();
        lastLoaded = next;

        Set<String> changed = new LinkedHashSet<>();
        for (var entry : next.entrySet()) {
            if (!previous.containsKey(entry.getKey())
                    || !Objects.equals(previous.get(entry.getKey()), entry.getValue())) {
                changed.add(entry.getKey());
            }
        }
        for (String key : previous.keySet()) {
            if (!next.containsKey(key))
                changed.add(key);
        }
        if (!changed.isEmpty()) {
            log.info("Settings reloaded from {} (changed: {})", settingsPath, changed);
            fireChanged(changed);
        }
        return changed;
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    private Map<String, Object> doLoad() {
        if (!Files.exists(settingsPath)) {
            log.warn("Settings file not found: {}, using defaults", settingsPath);
            return Map.of();
        }
        try {
            Map<String, Object> raw = objectMapper.readValue(Files.readString(settingsPath), MAP_TYPE);
            Map<String, Object> flat = new LinkedHashMap<>();
            flatten("", raw, flat);
            log.debug("Settings loaded from: {}", settingsPath);
            return flat;
        } catch (IOException e) {
            // Keep serving the last good values rather than dropping to defaults
            log.error("Failed to load settings from: {}", settingsPath, e);
            return lastLoaded;
        }
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> source, Map<String, Object> target) {
        for (var entry : source.entrySet()) {
            String key = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            if (entry.getValue() instanceof Map<?, ?> nested) {
                flatten(key, (Map<String, Object>) nested, target);
            } else {
                target.put(key, entry.getValue());
            }
        }
    }

    // -----------------------------------------------------------------------
    // File watching
    // -----------------------------------------------------------------------

    /**
     * Start watching the settings file for changes.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Settings watcher is already running");
            return;
        }

        Path parentDir = settingsPath.getParent();
        String fileName = settingsPath.getFileName().toString();

        try {
            watchService = FileSystems.getDefault().newWatchService();
            parentDir.register(watchService,
                    StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);
        } catch (IOException e) {
            log.error("Failed to start settings file watcher: {}", e.getMessage());
            running.set(false);
            return;
        }

        watchThread = new Thread(() -> {
            log.info("Settings file watcher started for: {}", settingsPath);

            while (running.get()) {
                try {
                    WatchKey key = watchService.take();
                    if (!isRelevant(key, fileName))
                        continue;

                    // Trailing edge: every further event restarts the quiet period
                    WatchKey next;
                    while ((next = watchService.poll(DEBOUNCE_MS, TimeUnit.MILLISECONDS)) != null) {
                        isRelevant(next, fileName);
                    }
                    reload();

                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (ClosedWatchServiceException e) {
                    break;
                } catch (Exception e) {
                    log.error("Settings watcher error: {}", e.getMessage(), e);
                }
            }

            log.info("Settings file watcher stopped");
        }, "settings-file-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
    }

    private static boolean isRelevant(WatchKey key, String fileName) {
        boolean relevant = false;
        for (var event : key.pollEvents()) {
            if (event.context() instanceof Path changedPath && fileName.equals(changedPath.toString())) {
                relevant = true;
            }
        }
        key.reset();
        return relevant;
    }

    /**
     * Stop watching the settings file.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            try {
                if (watchService != null) {
                    watchService.close();
                }
            } catch (IOException e) {
                log.warn("Error closing watch service: {}", e.getMessage());
            }
            if (watchThread != null) {
                watchThread.interrupt();
            }
        }
    }
}
