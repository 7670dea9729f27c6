package com.parley.messages.config;

import com.parley.common.config.SettingsSource;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Holds the current {@link PipelineConfig} and replaces it whole whenever the
 * watched settings change.
 *
 * <p>
 * Readers call {@link #get()} once per pipeline run. The swap is a single
 * reference write, so a reader sees either the old snapshot or the new one,
 * never a mix.
 */
@Slf4j
public class PipelineConfigHolder implements Supplier<PipelineConfig>, AutoCloseable {

    private final AtomicReference<PipelineConfig> current = new AtomicReference<>(PipelineConfig.defaults());
    private final AtomicLong versions = new AtomicLong();
    private volatile SettingsSource.Subscription subscription;

    public PipelineConfigHolder() {
    }

    /**
     * Holder initialised from, and subscribed to, the given source.
     */
    public static PipelineConfigHolder watching(SettingsSource source) {
        PipelineConfigHolder holder = new PipelineConfigHolder();
        holder.bind(source);
        return holder;
    }

    @Override
    public PipelineConfig get() {
        return current.get();
    }

    /**
     * Load the current settings and subscribe to later changes.
     */
    public synchronized void bind(SettingsSource source) {
        if (subscription != null) {
            subscription.close();
        }
        apply(source.current(PipelineSettingKeys.ALL));
        subscription = source.watch(PipelineSettingKeys.ALL, this::apply);
    }

    /**
     * Build a snapshot from a full set of setting values and swap it in. If the
     * snapshot cannot be built the previous one stays active.
     */
    public synchronized PipelineConfig apply(Map<String, Object> settings) {
        PipelineConfig next;
        try {
            next = PipelineConfig.fromSettings(settings, versions.incrementAndGet());
        } catch (RuntimeException e) {
            log.error("Keeping pipeline config v{}: new settings rejected: {}",
                    current.get().getVersion(), e.getMessage(), e);
            return current.get();
        }
        PipelineConfig previous = current.getAndSet(next);
        log.info("Pipeline config v{} -> v{}: {}", previous.getVersion(), next.getVersion(), next);
        return next;
    }

    @Override
    public synchronized void close() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }
}
