package com.parley.messages.pipeline.check;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.parley.messages.model.Message;
import com.parley.messages.pipeline.PipelineContext;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Limits how many messages a user may send to one room per time window.
 *
 * <p>
 * Counting uses fixed windows: the first message opens a window of
 * {@code constraint.rate.windowSeconds}, every message in it increments the
 * counter, and the entry expires when the window ends. Messages beyond
 * {@code constraint.rate.maxMessages} are rejected (and still counted).
 */
@Slf4j
public class SendRatePolicy implements ConstraintPolicy {

    public static final String NAME = "send-rate";
    public static final String ERROR_CODE = "error-too-many-requests";

    private record Window(AtomicInteger count, long lengthNanos) {
    }

    private final Cache<String, Window> windows;

    public SendRatePolicy() {
        this(Ticker.systemTicker());
    }

    public SendRatePolicy(Ticker ticker) {
        this.windows = Caffeine.newBuilder()
                .ticker(ticker)
                .executor(Runnable::run)
                .maximumSize(100_000)
                .expireAfter(new Expiry<String, Window>() {
                    @Override
                    public long expireAfterCreate(String key, Window window, long currentTime) {
                        return window.lengthNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Window window, long currentTime,
                            long currentDuration) {
                        return currentDuration;
                    }

                    @Override
                    public long expireAfterRead(String key, Window window, long currentTime,
                            long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<ConstraintViolation> evaluate(Message message, PipelineContext context) {
        int max = context.config().getRateMaxMessages();
        long lengthNanos = context.config().getRateWindow().toNanos();
        if (max <= 0 || lengthNanos <= 0) {
            return Optional.empty();
        }
        String key = context.room().id() + ":" + context.user().id();
        int count = windows.get(key, k -> new Window(new AtomicInteger(), lengthNanos))
                .count()
                .incrementAndGet();
        if (count <= max) {
            return Optional.empty();
        }
        log.debug("User {} over send rate in room {}: {} > {}", context.user().id(), context.room().id(), count, max);
        return Optional.of(new ConstraintViolation(ERROR_CODE,
                "More than " + max + " messages in " + context.config().getRateWindow().toSeconds() + " seconds"));
    }

    /** Number of open windows. */
    long openWindows() {
        windows.cleanUp();
        return windows.estimatedSize();
    }
}
