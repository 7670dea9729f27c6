package com.parley.messages.pipeline;

import com.parley.messages.config.PipelineConfig;
import com.parley.messages.model.Message;

import java.util.concurrent.CompletableFuture;

/**
 * A rewriting or enrichment step run in sequence before validation.
 *
 * <p>
 * Stages may mutate the message they are given and complete with it (or with
 * a replacement carrying the same id and room). They never veto.
 */
public interface MessageStage {

    CompletableFuture<Message> apply(Message message, PipelineContext context);

    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Whether the stage runs under the given snapshot. Disabled stages are
     * skipped entirely.
     */
    default boolean isEnabled(PipelineConfig config) {
        return true;
    }
}
