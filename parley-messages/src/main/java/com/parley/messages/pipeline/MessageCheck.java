package com.parley.messages.pipeline;

import com.parley.messages.model.Message;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A validation run in the concurrent group after all stages. Completes with a
 * veto to reject the message, or empty to let it through.
 */
public interface MessageCheck {

    CompletableFuture<Optional<Veto>> check(Message message, PipelineContext context);

    default String name() {
        return getClass().getSimpleName();
    }
}
