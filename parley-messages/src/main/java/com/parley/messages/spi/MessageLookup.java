package com.parley.messages.spi;

import com.parley.messages.model.Message;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read access to stored messages.
 */
@FunctionalInterface
public interface MessageLookup {

    /**
     * Resolve message ids to the messages that exist and are visible (not
     * hidden or deleted). Unknown ids are simply absent from the result.
     */
    CompletableFuture<List<Message>> findVisibleByIds(Collection<String> messageIds);
}
