package com.parley.messages.spi;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface MessageEventBroadcaster {

    /**
     * Announce that a message was stored.
     */
    CompletableFuture<Void> messageSent(String messageId);
}
