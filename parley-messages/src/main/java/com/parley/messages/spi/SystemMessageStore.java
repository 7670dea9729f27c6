package com.parley.messages.spi;

import com.parley.messages.model.MessageSender;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Persistence for system-authored messages.
 */
@FunctionalInterface
public interface SystemMessageStore {

    /**
     * Insert a system message and mark the room unread for its members.
     *
     * @param type      system message type, e.g. {@code "user-joined"}
     * @param extraData    additional fields stored with the message, may be empty
     * @param readReceipts whether read receipts are tracked for the new message
     * @return id of the inserted message
     */
    CompletableFuture<String> insertSystemMessage(String type, String roomId, String text,
            MessageSender owner, Map<String, Object> extraData, boolean readReceipts);
}
