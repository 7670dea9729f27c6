package com.parley.messages.model;

/**
 * The user on whose behalf a message is being processed.
 *
 * @param language preferred locale tag, may be null
 */
public record ActingUser(String id, String username, String name, String language) {

    public MessageSender asSender() {
        return new MessageSender(id, username, name);
    }
}
