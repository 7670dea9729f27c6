package com.parley.messages.model;

/**
 * Identity of the user who authored a message.
 */
public record MessageSender(String id, String username, String name) {
}
