package com.parley.messages.spi;

/**
 * Best-effort avatar lookup.
 */
@FunctionalInterface
public interface AvatarResolver {

    /**
     * Avatar URL for the username, or an empty string when there is none.
     */
    String avatarUrl(String username);
}
