package com.parley.messages.spi;

import com.parley.messages.model.ActingUser;
import com.parley.messages.model.Room;

import java.util.concurrent.CompletableFuture;

/**
 * Access and permission decisions.
 */
public interface AuthorizationCheck {

    CompletableFuture<Boolean> canAccessRoom(Room room, ActingUser user);

    /**
     * Whether the user holds {@code permission} in the scope of the room.
     */
    CompletableFuture<Boolean> hasPermission(String userId, String permission, String roomId);
}
