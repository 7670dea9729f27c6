package com.parley.messages.model;

/**
 * A chat room. Access control lives with the authorization collaborator, so
 * the pipeline only needs identity and linkage.
 *
 * @param parentRoomId parent room for discussions, null otherwise
 */
public record Room(String id, String name, RoomType type, String parentRoomId) {
}
