package com.parley.messages;

import com.parley.messages.config.PipelineConfig;
import com.parley.messages.model.ActingUser;
import com.parley.messages.model.Message;
import com.parley.messages.model.MessageSender;
import com.parley.messages.model.Room;
import com.parley.messages.model.RoomType;
import com.parley.messages.pipeline.PipelineContext;
import com.parley.messages.spi.AuthorizationCheck;
import com.parley.messages.spi.MessageLookup;
import com.parley.messages.spi.RoomLookup;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Shared test data and in-memory collaborators.
 */
public final class MessageFixtures {

    public static final String SITE_URL = "https://chat.example.com";
    public static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    public static final Room ROOM = new Room("room-1", "general", RoomType.CHANNEL, null);
    public static final ActingUser USER = new ActingUser("u-alice", "alice", "Alice Liddell", "en");

    private MessageFixtures() {
    }

    /** A fresh, unedited message from {@link #USER} in {@link #ROOM}. */
    public static Message message(String text) {
        return Message.builder()
                .id("m-new")
                .roomId(ROOM.id())
                .sender(USER.asSender())
                .text(text)
                .createdAt(NOW)
                .build();
    }

    public static Message storedMessage(String id, String roomId, MessageSender author, String text) {
        return Message.builder()
                .id(id)
                .roomId(roomId)
                .sender(author)
                .text(text)
                .createdAt(NOW.minusSeconds(3600))
                .build();
    }

    public static String permalink(String roomName, String messageId) {
        return SITE_URL + "/channel/" + roomName + "?msg=" + messageId;
    }

    public static PipelineConfig config() {
        return PipelineConfig.defaults().toBuilder().siteUrl(SITE_URL).build();
    }

    public static PipelineContext context(PipelineConfig config) {
        return new PipelineContext(ROOM, USER, config, NOW);
    }

    /**
     * Messages, rooms, access and permissions held in maps. Records every
     * lookup it serves.
     */
    public static class FakeDirectory implements MessageLookup, RoomLookup, AuthorizationCheck {

        public final Map<String, Message> messages = new ConcurrentHashMap<>();
        public final Map<String, Room> rooms = new ConcurrentHashMap<>();
        public final Set<String> deniedRooms = ConcurrentHashMap.newKeySet();
        public final Set<String> grantedPermissions = ConcurrentHashMap.newKeySet();
        public final List<List<String>> messageLookups = new CopyOnWriteArrayList<>();
        public final List<List<String>> roomLookups = new CopyOnWriteArrayList<>();
        public final List<String> accessChecks = new CopyOnWriteArrayList<>();
        public final List<String> permissionChecks = new CopyOnWriteArrayList<>();

        public FakeDirectory add(Message message) {
            messages.put(message.getId(), message);
            return this;
        }

        public FakeDirectory add(Room room) {
            rooms.put(room.id(), room);
            return this;
        }

        public FakeDirectory deny(String roomId) {
            deniedRooms.add(roomId);
            return this;
        }

        public FakeDirectory grant(String permission) {
            grantedPermissions.add(permission);
            return this;
        }

        @Override
        public CompletableFuture<List<Message>> findVisibleByIds(Collection<String> messageIds) {
            messageLookups.add(List.copyOf(messageIds));
            return CompletableFuture.completedFuture(
                    messageIds.stream().map(messages::get).filter(Objects::nonNull).toList());
        }

        @Override
        public CompletableFuture<List<Room>> findByIds(Collection<String> roomIds) {
            roomLookups.add(List.copyOf(roomIds));
            return CompletableFuture.completedFuture(
                    roomIds.stream().map(rooms::get).filter(Objects::nonNull).toList());
        }

        @Override
        public CompletableFuture<Boolean> canAccessRoom(Room room, ActingUser user) {
            accessChecks.add(room.id());
            return CompletableFuture.completedFuture(!deniedRooms.contains(room.id()));
        }

        @Override
        public CompletableFuture<Boolean> hasPermission(String userId, String permission, String roomId) {
            permissionChecks.add(permission);
            return CompletableFuture.completedFuture(grantedPermissions.contains(permission));
        }
    }
}
