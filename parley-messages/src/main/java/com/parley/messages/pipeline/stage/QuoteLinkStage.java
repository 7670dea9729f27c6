package com.parley.messages.pipeline.stage;

import com.parley.messages.config.PipelineConfig;
import com.parley.messages.model.ActingUser;
import com.parley.messages.model.Message;
import com.parley.messages.model.MessageSender;
import com.parley.messages.model.QuotedMessageAttachment;
import com.parley.messages.model.Room;
import com.parley.messages.pipeline.MessageStage;
import com.parley.messages.pipeline.PipelineContext;
import com.parley.messages.spi.AuthorizationCheck;
import com.parley.messages.spi.AvatarResolver;
import com.parley.messages.spi.MessageLookup;
import com.parley.messages.spi.RoomLookup;
import com.parley.messages.text.PermalinkParser;
import com.parley.messages.text.PermalinkParser.Permalink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Quotes messages referenced by permalinks in the text.
 *
 * <p>
 * Referenced messages and their rooms are each resolved with one batched
 * lookup. Candidates are then checked for room access one at a time, in order
 * of appearance, until {@code quoteChainLimit} quotes have been appended.
 * Anything that cannot be resolved or accessed is skipped; lookup failures
 * are logged and treated as "not found".
 */
@Slf4j
public class QuoteLinkStage implements MessageStage {

    private final MessageLookup messages;
    private final RoomLookup rooms;
    private final AuthorizationCheck authorization;
    private final AvatarResolver avatars;

    public QuoteLinkStage(MessageLookup messages, RoomLookup rooms, AuthorizationCheck authorization,
            AvatarResolver avatars) {
        this.messages = Objects.requireNonNull(messages, "messages");
        this.rooms = Objects.requireNonNull(rooms, "rooms");
        this.authorization = Objects.requireNonNull(authorization, "authorization");
        this.avatars = avatars != null ? avatars : username -> "";
    }

    @Override
    public boolean isEnabled(PipelineConfig config) {
        return config.getQuoteChainLimit() > 0;
    }

    @Override
    public CompletableFuture<Message> apply(Message message, PipelineContext context) {
        PipelineConfig config = context.config();
        PermalinkParser parser = PermalinkParser.forSiteUrl(config.getSiteUrl());
        if (!parser.isEnabled()) {
            return CompletableFuture.completedFuture(message);
        }

        // One entry per referenced message, in order of first appearance
        Map<String, Permalink> links = new LinkedHashMap<>();
        for (Permalink link : parser.find(message.getText())) {
            if (!link.messageId().equals(message.getId())) {
                links.putIfAbsent(link.messageId(), link);
            }
        }
        if (links.isEmpty()) {
            return CompletableFuture.completedFuture(message);
        }

        return safely(() -> messages.findVisibleByIds(List.copyOf(links.keySet())), List.<Message>of(),
                "message lookup")
                .thenCompose(found -> {
                    Map<String, Message> byId = new LinkedHashMap<>();
                    for (Message m : found) {
                        byId.put(m.getId(), m);
                    }
                    Set<String> roomIds = new LinkedHashSet<>();
                    byId.values().forEach(m -> roomIds.add(m.getRoomId()));
                    if (roomIds.isEmpty()) {
                        log.debug("No quotable messages found for {}", message.getId());
                        return CompletableFuture.completedFuture(message);
                    }
                    return safely(() -> rooms.findByIds(List.copyOf(roomIds)), List.<Room>of(), "room lookup")
                            .thenCompose(foundRooms -> {
                                Map<String, Room> roomsById = new LinkedHashMap<>();
                                for (Room room : foundRooms) {
                                    roomsById.put(room.id(), room);
                                }
                                List<Candidate> candidates = new ArrayList<>();
                                for (Permalink link : links.values()) {
                                    Message quoted = byId.get(link.messageId());
                                    Room room = quoted == null ? null : roomsById.get(quoted.getRoomId());
                                    if (quoted == null || room == null) {
                                        log.debug("Skipping unresolved permalink {}", link.url());
                                        continue;
                                    }
                                    candidates.add(new Candidate(link, quoted, room));
                                }
                                return appendQuotes(message, candidates, 0, config.getQuoteChainLimit(), context);
                            });
                });
    }

    private record Candidate(Permalink link, Message quoted, Room room) {
    }

    /**
     * Check access for candidates in order and append quotes until
     * {@code remaining} reaches zero.
     */
    private CompletableFuture<Message> appendQuotes(Message target, List<Candidate> candidates, int index,
            int remaining, PipelineContext context) {
        if (remaining <= 0 || index >= candidates.size()) {
            return CompletableFuture.completedFuture(target);
        }
        Candidate candidate = candidates.get(index);
        ActingUser user = context.user();
        return safely(() -> authorization.canAccessRoom(candidate.room(), user), Boolean.FALSE, "access check")
                .thenCompose(allowed -> {
                    if (!Boolean.TRUE.equals(allowed)) {
                        log.debug("User {} cannot access room {}, not quoting {}",
                                user.id(), candidate.room().id(), candidate.quoted().getId());
                        return appendQuotes(target, candidates, index + 1, remaining, context);
                    }
                    target.appendAttachment(toAttachment(candidate, context.config().isUseRealName()));
                    return appendQuotes(target, candidates, index + 1, remaining - 1, context);
                });
    }

    private QuotedMessageAttachment toAttachment(Candidate candidate, boolean useRealName) {
        Message quoted = candidate.quoted();
        MessageSender author = quoted.getSender();
        String username = author != null ? author.username() : null;
        String name = author != null ? author.name() : null;
        String displayName = useRealName && name != null && !name.isBlank() ? name : username;

        return QuotedMessageAttachment.builder()
                .authorName(displayName)
                .authorUsername(username)
                .authorAvatarUrl(avatarUrl(username))
                .text(quoted.getText())
                .markup(quoted.getMarkup())
                .messageLink(candidate.link().url())
                .roomId(quoted.getRoomId())
                .messageId(quoted.getId())
                .quotedAt(quoted.getCreatedAt())
                .build();
    }

    private String avatarUrl(String username) {
        if (username == null || username.isEmpty()) {
            return "";
        }
        try {
            String url = avatars.avatarUrl(username);
            return url != null ? url : "";
        } catch (RuntimeException e) {
            log.debug("Avatar lookup failed for {}: {}", username, e.getMessage());
            return "";
        }
    }

    private static <T> CompletableFuture<T> safely(Supplier<CompletableFuture<T>> call, T fallback, String what) {
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        if (future == null) {
            return CompletableFuture.completedFuture(fallback);
        }
        return future.handle((value, error) -> {
            if (error != null) {
                log.warn("Quote {} failed, skipping: {}", what, error.getMessage());
                return fallback;
            }
            return value != null ? value : fallback;
        });
    }
}
