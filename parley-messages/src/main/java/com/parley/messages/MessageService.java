package com.parley.messages;

import com.parley.common.config.SettingsSource;
import com.parley.messages.config.PipelineConfig;
import com.parley.messages.config.PipelineConfigHolder;
import com.parley.messages.model.ActingUser;
import com.parley.messages.model.Message;
import com.parley.messages.model.MessageSender;
import com.parley.messages.model.Room;
import com.parley.messages.pipeline.MessagePipeline;
import com.parley.messages.pipeline.MessageVetoException;
import com.parley.messages.pipeline.check.ConstraintCheck;
import com.parley.messages.pipeline.check.MentionGuardCheck;
import com.parley.messages.pipeline.check.MentionKind;
import com.parley.messages.pipeline.stage.BadWordsStage;
import com.parley.messages.pipeline.stage.MarkdownStage;
import com.parley.messages.pipeline.stage.QuoteLinkStage;
import com.parley.messages.pipeline.stage.StreamingLinkStage;
import com.parley.messages.spi.AuthorizationCheck;
import com.parley.messages.spi.AvatarResolver;
import com.parley.messages.spi.MessageEventBroadcaster;
import com.parley.messages.spi.MessageLookup;
import com.parley.messages.spi.RoomLookup;
import com.parley.messages.spi.SystemMessageStore;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Entry point for message preparation.
 *
 * <p>
 * {@link #beforeSave} runs a message through the pre-persistence pipeline:
 * markdown, bad words, streaming links and quotes, followed by the constraint
 * and collective-mention checks for fresh messages. The pipeline reads its
 * parameters from a config snapshot kept current from a
 * {@link SettingsSource}.
 */
@Slf4j
public class MessageService implements AutoCloseable {

    /**
     * External services the pipeline and system messages depend on.
     */
    @Data
    @Builder
    public static class Collaborators {
        private MessageLookup messageLookup;
        private RoomLookup roomLookup;
        private AuthorizationCheck authorization;
        @Builder.Default
        private AvatarResolver avatarResolver = username -> "";
        private SystemMessageStore systemMessageStore;
        @Builder.Default
        private MessageEventBroadcaster broadcaster = messageId -> CompletableFuture.completedFuture(null);
        /** Executor the validation checks are dispatched on. */
        @Builder.Default
        private Executor checkExecutor = ForkJoinPool.commonPool();
        @Builder.Default
        private Clock clock = Clock.systemUTC();
    }

    private final PipelineConfigHolder configHolder;
    private final Collaborators collaborators;
    private final MessagePipeline pipeline;

    public MessageService(PipelineConfigHolder configHolder, Collaborators collaborators) {
        this.configHolder = Objects.requireNonNull(configHolder, "configHolder");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        AuthorizationCheck authorization = Objects.requireNonNull(collaborators.getAuthorization(), "authorization");

        this.pipeline = new MessagePipeline(
                configHolder,
                List.of(
                        new MarkdownStage(),
                        new BadWordsStage(),
                        new StreamingLinkStage(),
                        new QuoteLinkStage(collaborators.getMessageLookup(), collaborators.getRoomLookup(),
                                authorization, collaborators.getAvatarResolver())),
                // Dispatch order decides which veto is reported
                List.of(
                        ConstraintCheck.withDefaultPolicies(),
                        new MentionGuardCheck(MentionKind.EVERYONE, authorization),
                        new MentionGuardCheck(MentionKind.HERE, authorization)),
                collaborators.getCheckExecutor(),
                collaborators.getClock());
    }

    /**
     * Service whose config follows {@code settings} until {@link #close()}.
     */
    public static MessageService create(SettingsSource settings, Collaborators collaborators) {
        PipelineConfigHolder holder = PipelineConfigHolder.watching(settings);
        log.info("Message service started with config v{}", holder.get().getVersion());
        return new MessageService(holder, collaborators);
    }

    public PipelineConfig getConfig() {
        return configHolder.get();
    }

    // =========================================================================
    // Pipeline
    // =========================================================================

    /**
     * Prepare a message for storage. The caller's message is not modified.
     *
     * @return future completing with the transformed message, or failing with
     *         {@link MessageVetoException} if a check rejected it
     */
    public CompletableFuture<Message> beforeSave(Message message, Room room, ActingUser user) {
        return pipeline.process(message, room, user);
    }

    // =========================================================================
    // System messages
    // =========================================================================

    /**
     * Store a system-authored message and announce it.
     *
     * @param extraData additional fields stored with the message, may be null
     * @return future completing with the new message id
     * @throws IllegalArgumentException if the owner has no username
     */
    public CompletableFuture<String> saveSystemMessage(String type, String roomId, String text,
            MessageSender owner, Map<String, Object> extraData) {
        Objects.requireNonNull(owner, "owner");
        if (owner.username() == null || owner.username().isEmpty()) {
            throw new IllegalArgumentException("The username cannot be empty.");
        }
        SystemMessageStore store = collaborators.getSystemMessageStore();
        if (store == null) {
            throw new IllegalStateException("No system message store configured");
        }
        Map<String, Object> extra = extraData == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extraData));

        return store.insertSystemMessage(type, roomId, text,
                new MessageSender(owner.id(), owner.username(), owner.name()), extra,
                configHolder.get().isReadReceiptsEnabled())
                .thenApply(messageId -> {
                    announce(messageId);
                    return messageId;
                });
    }

    private void announce(String messageId) {
        MessageEventBroadcaster broadcaster = collaborators.getBroadcaster();
        if (broadcaster == null) {
            return;
        }
        CompletableFuture<Void> sent;
        try {
            sent = broadcaster.messageSent(messageId);
        } catch (RuntimeException e) {
            log.warn("Failed to broadcast message {}: {}", messageId, e.getMessage(), e);
            return;
        }
        if (sent != null) {
            sent.whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("Failed to broadcast message {}: {}", messageId, error.getMessage());
                }
            });
        }
    }

    @Override
    public void close() {
        configHolder.close();
        log.info("Message service stopped");
    }
}
