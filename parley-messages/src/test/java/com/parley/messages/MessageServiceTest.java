package com.parley.messages;

import com.parley.common.config.InMemorySettingsSource;
import com.parley.messages.MessageFixtures.FakeDirectory;
import com.parley.messages.config.PipelineConfigHolder;
import com.parley.messages.config.PipelineSettingKeys;
import com.parley.messages.model.AttachmentKind;
import com.parley.messages.model.Message;
import com.parley.messages.model.MessageSender;
import com.parley.messages.model.QuotedMessageAttachment;
import com.parley.messages.model.StreamingLinkAttachment;
import com.parley.messages.pipeline.MessageVetoException;
import com.parley.messages.pipeline.VetoKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.parley.messages.MessageFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MessageServiceTest {

    private static final MessageSender BOB = new MessageSender("u-bob", "bob", "Bob");

    private InMemorySettingsSource settings;
    private FakeDirectory directory;
    private MessageService service;

    @BeforeEach
    void setUp() {
        settings = new InMemorySettingsSource(Map.of(
                PipelineSettingKeys.SITE_URL, SITE_URL,
                PipelineSettingKeys.STREAMING_LINKS_HOSTS, "open.stream.example"));
        directory = new FakeDirectory().add(ROOM);
        service = MessageService.create(settings, collaborators().build());
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    private MessageService.Collaborators.CollaboratorsBuilder collaborators() {
        return MessageService.Collaborators.builder()
                .messageLookup(directory)
                .roomLookup(directory)
                .authorization(directory)
                .clock(CLOCK)
                .checkExecutor(Runnable::run);
    }

    private Message save(Message message) {
        return service.beforeSave(message, ROOM, USER).join();
    }

    private MessageVetoException rejected(Message message) {
        CompletionException e = assertThrows(CompletionException.class, () -> save(message));
        return assertInstanceOf(MessageVetoException.class, e.getCause());
    }

    @Nested
    class Scenarios {

        @Test
        void streamingLinkBecomesAttachment() {
            String text = "listen to https://open.stream.example/track/42";
            Message result = save(message(text));

            assertEquals(text, result.getText());
            assertEquals(1, result.getAttachments().size());
            var attachment = (StreamingLinkAttachment) result.getAttachments().get(0);
            assertEquals(AttachmentKind.STREAMING_LINK, attachment.kind());
            assertEquals("track", attachment.resourceType());
            assertEquals("42", attachment.resourceId());
        }

        @Test
        void bannedWordIsMasked() {
            settings.putAll(Map.of(
                    PipelineSettingKeys.BAD_WORDS_ENABLED, true,
                    PipelineSettingKeys.BAD_WORDS_LIST, List.of("damn"),
                    PipelineSettingKeys.BAD_WORDS_WHITELIST, List.of()));

            Message result = save(message("that's damn annoying"));

            assertEquals("that's **** annoying", result.getText());
            assertEquals("that's **** annoying", result.getMarkup().text());
        }

        @Test
        void everyoneWithoutPermissionIsRejected() {
            MessageVetoException veto = rejected(message("@everyone meeting now"));

            assertEquals(VetoKind.MENTION_EVERYONE, veto.getKind());
            assertEquals("error-action-not-allowed", veto.getErrorCode());
        }

        @Test
        void editedMessageKeepsMention() {
            Message edited = message("@everyone meeting now").toBuilder()
                    .editedAt(NOW).editedBy(USER.id()).build();

            Message result = save(edited);

            assertEquals("@everyone meeting now", result.getText());
            assertTrue(directory.permissionChecks.isEmpty());
        }

        @Test
        void chainLimitOneQuotesFirstLink() {
            settings.put(PipelineSettingKeys.QUOTE_CHAIN_LIMIT, 1);
            directory.add(storedMessage("q1", ROOM.id(), BOB, "first"));
            directory.add(storedMessage("q2", ROOM.id(), BOB, "second"));

            Message result = save(message(permalink("general", "q1") + " and " + permalink("general", "q2")));

            assertEquals(1, result.getAttachments().size());
            assertEquals("q1", ((QuotedMessageAttachment) result.getAttachments().get(0)).messageId());
        }
    }

    @Nested
    class Validation {

        @Test
        void permittedEveryoneIsAccepted() {
            directory.grant("mention-all");
            assertEquals("@everyone hi", save(message("@everyone hi")).getText());
        }

        @Test
        void hereIsGuardedSeparately() {
            directory.grant("mention-all");
            assertEquals(VetoKind.MENTION_HERE, rejected(message("@everyone and @here")).getKind());
        }

        @Test
        void constraintReportedBeforeMentions() {
            settings.put(PipelineSettingKeys.MAX_ALLOWED_SIZE, 10);
            assertEquals(VetoKind.CONSTRAINT_EXCEEDED, rejected(message("@everyone this is long")).getKind());
        }

        @Test
        void mentionInsideHtmlIsGuarded() {
            assertEquals(VetoKind.MENTION_EVERYONE, rejected(message("<div>@everyone</div>")).getKind());
            assertEquals(VetoKind.MENTION_HERE, rejected(message("<div>\n@here ping\n</div>")).getKind());
            assertEquals(VetoKind.MENTION_EVERYONE, rejected(message("hey <span>@all</span>")).getKind());
        }

        @Test
        void mentionInImageAltIsGuarded() {
            assertEquals(VetoKind.MENTION_EVERYONE, rejected(message("![@everyone](x.png)")).getKind());
        }

        @Test
        void bannedWordMaskedInLinksAndMentions() {
            settings.putAll(Map.of(
                    PipelineSettingKeys.BAD_WORDS_ENABLED, true,
                    PipelineSettingKeys.BAD_WORDS_LIST, List.of("damn")));

            Message result = save(message("see https://damn.example/x and @damn"));

            assertEquals("see https://****.example/x and @****", result.getText());
            assertEquals("https://****.example/x", result.getMarkup().links().get(0).href());
            assertEquals(List.of("****"), result.getMarkup().mentions());
        }

        @Test
        void staleMessageSkipsChecks() {
            Message stale = message("@here").toBuilder().createdAt(NOW.minusSeconds(120)).build();
            assertEquals("@here", save(stale).getText());
        }

        @Test
        void editedMessagesCheckedWhenEnabled() {
            settings.put(PipelineSettingKeys.INCLUDE_EDITED_AND_STALE, true);
            Message edited = message("@here").toBuilder().editedAt(NOW).editedBy(USER.id()).build();

            assertEquals(VetoKind.MENTION_HERE, rejected(edited).getKind());
        }

        @Test
        void callerMessageUnchanged() {
            Message original = message("listen https://open.stream.example/album/1");
            save(original);
            assertTrue(original.getAttachments().isEmpty());
            assertNull(original.getMarkup());
        }
    }

    @Nested
    class Settings {

        @Test
        void followsSettingChanges() {
            long before = service.getConfig().getVersion();
            settings.put(PipelineSettingKeys.MARKDOWN_ENABLED, false);

            assertEquals(before + 1, service.getConfig().getVersion());
            assertNull(save(message("**bold**")).getMarkup());
        }

        @Test
        void closeStopsFollowing() {
            service.close();
            settings.put(PipelineSettingKeys.QUOTE_CHAIN_LIMIT, 7);
            assertEquals(2, service.getConfig().getQuoteChainLimit());
        }
    }

    @Nested
    class SystemMessages {

        private final List<String> stored = new CopyOnWriteArrayList<>();
        private final List<String> broadcast = new CopyOnWriteArrayList<>();

        private MessageService withStore(CompletableFuture<Void> broadcastResult) {
            return withStore(new PipelineConfigHolder(), broadcastResult);
        }

        private MessageService withStore(PipelineConfigHolder holder, CompletableFuture<Void> broadcastResult) {
            return new MessageService(holder, collaborators()
                    .systemMessageStore((type, roomId, text, owner, extra, readReceipts) -> {
                        stored.add(type + "|" + roomId + "|" + text + "|" + owner.username() + "|" + extra
                                + "|" + readReceipts);
                        return CompletableFuture.completedFuture("sys-1");
                    })
                    .broadcaster(id -> {
                        broadcast.add(id);
                        return broadcastResult;
                    })
                    .build());
        }

        @Test
        void storesAndBroadcasts() {
            var service = withStore(CompletableFuture.completedFuture(null));

            String id = service.saveSystemMessage("user-joined", ROOM.id(), "bob joined", BOB,
                    Map.of("role", "guest")).join();

            assertEquals("sys-1", id);
            assertEquals(List.of("user-joined|room-1|bob joined|bob|{role=guest}|false"), stored);
            assertEquals(List.of("sys-1"), broadcast);
        }

        @Test
        void passesReadReceiptSetting() {
            PipelineConfigHolder holder = new PipelineConfigHolder();
            holder.apply(Map.of(PipelineSettingKeys.READ_RECEIPTS_ENABLED, true));
            var service = withStore(holder, CompletableFuture.completedFuture(null));

            service.saveSystemMessage("user-joined", ROOM.id(), "bob joined", BOB, Map.of()).join();

            assertEquals(List.of("user-joined|room-1|bob joined|bob|{}|true"), stored);
        }

        @Test
        void broadcastFailureDoesNotFailSave() {
            var service = withStore(CompletableFuture.failedFuture(new IllegalStateException("bus down")));

            assertEquals("sys-1", service.saveSystemMessage("user-joined", ROOM.id(), "x", BOB, null).join());
        }

        @Test
        void emptyUsernameIsRejected() {
            var service = withStore(CompletableFuture.completedFuture(null));
            MessageSender nameless = new MessageSender("u-x", "", "X");

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> service.saveSystemMessage("user-joined", ROOM.id(), "x", nameless, Map.of()));
            assertEquals("The username cannot be empty.", e.getMessage());
            assertTrue(stored.isEmpty());
        }
    }
}
