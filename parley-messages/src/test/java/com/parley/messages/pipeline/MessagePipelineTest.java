package com.parley.messages.pipeline;

import com.parley.messages.config.PipelineConfig;
import com.parley.messages.config.PipelineConfigHolder;
import com.parley.messages.config.PipelineSettingKeys;
import com.parley.messages.model.Message;
import com.parley.messages.model.StreamingLinkAttachment;
import com.parley.messages.pipeline.stage.BadWordsStage;
import com.parley.messages.pipeline.stage.MarkdownStage;
import com.parley.messages.text.BadWordsFilter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static com.parley.messages.MessageFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class MessagePipelineTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private MessagePipeline pipeline(PipelineConfig config, List<MessageStage> stages, List<MessageCheck> checks) {
        return new MessagePipeline(() -> config, stages, checks, executor, CLOCK);
    }

    private static MessageStage stage(String name, Consumer<Message> body) {
        return new MessageStage() {
            @Override
            public CompletableFuture<Message> apply(Message message, PipelineContext context) {
                body.accept(message);
                return CompletableFuture.completedFuture(message);
            }

            @Override
            public String name() {
                return name;
            }
        };
    }

    private static MessageCheck vetoing(VetoKind kind) {
        return (message, context) -> CompletableFuture.completedFuture(
                Optional.of(new Veto(kind, "error-" + kind, "rejected by " + kind)));
    }

    private static MessageVetoException vetoOf(CompletableFuture<Message> result) {
        CompletionException e = assertThrows(CompletionException.class, result::join);
        return assertInstanceOf(MessageVetoException.class, e.getCause());
    }

    @Nested
    class Stages {

        @Test
        void runInListOrder() {
            var p = pipeline(config(), List.of(
                    stage("a", m -> m.setText(m.getText() + "a")),
                    stage("b", m -> m.setText(m.getText() + "b")),
                    stage("c", m -> m.setText(m.getText() + "c"))), List.of());

            assertEquals(">abc", p.process(message(">"), ROOM, USER).join().getText());
        }

        @Test
        void callerMessageIsNotMutated() {
            Message original = message("hello");
            var p = pipeline(config(), List.of(stage("mutate", m -> {
                m.setText("changed");
                m.appendAttachment(new StreamingLinkAttachment("p", "track", "1", "u"));
            })), List.of());

            Message result = p.process(original, ROOM, USER).join();

            assertEquals("changed", result.getText());
            assertEquals("hello", original.getText());
            assertTrue(original.getAttachments().isEmpty());
            assertNotSame(original, result);
        }

        @Test
        void failingStageIsSkipped() {
            MessageStage throwing = stage("boom", m -> {
                throw new IllegalStateException("boom");
            });
            MessageStage failing = (message, context) -> CompletableFuture.failedFuture(new RuntimeException("async"));
            var p = pipeline(config(), List.of(
                    stage("a", m -> m.setText("a")),
                    throwing,
                    failing,
                    stage("b", m -> m.setText(m.getText() + "b"))), List.of());

            assertEquals("ab", p.process(message("x"), ROOM, USER).join().getText());
        }

        @Test
        void outputWithDifferentIdentityIsDiscarded() {
            MessageStage swapper = (message, context) -> CompletableFuture.completedFuture(
                    Message.builder().id("other").roomId(message.getRoomId()).text("hijacked").build());
            var p = pipeline(config(), List.of(swapper), List.of());

            Message result = p.process(message("kept"), ROOM, USER).join();
            assertEquals("m-new", result.getId());
            assertEquals("kept", result.getText());
        }

        @Test
        void disabledStageDoesNotRun() {
            AtomicInteger runs = new AtomicInteger();
            MessageStage disabled = new MessageStage() {
                @Override
                public CompletableFuture<Message> apply(Message message, PipelineContext context) {
                    runs.incrementAndGet();
                    return CompletableFuture.completedFuture(message);
                }

                @Override
                public boolean isEnabled(PipelineConfig config) {
                    return false;
                }
            };
            pipeline(config(), List.of(disabled), List.of()).process(message("x"), ROOM, USER).join();
            assertEquals(0, runs.get());
        }

        @Test
        void nullArgumentsAreRejected() {
            var p = pipeline(config(), List.of(), List.of());
            assertThrows(NullPointerException.class, () -> p.process(null, ROOM, USER));
            assertThrows(NullPointerException.class, () -> p.process(message("x"), null, USER));
            assertThrows(NullPointerException.class, () -> p.process(message("x"), ROOM, null));
        }
    }

    @Nested
    class Checks {

        @Test
        void vetoRejectsWithTransformedMessage() {
            var p = pipeline(config(), List.of(new MarkdownStage()), List.of(vetoing(VetoKind.MENTION_HERE)));

            MessageVetoException veto = vetoOf(p.process(message("**hi** @here"), ROOM, USER));

            assertEquals(VetoKind.MENTION_HERE, veto.getKind());
            assertEquals("error-MENTION_HERE", veto.getErrorCode());
            assertNotNull(veto.getRejectedMessage().getMarkup());
            assertEquals("hi @here", veto.getRejectedMessage().getMarkup().text());
        }

        @Test
        void firstVetoInDispatchOrderIsReported() {
            MessageCheck slowConstraint = (message, context) -> CompletableFuture.supplyAsync(() -> {
                sleep(100);
                return Optional.of(new Veto(VetoKind.CONSTRAINT_EXCEEDED, "error-size", "too long"));
            }, executor);
            var p = pipeline(config(), List.of(), List.of(
                    slowConstraint, vetoing(VetoKind.MENTION_EVERYONE), vetoing(VetoKind.MENTION_HERE)));

            assertEquals(VetoKind.CONSTRAINT_EXCEEDED, vetoOf(p.process(message("x"), ROOM, USER)).getKind());
        }

        @Test
        void checksRunConcurrently() {
            CountDownLatch allStarted = new CountDownLatch(3);
            MessageCheck rendezvous = (message, context) -> {
                allStarted.countDown();
                boolean together = await(allStarted);
                return CompletableFuture.completedFuture(together ? Optional.<Veto>empty()
                        : Optional.of(new Veto(VetoKind.CONSTRAINT_EXCEEDED, "error-serial", "ran alone")));
            };
            var p = pipeline(config(), List.of(), List.of(rendezvous, rendezvous, rendezvous));

            assertEquals("x", p.process(message("x"), ROOM, USER).join().getText());
        }

        @Test
        void collaboratorFailurePropagates() {
            MessageCheck broken = (message, context) -> CompletableFuture.failedFuture(new IllegalStateException("db down"));
            var p = pipeline(config(), List.of(), List.of(broken));

            CompletionException e = assertThrows(CompletionException.class, () -> p.process(message("x"), ROOM, USER).join());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        void editedMessageSkipsChecks() {
            AtomicInteger runs = new AtomicInteger();
            MessageCheck counting = (message, context) -> {
                runs.incrementAndGet();
                return CompletableFuture.completedFuture(Optional.of(new Veto(VetoKind.MENTION_HERE, "e", "r")));
            };
            var p = pipeline(config(), List.of(), List.of(counting));
            Message edited = message("@here").toBuilder().editedAt(NOW).editedBy(USER.id()).build();

            assertEquals("@here", p.process(edited, ROOM, USER).join().getText());
            assertEquals(0, runs.get());
        }

        @Test
        void staleMessageSkipsChecks() {
            var p = pipeline(config(), List.of(), List.of(vetoing(VetoKind.MENTION_HERE)));
            Message stale = message("@here").toBuilder().createdAt(NOW.minusSeconds(61)).build();

            assertDoesNotThrow(() -> p.process(stale, ROOM, USER).join());
        }

        @Test
        void editedMessagesCheckedWhenConfigured() {
            PipelineConfig config = config().toBuilder().includeEditedAndStale(true).build();
            var p = pipeline(config, List.of(), List.of(vetoing(VetoKind.MENTION_HERE)));
            Message edited = message("@here").toBuilder()
                    .createdAt(Instant.EPOCH).editedAt(NOW).editedBy(USER.id()).build();

            assertEquals(VetoKind.MENTION_HERE, vetoOf(p.process(edited, ROOM, USER)).getKind());
        }
    }

    @Test
    void runKeepsSnapshotItStartedWith() {
        var holder = new PipelineConfigHolder();
        holder.apply(Map.of(
                PipelineSettingKeys.BAD_WORDS_ENABLED, true,
                PipelineSettingKeys.BAD_WORDS_LIST, "damn"));
        CompletableFuture<Void> gate = new CompletableFuture<>();
        MessageStage waiting = (message, context) -> gate.thenApply(ignored -> message);
        var p = new MessagePipeline(holder, List.of(waiting, new BadWordsStage()), List.of(), executor, CLOCK);

        CompletableFuture<Message> inFlight = p.process(message("damn it"), ROOM, USER);
        holder.apply(Map.of(PipelineSettingKeys.BAD_WORDS_ENABLED, false));
        assertEquals(BadWordsFilter.disabled(), holder.get().getBadWords());
        gate.complete(null);

        assertEquals("**** it", inFlight.join().getText());
        assertEquals("damn it", p.process(message("damn it"), ROOM, USER).join().getText());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean await(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
