package com.parley.messages.pipeline;

import com.parley.messages.config.PipelineConfig;
import com.parley.messages.model.ActingUser;
import com.parley.messages.model.Message;
import com.parley.messages.model.Room;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Runs a message through the ordered stages, then through the concurrent
 * check group.
 *
 * <p>
 * Each run works on a copy of the caller's message and reads the config
 * snapshot once. Stages run strictly in list order, each one composed on the
 * previous; a stage that fails is logged and skipped. Checks run only for
 * fresh, unedited messages (unless the snapshot says otherwise), are
 * dispatched together on the executor and joined with {@code allOf}. The
 * first veto in dispatch order rejects the run with a
 * {@link MessageVetoException}.
 */
@Slf4j
public class MessagePipeline {

    private final Supplier<PipelineConfig> configSupplier;
    private final List<MessageStage> stages;
    private final List<MessageCheck> checks;
    private final Executor checkExecutor;
    private final Clock clock;

    public MessagePipeline(Supplier<PipelineConfig> configSupplier, List<MessageStage> stages,
            List<MessageCheck> checks, Executor checkExecutor, Clock clock) {
        this.configSupplier = Objects.requireNonNull(configSupplier, "configSupplier");
        this.stages = List.copyOf(stages);
        this.checks = List.copyOf(checks);
        this.checkExecutor = Objects.requireNonNull(checkExecutor, "checkExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Transform and validate a message.
     *
     * @return a future completing with the transformed message, or failing with
     *         {@link MessageVetoException} when a check rejects it
     * @throws NullPointerException if any argument is null
     */
    public CompletableFuture<Message> process(Message message, Room room, ActingUser user) {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(room, "room");
        Objects.requireNonNull(user, "user");

        PipelineContext context = new PipelineContext(room, user, configSupplier.get(), clock.instant());
        log.debug("Processing {} in room {} with config v{}",
                message.getId(), room.id(), context.config().getVersion());

        CompletableFuture<Message> chain = CompletableFuture.completedFuture(message.copy());
        for (MessageStage stage : stages) {
            chain = chain.thenCompose(current -> runStage(stage, current, context));
        }
        return chain.thenCompose(transformed -> validate(transformed, context));
    }

    // =========================================================================
    // Stages
    // =========================================================================

    private CompletableFuture<Message> runStage(MessageStage stage, Message current, PipelineContext context) {
        if (!stage.isEnabled(context.config())) {
            return CompletableFuture.completedFuture(current);
        }
        CompletableFuture<Message> result;
        try {
            result = stage.apply(current, context);
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        if (result == null) {
            return CompletableFuture.completedFuture(current);
        }
        return result.handle((next, error) -> {
            if (error != null) {
                log.warn("Stage {} failed on message {}, continuing without it: {}",
                        stage.name(), current.getId(), error.getMessage(), error);
                return current;
            }
            if (next == null) {
                return current;
            }
            if (!next.getId().equals(current.getId()) || !next.getRoomId().equals(current.getRoomId())) {
                log.warn("Stage {} changed the identity of message {}, discarding its output",
                        stage.name(), current.getId());
                return current;
            }
            return next;
        });
    }

    // =========================================================================
    // Checks
    // =========================================================================

    private CompletableFuture<Message> validate(Message message, PipelineContext context) {
        PipelineConfig config = context.config();
        boolean fresh = FreshnessGate.isFreshAndUnedited(message, context.now(), config.getFreshnessWindow());
        if (checks.isEmpty() || (!fresh && !config.isIncludeEditedAndStale())) {
            log.debug("Skipping checks for message {} (fresh={})", message.getId(), fresh);
            return CompletableFuture.completedFuture(message);
        }

        List<CompletableFuture<Optional<Veto>>> pending = new ArrayList<>(checks.size());
        for (MessageCheck check : checks) {
            pending.add(dispatch(check, message, context));
        }

        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenCompose(ignored -> {
                    for (CompletableFuture<Optional<Veto>> result : pending) {
                        Optional<Veto> veto = result.join();
                        if (veto.isPresent()) {
                            log.info("Message {} rejected: {} ({})",
                                    message.getId(), veto.get().kind(), veto.get().errorCode());
                            return CompletableFuture.<Message>failedFuture(new MessageVetoException(veto.get(), message));
                        }
                    }
                    return CompletableFuture.completedFuture(message);
                });
    }

    private CompletableFuture<Optional<Veto>> dispatch(MessageCheck check, Message message, PipelineContext context) {
        return CompletableFuture
                .supplyAsync(() -> check.check(message, context), checkExecutor)
                .thenCompose(future -> future)
                .thenApply(veto -> veto != null ? veto : Optional.<Veto>empty());
    }
}
