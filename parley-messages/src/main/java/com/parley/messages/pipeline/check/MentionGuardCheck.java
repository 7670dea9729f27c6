package com.parley.messages.pipeline.check;

import com.parley.common.markdown.MessageMarkup;
import com.parley.messages.model.Message;
import com.parley.messages.pipeline.MessageCheck;
import com.parley.messages.pipeline.PipelineContext;
import com.parley.messages.pipeline.Veto;
import com.parley.messages.spi.AuthorizationCheck;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Rejects a collective mention when the sender lacks the matching permission
 * in the room.
 *
 * <p>
 * Mentions come from the rendered markup when present (so mentions inside
 * code do not count), otherwise from the raw text.
 */
@Slf4j
public class MentionGuardCheck implements MessageCheck {

    public static final String ERROR_CODE = "error-action-not-allowed";

    private final MentionKind kind;
    private final AuthorizationCheck authorization;

    public MentionGuardCheck(MentionKind kind, AuthorizationCheck authorization) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.authorization = Objects.requireNonNull(authorization, "authorization");
    }

    public MentionKind getKind() {
        return kind;
    }

    @Override
    public String name() {
        return "MentionGuard[" + kind + "]";
    }

    @Override
    public CompletableFuture<Optional<Veto>> check(Message message, PipelineContext context) {
        if (!mentions(message)) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        String userId = context.user().id();
        return authorization.hasPermission(userId, kind.permission(), context.room().id())
                .thenApply(allowed -> {
                    if (Boolean.TRUE.equals(allowed)) {
                        return Optional.<Veto>empty();
                    }
                    log.debug("User {} lacks {} in room {}", userId, kind.permission(), context.room().id());
                    return Optional.of(new Veto(kind.vetoKind(), ERROR_CODE, kind.action() + " not allowed"));
                });
    }

    private boolean mentions(Message message) {
        MessageMarkup markup = message.getMarkup();
        if (markup != null) {
            return markup.mentions().stream()
                    .anyMatch(name -> kind.tokens().contains(name.toLowerCase(Locale.ROOT)));
        }
        return kind.isMentionedIn(message.getText());
    }
}
