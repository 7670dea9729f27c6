package com.parley.messages.pipeline;

import java.util.Objects;

/**
 * Why a check rejected a message.
 *
 * @param errorCode stable machine-readable code, e.g.
 *                  {@code error-action-not-allowed}
 * @param reason    human-readable explanation
 */
public record Veto(VetoKind kind, String errorCode, String reason) {

    public Veto {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(errorCode, "errorCode");
    }
}
