package com.parley.messages.pipeline.check;

import com.parley.messages.model.Message;
import com.parley.messages.pipeline.PipelineContext;

import java.util.Optional;

/**
 * Rejects messages whose raw text is longer than
 * {@code message.maxAllowedSize}. A limit of zero or less disables the check.
 */
public class MaxLengthPolicy implements ConstraintPolicy {

    public static final String NAME = "max-length";
    public static final String ERROR_CODE = "error-message-size-exceeded";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<ConstraintViolation> evaluate(Message message, PipelineContext context) {
        int limit = context.config().getMaxMessageLength();
        int length = message.getText().length();
        if (limit <= 0 || length <= limit) {
            return Optional.empty();
        }
        return Optional.of(new ConstraintViolation(ERROR_CODE,
                "Message size " + length + " exceeds the limit of " + limit + " characters"));
    }
}
