package com.parley.messages.pipeline.check;

import com.parley.messages.model.Message;
import com.parley.messages.pipeline.PipelineContext;

import java.util.Optional;

/**
 * A named rule a message must satisfy before it is stored. The active policy
 * is selected by the {@code constraint.policy} setting.
 */
public interface ConstraintPolicy {

    String name();

    Optional<ConstraintViolation> evaluate(Message message, PipelineContext context);
}
