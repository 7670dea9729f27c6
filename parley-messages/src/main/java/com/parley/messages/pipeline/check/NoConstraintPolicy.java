package com.parley.messages.pipeline.check;

import com.parley.messages.model.Message;
import com.parley.messages.pipeline.PipelineContext;

import java.util.Optional;

public class NoConstraintPolicy implements ConstraintPolicy {

    public static final String NAME = "none";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<ConstraintViolation> evaluate(Message message, PipelineContext context) {
        return Optional.empty();
    }
}
