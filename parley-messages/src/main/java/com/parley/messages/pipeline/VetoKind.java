package com.parley.messages.pipeline;

public enum VetoKind {
    MENTION_EVERYONE,
    MENTION_HERE,
    CONSTRAINT_EXCEEDED
}
