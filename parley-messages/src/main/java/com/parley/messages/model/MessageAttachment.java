package com.parley.messages.model;

/**
 * Structured content attached to a message by the pipeline.
 */
public interface MessageAttachment {

    AttachmentKind kind();
}
