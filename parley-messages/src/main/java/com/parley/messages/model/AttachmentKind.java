package com.parley.messages.model;

public enum AttachmentKind {
    STREAMING_LINK,
    QUOTED_MESSAGE
}
