package com.parley.messages.pipeline;

import com.parley.messages.model.Message;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a message is new enough to be validated.
 */
public final class FreshnessGate {

    private FreshnessGate() {
    }

    /**
     * True when the message is not edited and either has no creation time or
     * was created within {@code window} of {@code now}, in either direction.
     */
    public static boolean isFreshAndUnedited(Message message, Instant now, Duration window) {
        if (message.isEdited()) {
            return false;
        }
        Instant createdAt = message.getCreatedAt();
        if (createdAt == null) {
            return true;
        }
        return Duration.between(createdAt, now).abs().compareTo(window) <= 0;
    }
}
