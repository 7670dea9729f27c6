package com.parley.messages.model;

import com.parley.common.markdown.MessageMarkup;
import lombok.Builder;

import java.time.Instant;

/**
 * Another message quoted through a permalink.
 *
 * @param authorName      display name shown for the quoted author
 * @param authorUsername  username of the quoted author
 * @param authorAvatarUrl avatar URL, empty when it could not be resolved
 * @param text            quoted raw text
 * @param markup          quoted rendered markup, may be null
 * @param messageLink     the permalink that produced this quote
 */
@Builder
public record QuotedMessageAttachment(
        String authorName,
        String authorUsername,
        String authorAvatarUrl,
        String text,
        MessageMarkup markup,
        String messageLink,
        String roomId,
        String messageId,
        Instant quotedAt) implements MessageAttachment {

    @Override
    public AttachmentKind kind() {
        return AttachmentKind.QUOTED_MESSAGE;
    }
}
