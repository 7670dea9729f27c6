package com.parley.messages.model;

import com.parley.common.markdown.MessageMarkup;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A chat message as it travels through the pre-persistence pipeline.
 *
 * <p>
 * Identity fields are fixed at construction. Text and markup may be rewritten
 * by pipeline stages; attachments can only be appended.
 */
@Getter
public class Message {

    private final String id;
    private final String roomId;
    private final MessageSender sender;
    private final Instant createdAt;
    private final Instant editedAt;
    private final String editedBy;

    private String text;
    private MessageMarkup markup;
    private final List<MessageAttachment> attachments;

    @Builder(toBuilder = true)
    private Message(String id, String roomId, MessageSender sender, String text, MessageMarkup markup,
            @Singular List<MessageAttachment> attachments, Instant createdAt, Instant editedAt,
            String editedBy) {
        this.id = Objects.requireNonNull(id, "id");
        this.roomId = Objects.requireNonNull(roomId, "roomId");
        this.sender = sender;
        this.text = text != null ? text : "";
        this.markup = markup;
        this.attachments = new ArrayList<>(attachments != null ? attachments : List.of());
        this.createdAt = createdAt;
        this.editedAt = editedAt;
        this.editedBy = editedBy;
    }

    /**
     * Attachments in the order they were added. The view is read-only; use
     * {@link #appendAttachment}.
     */
    public List<MessageAttachment> getAttachments() {
        return Collections.unmodifiableList(attachments);
    }

    public void setText(String text) {
        this.text = text != null ? text : "";
    }

    public void setMarkup(MessageMarkup markup) {
        this.markup = markup;
    }

    public void appendAttachment(MessageAttachment attachment) {
        attachments.add(Objects.requireNonNull(attachment, "attachment"));
    }

    public boolean isEdited() {
        return editedAt != null;
    }

    /**
     * An independent copy; appending to the copy does not affect this message.
     */
    public Message copy() {
        return toBuilder().build();
    }

    @Override
    public String toString() {
        return "Message{id=" + id + ", roomId=" + roomId
                + ", attachments=" + attachments.size()
                + (isEdited() ? ", edited" : "") + "}";
    }
}
