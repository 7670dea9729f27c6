package com.parley.messages.pipeline.stage;

import com.parley.messages.config.PipelineConfig;
import com.parley.messages.model.Message;
import com.parley.messages.model.StreamingLinkAttachment;
import com.parley.messages.pipeline.MessageStage;
import com.parley.messages.pipeline.PipelineContext;
import com.parley.messages.text.StreamingLinkMatcher.StreamingLink;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Appends a preview attachment for every music-streaming link or resource URI
 * in the text, left to right. The text itself is not touched.
 */
public class StreamingLinkStage implements MessageStage {

    @Override
    public boolean isEnabled(PipelineConfig config) {
        return config.isStreamingLinksEnabled();
    }

    @Override
    public CompletableFuture<Message> apply(Message message, PipelineContext context) {
        List<StreamingLink> links = context.config().getStreamingLinks().find(message.getText());
        for (StreamingLink link : links) {
            message.appendAttachment(new StreamingLinkAttachment(
                    link.provider(), link.resourceType(), link.resourceId(), link.url()));
        }
        return CompletableFuture.completedFuture(message);
    }
}
