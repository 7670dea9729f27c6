package com.parley.messages.pipeline.stage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.parley.common.markdown.MarkupOptions;
import com.parley.common.markdown.MessageMarkup;
import com.parley.common.markdown.MessageMarkupParser;
import com.parley.messages.config.PipelineConfig;
import com.parley.messages.model.Message;
import com.parley.messages.pipeline.MessageStage;
import com.parley.messages.pipeline.PipelineContext;

import java.util.concurrent.CompletableFuture;

/**
 * Renders the raw text into {@link MessageMarkup}. The raw text is left as is
 * and always used as the input, so re-running the stage gives the same result.
 */
public class MarkdownStage implements MessageStage {

    // One parser per distinct option set; a settings change adds a new entry.
    private final Cache<MarkupOptions, MessageMarkupParser> parsers = Caffeine.newBuilder()
            .maximumSize(8)
            .build();

    @Override
    public boolean isEnabled(PipelineConfig config) {
        return config.isMarkdownEnabled();
    }

    @Override
    public CompletableFuture<Message> apply(Message message, PipelineContext context) {
        MessageMarkupParser parser = parsers.get(context.config().getMarkupOptions(), MessageMarkupParser::new);
        message.setMarkup(parser.parse(message.getText()));
        return CompletableFuture.completedFuture(message);
    }
}
