package com.parley.messages.pipeline.stage;

import com.parley.common.markdown.MessageMarkup;
import com.parley.messages.config.PipelineConfig;
import com.parley.messages.model.Message;
import com.parley.messages.pipeline.MessageStage;
import com.parley.messages.pipeline.PipelineContext;
import com.parley.messages.text.BadWordsFilter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Masks banned words in the raw text and in the rendered markup, including
 * link targets and mentions. Masks keep the token length, so markup spans
 * stay aligned.
 */
@Slf4j
public class BadWordsStage implements MessageStage {

    @Override
    public boolean isEnabled(PipelineConfig config) {
        return config.getBadWords().isEnabled();
    }

    @Override
    public CompletableFuture<Message> apply(Message message, PipelineContext context) {
        BadWordsFilter filter = context.config().getBadWords();

        String text = message.getText();
        String masked = filter.mask(text);
        if (!masked.equals(text)) {
            log.debug("Masked banned words in message {}", message.getId());
            message.setText(masked);
        }

        MessageMarkup markup = message.getMarkup();
        MessageMarkup maskedMarkup = filter.maskMarkup(markup);
        if (maskedMarkup != markup) {
            message.setMarkup(maskedMarkup);
        }
        return CompletableFuture.completedFuture(message);
    }
}
