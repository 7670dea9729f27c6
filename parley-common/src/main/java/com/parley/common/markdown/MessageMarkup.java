package com.parley.common.markdown;

import java.util.ArrayList;
import java.util.List;

/**
 * Rendered form of a chat message: plain text with style spans, link spans and
 * the user mentions found outside code.
 *
 * <p>
 * Span offsets index into {@link #text()}. Two markups parsed from the same
 * input with the same {@link MarkupOptions} are equal.
 */
public record MessageMarkup(String text, List<StyleSpan> styles, List<LinkSpan> links, List<String> mentions) {

    public enum Style {
        BOLD,
        ITALIC,
        STRIKETHROUGH,
        CODE,
        CODE_BLOCK,
        /** Math expression; the span covers the expression source. */
        MATH,
        /** Emoji shortcode; value is the shortcode name. */
        EMOJI,
        /** Hex color preview; value is the color. */
        COLOR
    }

    /**
     * A style applied to a range of text positions. {@code value} carries
     * style-specific data and is null for plain emphasis styles.
     */
    public record StyleSpan(int start, int end, Style style, String value) {
        public StyleSpan {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid span range: [" + start + ", " + end + ")");
            }
        }

        public StyleSpan(int start, int end, Style style) {
            this(start, end, style, null);
        }
    }

    /**
     * A hyperlink applied to a range of text positions.
     */
    public record LinkSpan(int start, int end, String href) {
        public LinkSpan {
            if (start < 0 || end < start) {
                throw new IllegalArgumentException("Invalid span range: [" + start + ", " + end + ")");
            }
        }
    }

    public MessageMarkup {
        text = text != null ? text : "";
        styles = styles != null ? List.copyOf(styles) : List.of();
        links = links != null ? List.copyOf(links) : List.of();
        mentions = mentions != null ? List.copyOf(mentions) : List.of();
    }

    /**
     * Plain-text markup with no spans or mentions.
     */
    public static MessageMarkup plainText(String text) {
        return new MessageMarkup(text, List.of(), List.of(), List.of());
    }

    /**
     * Same spans over replacement text of the same length, e.g. after masking.
     */
    public MessageMarkup withText(String replacement) {
        if (replacement == null || replacement.length() != text.length()) {
            throw new IllegalArgumentException("Replacement text must keep the original length");
        }
        return new MessageMarkup(replacement, styles, links, mentions);
    }

    public boolean hasStyle(Style style) {
        return styles.stream().anyMatch(s -> s.style() == style);
    }

    /**
     * Whether {@code position} falls inside inline code or a code block.
     */
    public boolean isInCode(int position) {
        for (StyleSpan span : styles) {
            if ((span.style() == Style.CODE || span.style() == Style.CODE_BLOCK)
                    && position >= span.start() && position < span.end()) {
                return true;
            }
        }
        return false;
    }

    // -----------------------------------------------------------------------
    // Builder
    // -----------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing markup incrementally.
     */
    public static class Builder {
        private final StringBuilder text = new StringBuilder();
        private final List<StyleSpan> styles = new ArrayList<>();
        private final List<LinkSpan> links = new ArrayList<>();
        private final List<String> mentions = new ArrayList<>();

        public int position() {
            return text.length();
        }

        public Builder append(String value) {
            if (value != null)
                text.append(value);
            return this;
        }

        public Builder addStyle(int start, int end, Style style, String value) {
            if (start < end) {
                styles.add(new StyleSpan(start, end, style, value));
            }
            return this;
        }

        public Builder addLink(int start, int end, String href) {
            if (start < end && href != null) {
                links.add(new LinkSpan(start, end, href));
            }
            return this;
        }

        public Builder addMention(String name) {
            if (name != null && !name.isEmpty())
                mentions.add(name);
            return this;
        }

        public MessageMarkup build() {
            return new MessageMarkup(text.toString(), styles, links, mentions);
        }
    }

    @Override
    public String toString() {
        return "MessageMarkup{text=" + (text.length() > 50 ? text.substring(0, 50) + "…" : text)
                + ", styles=" + styles.size()
                + ", links=" + links.size()
                + ", mentions=" + mentions + "}";
    }
}
