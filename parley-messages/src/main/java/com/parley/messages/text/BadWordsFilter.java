package com.parley.messages.text;

import com.parley.common.markdown.MessageMarkup;
import com.parley.common.markdown.MessageMarkup.LinkSpan;
import com.parley.common.markdown.MessageMarkup.StyleSpan;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Masks banned words in text.
 *
 * <p>
 * Words match case-insensitively and only as whole tokens: "ass" does not
 * match inside "class". A match that appears in the whitelist is left alone.
 * Each masked token becomes a run of {@code *} of the same length, so offsets
 * into the text stay valid after masking.
 */
public final class BadWordsFilter {

    private static final char MASK = '*';
    private static final String WORD_CHAR = "[\\p{L}\\p{N}_]";
    private static final BadWordsFilter DISABLED = new BadWordsFilter(null, Set.of(), List.of());

    private final Pattern pattern;
    private final Set<String> whitelist;
    private final List<String> words;

    private BadWordsFilter(Pattern pattern, Set<String> whitelist, List<String> words) {
        this.pattern = pattern;
        this.whitelist = whitelist;
        this.words = words;
    }

    public static BadWordsFilter disabled() {
        return DISABLED;
    }

    /**
     * Build a filter; an empty word list yields a disabled filter.
     */
    public static BadWordsFilter of(Collection<String> words, Collection<String> whitelist) {
        List<String> cleaned = words == null ? List.of()
                : words.stream()
                        .filter(w -> w != null && !w.isBlank())
                        .map(String::trim)
                        .distinct()
                        // Longest first so "damnit" wins over "damn"
                        .sorted(Comparator.comparingInt(String::length).reversed())
                        .toList();
        if (cleaned.isEmpty()) {
            return DISABLED;
        }
        String alternation = cleaned.stream().map(Pattern::quote).collect(Collectors.joining("|"));
        Pattern pattern = Pattern.compile(
                "(?<!" + WORD_CHAR + ")(?:" + alternation + ")(?!" + WORD_CHAR + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        Set<String> allowed = whitelist == null ? Set.of()
                : whitelist.stream()
                        .filter(w -> w != null && !w.isBlank())
                        .map(w -> w.trim().toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
        return new BadWordsFilter(pattern, allowed, cleaned);
    }

    public boolean isEnabled() {
        return pattern != null;
    }

    public List<String> words() {
        return words;
    }

    /**
     * Mask every banned, non-whitelisted token. Returns the input instance when
     * nothing was masked.
     */
    public String mask(String text) {
        if (pattern == null || text == null || text.isEmpty()) {
            return text;
        }
        Matcher m = pattern.matcher(text);
        StringBuilder out = null;
        int last = 0;
        while (m.find()) {
            String token = m.group();
            if (whitelist.contains(token.toLowerCase(Locale.ROOT))) {
                continue;
            }
            if (out == null) {
                out = new StringBuilder(text.length());
            }
            out.append(text, last, m.start());
            out.append(String.valueOf(MASK).repeat(token.length()));
            last = m.end();
        }
        if (out == null) {
            return text;
        }
        out.append(text, last, text.length());
        return out.toString();
    }

    /**
     * Mask rendered markup: the text, link targets, mentions and span values.
     * Span offsets are unchanged. Returns the input instance when nothing was
     * masked.
     */
    public MessageMarkup maskMarkup(MessageMarkup markup) {
        if (pattern == null || markup == null) {
            return markup;
        }
        List<StyleSpan> styles = markup.styles().stream()
                .map(s -> s.value() == null ? s : new StyleSpan(s.start(), s.end(), s.style(), mask(s.value())))
                .toList();
        List<LinkSpan> links = markup.links().stream()
                .map(l -> new LinkSpan(l.start(), l.end(), mask(l.href())))
                .toList();
        List<String> mentions = markup.mentions().stream().map(this::mask).toList();
        MessageMarkup masked = new MessageMarkup(mask(markup.text()), styles, links, mentions);
        return masked.equals(markup) ? markup : masked;
    }
}
