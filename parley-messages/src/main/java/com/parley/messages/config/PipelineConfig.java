package com.parley.messages.config;

import com.parley.common.config.SettingsValues;
import com.parley.common.markdown.MarkupOptions;
import com.parley.messages.text.BadWordsFilter;
import com.parley.messages.text.StreamingLinkMatcher;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.parley.messages.config.PipelineSettingKeys.*;

/**
 * Immutable snapshot of every parameter the message pipeline reads.
 *
 * <p>
 * A pipeline run reads one snapshot at its start and uses it throughout, so a
 * settings change never becomes visible half-way through a message.
 * Matchers (bad words, streaming links) are compiled when the snapshot is
 * built.
 */
@Getter
@Builder(toBuilder = true)
public final class PipelineConfig {

    public static final String DEFAULT_SITE_URL = "http://localhost:3000";
    public static final List<String> DEFAULT_STREAMING_HOSTS = List.of("open.spotify.com");
    public static final String DEFAULT_STREAMING_SCHEME = "spotify";

    /** Monotonic; 0 for the built-in defaults. */
    private final long version;

    @Builder.Default
    private final boolean markdownEnabled = true;
    @Builder.Default
    private final MarkupOptions markupOptions = new MarkupOptions(false, true, List.of(),
            new MarkupOptions.KatexOptions(false, true));

    @Builder.Default
    private final BadWordsFilter badWords = BadWordsFilter.disabled();

    @Builder.Default
    private final boolean streamingLinksEnabled = true;
    @Builder.Default
    private final StreamingLinkMatcher streamingLinks = StreamingLinkMatcher.of(
            DEFAULT_STREAMING_HOSTS, DEFAULT_STREAMING_SCHEME);

    @Builder.Default
    private final int quoteChainLimit = 2;
    @Builder.Default
    private final String siteUrl = DEFAULT_SITE_URL;
    private final boolean useRealName;
    /** Passed to the system message store along with each insert. */
    private final boolean readReceiptsEnabled;

    @Builder.Default
    private final Duration freshnessWindow = Duration.ofSeconds(60);
    /** Run the pre-save checks on edited and stale messages too. */
    private final boolean includeEditedAndStale;

    @Builder.Default
    private final String constraintPolicy = "max-length";
    @Builder.Default
    private final int maxMessageLength = 5000;
    @Builder.Default
    private final int rateMaxMessages = 10;
    @Builder.Default
    private final Duration rateWindow = Duration.ofSeconds(10);

    public static PipelineConfig defaults() {
        return builder().build();
    }

    /**
     * Build a snapshot from raw setting values. Missing keys keep their
     * defaults; unconvertible values fall back to defaults with a warning.
     */
    public static PipelineConfig fromSettings(Map<String, Object> settings, long version) {
        SettingsValues v = SettingsValues.of(settings);
        PipelineConfig d = defaults();

        MarkupOptions.KatexOptions katex = v.getBoolean(KATEX_ENABLED, true)
                ? new MarkupOptions.KatexOptions(
                        v.getBoolean(KATEX_DOLLAR_SYNTAX, false),
                        v.getBoolean(KATEX_PARENTHESIS_SYNTAX, true))
                : null;
        MarkupOptions markup = new MarkupOptions(
                v.getBoolean(MARKDOWN_COLORS, false),
                true,
                v.getList(MARKDOWN_CUSTOM_DOMAINS, List.of()),
                katex);

        BadWordsFilter badWords = v.getBoolean(BAD_WORDS_ENABLED, false)
                ? BadWordsFilter.of(v.getList(BAD_WORDS_LIST, List.of()), v.getList(BAD_WORDS_WHITELIST, List.of()))
                : BadWordsFilter.disabled();

        StreamingLinkMatcher streaming = StreamingLinkMatcher.of(
                v.getList(STREAMING_LINKS_HOSTS, DEFAULT_STREAMING_HOSTS),
                v.getString(STREAMING_LINKS_URI_SCHEME, DEFAULT_STREAMING_SCHEME));

        return builder()
                .version(version)
                .markdownEnabled(v.getBoolean(MARKDOWN_ENABLED, d.markdownEnabled))
                .markupOptions(markup)
                .badWords(badWords)
                .streamingLinksEnabled(v.getBoolean(STREAMING_LINKS_ENABLED, d.streamingLinksEnabled))
                .streamingLinks(streaming)
                .quoteChainLimit(Math.max(0, v.getInt(QUOTE_CHAIN_LIMIT, d.quoteChainLimit)))
                .siteUrl(v.getString(SITE_URL, d.siteUrl))
                .useRealName(v.getBoolean(USE_REAL_NAME, false))
                .readReceiptsEnabled(v.getBoolean(READ_RECEIPTS_ENABLED, false))
                .freshnessWindow(v.getSeconds(FRESHNESS_WINDOW_SECONDS, d.freshnessWindow))
                .includeEditedAndStale(v.getBoolean(INCLUDE_EDITED_AND_STALE, false))
                .constraintPolicy(v.getString(CONSTRAINT_POLICY, d.constraintPolicy).trim())
                .maxMessageLength(v.getInt(MAX_ALLOWED_SIZE, d.maxMessageLength))
                .rateMaxMessages(v.getInt(RATE_MAX_MESSAGES, d.rateMaxMessages))
                .rateWindow(v.getSeconds(RATE_WINDOW_SECONDS, d.rateWindow))
                .build();
    }

    @Override
    public String toString() {
        return "PipelineConfig{version=" + version
                + ", markdown=" + markdownEnabled
                + ", badWords=" + badWords.isEnabled()
                + ", streamingLinks=" + streamingLinksEnabled
                + ", quoteChainLimit=" + quoteChainLimit
                + ", constraintPolicy=" + constraintPolicy + "}";
    }
}
