package com.parley.messages.config;

import java.util.Set;

/**
 * Setting keys read into {@link PipelineConfig}.
 */
public final class PipelineSettingKeys {

    private PipelineSettingKeys() {
    }

    // Markdown
    public static final String MARKDOWN_ENABLED = "markdown.enabled";
    public static final String MARKDOWN_COLORS = "markdown.colors";
    public static final String MARKDOWN_CUSTOM_DOMAINS = "markdown.customDomains";
    public static final String KATEX_ENABLED = "markdown.katex.enabled";
    public static final String KATEX_DOLLAR_SYNTAX = "markdown.katex.dollarSyntax";
    public static final String KATEX_PARENTHESIS_SYNTAX = "markdown.katex.parenthesisSyntax";

    // Bad words
    public static final String BAD_WORDS_ENABLED = "message.badWords.enabled";
    public static final String BAD_WORDS_LIST = "message.badWords.list";
    public static final String BAD_WORDS_WHITELIST = "message.badWords.whitelist";

    // Streaming links
    public static final String STREAMING_LINKS_ENABLED = "message.streamingLinks.enabled";
    public static final String STREAMING_LINKS_HOSTS = "message.streamingLinks.hosts";
    public static final String STREAMING_LINKS_URI_SCHEME = "message.streamingLinks.uriScheme";

    // Quotes
    public static final String QUOTE_CHAIN_LIMIT = "message.quoteChainLimit";
    public static final String SITE_URL = "site.url";
    public static final String USE_REAL_NAME = "ui.useRealName";
    public static final String READ_RECEIPTS_ENABLED = "message.readReceipts.enabled";

    // Validation
    public static final String FRESHNESS_WINDOW_SECONDS = "message.freshnessWindowSeconds";
    public static final String INCLUDE_EDITED_AND_STALE = "validation.includeEditedAndStale";
    public static final String CONSTRAINT_POLICY = "constraint.policy";
    public static final String MAX_ALLOWED_SIZE = "message.maxAllowedSize";
    public static final String RATE_MAX_MESSAGES = "constraint.rate.maxMessages";
    public static final String RATE_WINDOW_SECONDS = "constraint.rate.windowSeconds";

    public static final Set<String> ALL = Set.of(
            MARKDOWN_ENABLED, MARKDOWN_COLORS, MARKDOWN_CUSTOM_DOMAINS,
            KATEX_ENABLED, KATEX_DOLLAR_SYNTAX, KATEX_PARENTHESIS_SYNTAX,
            BAD_WORDS_ENABLED, BAD_WORDS_LIST, BAD_WORDS_WHITELIST,
            STREAMING_LINKS_ENABLED, STREAMING_LINKS_HOSTS, STREAMING_LINKS_URI_SCHEME,
            QUOTE_CHAIN_LIMIT, SITE_URL, USE_REAL_NAME, READ_RECEIPTS_ENABLED,
            FRESHNESS_WINDOW_SECONDS, INCLUDE_EDITED_AND_STALE, CONSTRAINT_POLICY,
            MAX_ALLOWED_SIZE, RATE_MAX_MESSAGES, RATE_WINDOW_SECONDS);
}
