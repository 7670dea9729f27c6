package com.parley.common.markdown;

import java.util.List;

/**
 * Inline rules enabled for {@link MessageMarkupParser}.
 *
 * @param colors        render {@code color:#rrggbb} tokens as color previews
 * @param emoticons     render {@code :shortcode:} tokens as emoji
 * @param customDomains bare host names to auto-link even without a scheme
 * @param katex         math syntax options, or null when math is disabled
 */
public record MarkupOptions(boolean colors, boolean emoticons, List<String> customDomains, KatexOptions katex) {

    public record KatexOptions(boolean dollarSyntax, boolean parenthesisSyntax) {
    }

    public MarkupOptions {
        customDomains = customDomains != null ? List.copyOf(customDomains) : List.of();
    }

    public static MarkupOptions defaults() {
        return new MarkupOptions(false, true, List.of(), null);
    }
}
