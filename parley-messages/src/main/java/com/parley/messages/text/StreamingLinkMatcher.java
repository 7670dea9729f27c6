package com.parley.messages.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds links to music-streaming resources.
 *
 * <p>
 * Two shapes are recognized: web links on one of the configured hosts, such as
 * {@code https://open.spotify.com/track/4uLU6hMCjMI75M1A2tKUQC}, and resource
 * URIs in the configured scheme, such as {@code spotify:album:1DFixLWuPkv3KT3TnV35m3}.
 * Anything else, including links missing an id, is not a match.
 */
public final class StreamingLinkMatcher {

    public static final List<String> RESOURCE_TYPES = List.of(
            "track", "album", "playlist", "artist", "episode", "show");

    private static final StreamingLinkMatcher NONE = new StreamingLinkMatcher(null, false, false);

    /**
     * One recognized link, with its offset in the scanned text.
     */
    public record StreamingLink(String provider, String resourceType, String resourceId, String url, int start) {
    }

    private final Pattern pattern;
    private final boolean webLinks;
    private final boolean resourceUris;

    private StreamingLinkMatcher(Pattern pattern, boolean webLinks, boolean resourceUris) {
        this.pattern = pattern;
        this.webLinks = webLinks;
        this.resourceUris = resourceUris;
    }

    public static StreamingLinkMatcher none() {
        return NONE;
    }

    /**
     * @param hosts     web hosts whose links are recognized
     * @param uriScheme scheme of resource URIs, or null/blank to skip URIs
     */
    public static StreamingLinkMatcher of(List<String> hosts, String uriScheme) {
        String types = String.join("|", RESOURCE_TYPES);
        List<String> alternatives = new ArrayList<>();
        boolean webLinks = hosts != null && !hosts.isEmpty();
        boolean resourceUris = uriScheme != null && !uriScheme.isBlank();
        if (webLinks) {
            String hostAlternation = hosts.stream().map(Pattern::quote).collect(Collectors.joining("|"));
            alternatives.add("https?://(?<host>(?i:" + hostAlternation + "))/(?:intl-[a-z]{2}/)?(?:embed/)?"
                    + "(?<type>" + types + ")/(?<id>[A-Za-z0-9]+)(?![A-Za-z0-9])(?:[/?#][^\\s<>]*)?");
        }
        if (resourceUris) {
            alternatives.add("(?<![\\w:])(?<scheme>(?i:" + Pattern.quote(uriScheme.trim()) + ")):"
                    + "(?<utype>" + types + "):(?<uid>[A-Za-z0-9]+)(?![A-Za-z0-9])");
        }
        if (alternatives.isEmpty()) {
            return NONE;
        }
        return new StreamingLinkMatcher(Pattern.compile(String.join("|", alternatives)), webLinks, resourceUris);
    }

    /**
     * All links in {@code text}, left to right.
     */
    public List<StreamingLink> find(String text) {
        if (pattern == null || text == null || text.isEmpty()) {
            return List.of();
        }
        List<StreamingLink> links = new ArrayList<>();
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            if (webLinks && m.group("host") != null) {
                links.add(new StreamingLink(m.group("host").toLowerCase(Locale.ROOT), m.group("type"),
                        m.group("id"), m.group(), m.start()));
            } else if (resourceUris && m.group("scheme") != null) {
                links.add(new StreamingLink(m.group("scheme").toLowerCase(Locale.ROOT), m.group("utype"),
                        m.group("uid"), m.group(), m.start()));
            }
        }
        return links;
    }
}
