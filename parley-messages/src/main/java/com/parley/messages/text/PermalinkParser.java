package com.parley.messages.text;

import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds permalinks to messages on this deployment.
 *
 * <p>
 * A permalink is an http(s) URL on the same origin as the site URL, under the
 * site's path, carrying the message id in a {@code msg} query parameter, e.g.
 * {@code https://chat.example.com/channel/general?msg=abc123}. Links to other
 * origins and malformed URLs are ignored.
 */
@Slf4j
public final class PermalinkParser {

    private static final Pattern URL_CANDIDATE = Pattern.compile("https?://[^\\s<>\"'`]+", Pattern.CASE_INSENSITIVE);
    private static final String TRAILING_PUNCTUATION = ".,;:!?)]}*_~";
    private static final PermalinkParser NONE = new PermalinkParser(null, -1, null, null);

    /**
     * A permalink found in text.
     *
     * @param roomSegment last path segment before the query (usually the room
     *                    name), may be empty
     */
    public record Permalink(String url, String roomSegment, String messageId, int start) {
    }

    private final String host;
    private final int port;
    private final String scheme;
    private final String pathPrefix;

    private PermalinkParser(String scheme, int port, String host, String pathPrefix) {
        this.scheme = scheme;
        this.port = port;
        this.host = host;
        this.pathPrefix = pathPrefix;
    }

    /**
     * Parser for permalinks under {@code siteUrl}. A blank or malformed site URL
     * yields a parser that finds nothing.
     */
    public static PermalinkParser forSiteUrl(String siteUrl) {
        if (siteUrl == null || siteUrl.isBlank()) {
            return NONE;
        }
        URI site;
        try {
            site = URI.create(siteUrl.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed site URL: {}", siteUrl);
            return NONE;
        }
        if (site.getScheme() == null || site.getHost() == null) {
            log.warn("Ignoring site URL without scheme or host: {}", siteUrl);
            return NONE;
        }
        String scheme = site.getScheme().toLowerCase(Locale.ROOT);
        String path = site.getPath() == null ? "" : site.getPath();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return new PermalinkParser(scheme, effectivePort(scheme, site.getPort()),
                site.getHost().toLowerCase(Locale.ROOT), path);
    }

    public boolean isEnabled() {
        return host != null;
    }

    /**
     * All permalinks in {@code text}, left to right.
     */
    public List<Permalink> find(String text) {
        if (host == null || text == null || text.isEmpty()) {
            return List.of();
        }
        List<Permalink> result = new ArrayList<>();
        Matcher m = URL_CANDIDATE.matcher(text);
        while (m.find()) {
            String url = stripTrailingPunctuation(m.group());
            Permalink permalink = parse(url, m.start());
            if (permalink != null) {
                result.add(permalink);
            }
        }
        return result;
    }

    private Permalink parse(String url, int start) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (Exception e) {
            log.debug("Skipping malformed link {}: {}", url, e.getMessage());
            return null;
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        String linkScheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals(linkScheme)
                || !host.equalsIgnoreCase(uri.getHost())
                || port != effectivePort(linkScheme, uri.getPort())) {
            return null;
        }
        String path = uri.getPath() == null ? "" : uri.getPath();
        if (!pathPrefix.isEmpty() && !(path.equals(pathPrefix) || path.startsWith(pathPrefix + "/"))) {
            return null;
        }
        String messageId = queryParam(uri.getRawQuery(), "msg");
        if (messageId == null || messageId.isBlank()) {
            return null;
        }
        String relative = path.substring(pathPrefix.length());
        int slash = relative.lastIndexOf('/');
        String roomSegment = slash >= 0 ? relative.substring(slash + 1) : relative;
        return new Permalink(url, roomSegment, messageId, start);
    }

    private static String queryParam(String rawQuery, String name) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return null;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq >= 0 ? pair.substring(0, eq) : pair;
            if (name.equals(key)) {
                String value = eq >= 0 ? pair.substring(eq + 1) : "";
                try {
                    return URLDecoder.decode(value, StandardCharsets.UTF_8);
                } catch (IllegalArgumentException e) {
                    return null;
                }
            }
        }
        return null;
    }

    private static int effectivePort(String scheme, int port) {
        if (port != -1) {
            return port;
        }
        return "https".equals(scheme) ? 443 : 80;
    }

    private static String stripTrailingPunctuation(String url) {
        int end = url.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
            end--;
        }
        return url.substring(0, end);
    }
}
