package com.delta.linktools.check.util;

import java.util.Locale;

/**
 * Canonical forms of URLs and hosts used to compare expected links with the links found on a page.
 * Parsing is lenient: malformed input never throws and at worst produces an empty host segment.
 */
public final class UrlNormalizer {
    private static final String HTTP_PREFIX = "http://";
    private static final String HTTPS_PREFIX = "https://";
    private static final String WWW_PREFIX = "www.";

    private UrlNormalizer() {
    }

    /**
     * Comparison key: {@code https://host/path?query} with the host stripped of {@code www.} and port,
     * the fragment dropped and one trailing slash removed from the path.
     */
    public static String normalize(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (!value.startsWith(HTTP_PREFIX) && !value.startsWith(HTTPS_PREFIX)) {
            value = HTTPS_PREFIX + value;
        }
        int hash = value.indexOf('#');
        if (hash >= 0) {
            value = value.substring(0, hash);
        }

        ParsedUrl parsed = parse(value);
        String host = stripWww(parsed.host());
        String path = parsed.path();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        StringBuilder key = new StringBuilder("https://").append(host).append(path);
        if (!parsed.query().isEmpty()) {
            key.append('?').append(parsed.query());
        }
        return key.toString();
    }

    /**
     * Lowercased host of an absolute URL without port and leading {@code www.}; empty when there is none.
     */
    public static String domainOf(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        String value = url.trim().toLowerCase(Locale.ROOT);
        int schemeEnd = value.indexOf("://");
        if (schemeEnd < 0) {
            if (!value.startsWith("//")) {
                return "";
            }
            value = "http:" + value;
        }
        int hash = value.indexOf('#');
        if (hash >= 0) {
            value = value.substring(0, hash);
        }
        return stripWww(parse(value).host());
    }

    /**
     * Scheme of an absolute URL in lower case, or an empty string for relative and opaque values.
     */
    public static String schemeOf(String url) {
        if (url == null) {
            return "";
        }
        String value = url.trim();
        int colon = value.indexOf(':');
        if (colon <= 0) {
            return "";
        }
        String scheme = value.substring(0, colon);
        for (int i = 0; i < scheme.length(); i++) {
            char c = scheme.charAt(i);
            boolean valid = Character.isLetterOrDigit(c) || c == '+' || c == '-' || c == '.';
            if (!valid || (i == 0 && !Character.isLetter(c))) {
                return "";
            }
        }
        return scheme.toLowerCase(Locale.ROOT);
    }

    public static boolean isHttpLike(String url) {
        String scheme = schemeOf(url);
        return "http".equals(scheme) || "https".equals(scheme);
    }

    /**
     * Cleans free-form domain input ({@code https://www.Example.com/}) into a bare host ({@code example.com}).
     */
    public static String toBareHost(String input) {
        if (input == null) {
            return "";
        }
        String value = input.trim().toLowerCase(Locale.ROOT)
            .replace(HTTPS_PREFIX, "")
            .replace(HTTP_PREFIX, "");
        value = stripWww(value);
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value.trim();
    }

    private static String stripWww(String host) {
        return host.startsWith(WWW_PREFIX) ? host.substring(WWW_PREFIX.length()) : host;
    }

    // Expects a lowercased "<scheme>://..." string without fragment.
    private static ParsedUrl parse(String value) {
        int schemeEnd = value.indexOf("://");
        String rest = schemeEnd < 0 ? value : value.substring(schemeEnd + 3);

        int authorityEnd = rest.length();
        for (int i = 0; i < rest.length(); i++) {
            char c = rest.charAt(i);
            if (c == '/' || c == '?') {
                authorityEnd = i;
                break;
            }
        }
        String authority = rest.substring(0, authorityEnd);
        String remainder = rest.substring(authorityEnd);

        String path = remainder;
        String query = "";
        int question = remainder.indexOf('?');
        if (question >= 0) {
            path = remainder.substring(0, question);
            query = remainder.substring(question + 1);
        }
        return new ParsedUrl(hostOf(authority), path, query);
    }

    private static String hostOf(String authority) {
        String hostPort = authority;
        int at = hostPort.lastIndexOf('@');
        if (at >= 0) {
            hostPort = hostPort.substring(at + 1);
        }
        if (hostPort.startsWith("[")) {
            int close = hostPort.indexOf(']');
            return close < 0 ? "" : hostPort.substring(1, close);
        }
        int colon = hostPort.indexOf(':');
        if (colon >= 0) {
            hostPort = hostPort.substring(0, colon);
        }
        return hostPort;
    }

    private record ParsedUrl(String host, String path, String query) {
    }
}
