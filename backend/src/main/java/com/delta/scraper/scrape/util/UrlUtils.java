package com.delta.scraper.scrape.util;

import org.jsoup.internal.StringUtil;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    public static boolean isHttpUrl(String candidate) {
        URI uri = safeUri(candidate);
        if (uri == null || uri.getHost() == null || uri.getHost().isBlank()) {
            return false;
        }
        String scheme = uri.getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    public static String hostOf(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return "";
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a proxy endpoint given as {@code host:port} or {@code http(s)://host:port}. Returns
     * {@code null} when the endpoint has no usable host or port.
     */
    public static URI proxyUri(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return null;
        }
        String value = endpoint.trim();
        if (!value.contains("://")) {
            value = "http://" + value;
        }
        URI uri = safeUri(value);
        if (uri == null || uri.getHost() == null || uri.getHost().isBlank() || uri.getPort() > 65535) {
            return null;
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            return null;
        }
        return uri;
    }

    /**
     * Resolves {@code href} against {@code base} the way a browser would, so query-only references
     * keep the base path. Returns {@code null} for blank, fragment-only or non-http(s) results such
     * as {@code javascript:} links.
     */
    public static String resolve(String base, String href) {
        if (href == null) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return null;
        }
        String resolved = StringUtil.resolve(base == null ? "" : base.trim(), trimmed.replace(" ", "%20"));
        return isHttpUrl(resolved) ? resolved : null;
    }
}
