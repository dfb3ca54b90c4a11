package com.delta.scraper.scrape.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public record RawDocument(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    Map<String, List<String>> headers,
    Instant fetchedAt,
    Duration latency
) {
    public RawDocument {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? "" : body;
        latency = latency == null ? Duration.ZERO : latency;
    }

    public static RawDocument of(String url, int statusCode, String body) {
        return new RawDocument(url, null, statusCode, body, Map.of(), Instant.now(), Duration.ZERO);
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public String header(String name) {
        if (name == null) {
            return null;
        }
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null
                && entry.getKey().toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))
                && entry.getValue() != null
                && !entry.getValue().isEmpty()) {
                return entry.getValue().get(0);
            }
        }
        return null;
    }
}
