package com.delta.scraper.scrape.fetch;

/**
 * Network-level failure reported by a {@link FetchCapability}: no HTTP response was received.
 */
public class NetworkFetchException extends Exception {
    public enum Kind {
        TIMEOUT,
        REFUSED,
        DNS_FAILURE,
        IO,
        INTERRUPTED
    }

    private final Kind kind;

    public NetworkFetchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public NetworkFetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
