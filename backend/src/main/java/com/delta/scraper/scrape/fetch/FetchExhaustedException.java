package com.delta.scraper.scrape.fetch;

/**
 * A page could not be fetched within the retry budget, or failed with a non-retryable status.
 */
public class FetchExhaustedException extends RuntimeException {
    private final String reasonCode;
    private final String url;
    private final int attempts;
    private final int lastStatusCode;
    private final String lastProxy;

    public FetchExhaustedException(String reasonCode, String url, int attempts, int lastStatusCode, String lastProxy, String message) {
        super(message);
        this.reasonCode = reasonCode;
        this.url = url;
        this.attempts = attempts;
        this.lastStatusCode = lastStatusCode;
        this.lastProxy = lastProxy;
    }

    public String getReasonCode() {
        return reasonCode;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getLastStatusCode() {
        return lastStatusCode;
    }

    public String getLastProxy() {
        return lastProxy;
    }
}
