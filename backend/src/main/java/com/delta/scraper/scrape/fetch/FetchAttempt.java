package com.delta.scraper.scrape.fetch;

import com.delta.scraper.scrape.model.FetchMetadata;
import com.delta.scraper.scrape.model.FetchOutcome;
import com.delta.scraper.scrape.model.RawDocument;
import com.delta.scraper.scrape.proxy.ProxyEntry;

import java.time.Duration;

public record FetchAttempt(
    String url,
    ProxyEntry proxy,
    FetchOutcome outcome,
    int statusCode,
    Duration latency,
    RawDocument document,
    String errorMessage,
    int attemptNumber
) {
    public boolean isSuccess() {
        return outcome == FetchOutcome.SUCCESS;
    }

    public String proxyEndpoint() {
        return proxy == null ? null : proxy.endpoint();
    }

    public FetchMetadata metadata() {
        return new FetchMetadata(statusCode, latency, proxyEndpoint(), attemptNumber);
    }
}
