package com.delta.scraper.scrape.model;

import java.time.Duration;

public record FetchMetadata(
    int statusCode,
    Duration latency,
    String proxyEndpoint,
    int attempts
) {
}
