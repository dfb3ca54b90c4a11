package com.delta.scraper.scrape.model;

import java.time.Instant;

public record ProxyEntryView(
    String endpoint,
    ProxyState state,
    long successes,
    long failures,
    int consecutiveFailures,
    double successRate,
    double averageLatencyMs,
    int leases,
    Instant lastUsedAt,
    Instant deadline
) {
}
