package com.delta.scraper.scrape.model;

/**
 * Outcome of one health-check request sent through a proxy. {@code healthy} means a non-defense 2xx/3xx answer.
 */
public record ProxyValidationResult(
    String endpoint,
    boolean healthy,
    FetchOutcome outcome,
    int statusCode,
    long latencyMs,
    ProxyState stateAfter
) {
}
