package com.delta.scraper.scrape.api;

public record ProxyApiRequest(
    String endpoint,
    String testUrl
) {
}
