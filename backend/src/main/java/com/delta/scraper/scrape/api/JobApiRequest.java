package com.delta.scraper.scrape.api;

import java.util.Map;

public record JobApiRequest(
    String name,
    String template,
    String targetUrl,
    Map<String, String> parameters,
    Boolean start
) {
}
