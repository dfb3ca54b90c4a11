package com.delta.scraper.scrape.model;

import java.util.Map;

public record JobRequest(
    String name,
    String templateName,
    String targetUrl,
    Map<String, String> parameters
) {
    public JobRequest {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static JobRequest of(String templateName, String targetUrl) {
        return new JobRequest(null, templateName, targetUrl, Map.of());
    }
}
