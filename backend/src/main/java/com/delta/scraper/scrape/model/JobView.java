package com.delta.scraper.scrape.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record JobView(
    String id,
    String name,
    String templateName,
    String targetUrl,
    Map<String, String> parameters,
    JobStatus status,
    JobProgress progress,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String terminalReason,
    List<JobError> errors
) {
}
