package com.delta.scraper.scrape.model;

import java.time.Instant;

/**
 * Progress tuple handed to progress sinks after each page.
 *
 * @param percent fraction in [0, 1], or {@code null} when pagination is open-ended
 * @param estimatedTotalPages {@code null} when pagination is open-ended
 */
public record JobProgress(
    String jobId,
    int pagesDone,
    int itemsExtracted,
    int itemsFailed,
    JobStatus status,
    Double percent,
    Integer estimatedTotalPages,
    Instant updatedAt
) {
}
