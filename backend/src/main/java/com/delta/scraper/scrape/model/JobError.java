package com.delta.scraper.scrape.model;

import java.time.Instant;

public record JobError(
    Instant occurredAt,
    String url,
    String reasonCode,
    String message
) {
}
