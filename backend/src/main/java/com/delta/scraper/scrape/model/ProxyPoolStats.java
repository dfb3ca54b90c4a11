package com.delta.scraper.scrape.model;

import java.util.List;

public record ProxyPoolStats(
    int total,
    int active,
    int coolingDown,
    int blacklisted,
    double successRate,
    List<ProxyEntryView> entries
) {
}
