package com.delta.scraper.scrape.model;

public enum ProxySelectionPolicy {
    ROUND_ROBIN,
    RANDOM,
    PERFORMANCE
}
