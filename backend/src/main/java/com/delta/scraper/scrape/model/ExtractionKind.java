package com.delta.scraper.scrape.model;

public enum ExtractionKind {
    TEXT,
    ATTRIBUTE,
    COLLECTION,
    HTML
}
