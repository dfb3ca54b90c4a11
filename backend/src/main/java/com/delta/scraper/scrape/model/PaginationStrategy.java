package com.delta.scraper.scrape.model;

public enum PaginationStrategy {
    NEXT_LINK,
    PAGE_PARAMETER,
    NONE
}
