package com.delta.scraper.scrape.model;

/**
 * @param maxPages {@code null} falls back to the configured default; zero or less means open-ended
 * @param urlTemplate used by {@link PaginationStrategy#PAGE_PARAMETER}, with a {@code {page}} placeholder
 */
public record PaginationSpec(
    PaginationStrategy strategy,
    String nextSelector,
    String urlTemplate,
    Integer startPage,
    Integer maxPages,
    Boolean stopOnNoNewRecords,
    Integer duplicateWindowSize,
    Double similarityThreshold
) {
    public static PaginationSpec none() {
        return new PaginationSpec(PaginationStrategy.NONE, null, null, null, 1, false, null, null);
    }

    public static PaginationSpec nextLink(String nextSelector, int maxPages) {
        return new PaginationSpec(PaginationStrategy.NEXT_LINK, nextSelector, null, null, maxPages, null, null, null);
    }

    public PaginationStrategy effectiveStrategy() {
        if (strategy != null) {
            return strategy;
        }
        if (nextSelector != null && !nextSelector.isBlank()) {
            return PaginationStrategy.NEXT_LINK;
        }
        if (urlTemplate != null && !urlTemplate.isBlank()) {
            return PaginationStrategy.PAGE_PARAMETER;
        }
        return PaginationStrategy.NONE;
    }

    public boolean isOpenEnded() {
        return maxPages != null && maxPages <= 0;
    }
}
